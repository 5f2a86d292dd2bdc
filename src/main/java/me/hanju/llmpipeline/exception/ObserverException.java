package me.hanju.llmpipeline.exception;

import me.hanju.llmpipeline.notify.ObserverHandle;

/**
 * 구독자가 이벤트 처리 중 실패한 경우.
 * 던져지지 않고 {@link me.hanju.llmpipeline.notify.PublishOutcome}에 기록됩니다.
 */
public class ObserverException extends PipelineException {

  private final transient ObserverHandle handle;

  public ObserverException(final ObserverHandle handle, final Throwable cause) {
    super("Observer " + handle + " failed: " + cause.getMessage(), cause);
    this.handle = handle;
  }

  public ObserverHandle getHandle() {
    return handle;
  }
}
