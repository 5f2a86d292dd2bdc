package me.hanju.llmpipeline.exception;

import java.time.Duration;

/**
 * 검색 또는 백엔드 호출이 제한 시간 안에 끝나지 않은 경우.
 */
public class PipelineTimeoutException extends PipelineException {

  private final String stage;
  private final Duration timeout;

  public PipelineTimeoutException(final String stage, final Duration timeout, final Throwable cause) {
    super(stage + " did not complete within " + timeout.toMillis() + "ms", cause);
    this.stage = stage;
    this.timeout = timeout;
  }

  /**
   * 시간 초과가 발생한 단계 (예: "retrieval", "invocation").
   */
  public String getStage() {
    return stage;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
