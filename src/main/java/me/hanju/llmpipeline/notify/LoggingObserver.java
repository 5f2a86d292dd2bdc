package me.hanju.llmpipeline.notify;

import lombok.extern.slf4j.Slf4j;
import me.hanju.llmpipeline.payload.result.CompletionResult;
import me.hanju.llmpipeline.spi.notify.EventObserver;

/**
 * 발행된 결과를 로그로 남기는 구독자.
 */
@Slf4j
public class LoggingObserver implements EventObserver<CompletionResult> {

  private static final int PREVIEW_LENGTH = 200;

  @Override
  public void onEvent(final CompletionResult result) {
    log.info("[RESULT] modelId={} | textLength={} | preview={}",
        result.getModelId(), length(result.getText()), preview(result.getText()));
  }

  private static int length(final String text) {
    return text == null ? 0 : text.length();
  }

  private static String preview(final String text) {
    if (text == null || text.length() <= PREVIEW_LENGTH) {
      return text;
    }
    return text.substring(0, PREVIEW_LENGTH) + "...";
  }
}
