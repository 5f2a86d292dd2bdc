package me.hanju.llmpipeline;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import me.hanju.llmpipeline.notify.PublishOutcome;
import me.hanju.llmpipeline.payload.request.CompletionRequest;
import me.hanju.llmpipeline.payload.result.CompletionResult;
import me.hanju.llmpipeline.spi.retrieve.RetrievalResult;

/**
 * 파이프라인 한 번 실행의 전체 기록.
 * 구독자 실패는 {@link #getPublishOutcome()}에서만 확인할 수 있습니다.
 */
@Builder
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@ToString
public class PipelineOutcome {
  private final String query;
  private final String modelId;
  private final RetrievalResult retrieval;
  private final CompletionRequest request;
  private final CompletionResult result;
  private final PublishOutcome publishOutcome;
}
