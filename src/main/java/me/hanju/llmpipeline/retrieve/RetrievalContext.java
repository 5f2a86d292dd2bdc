package me.hanju.llmpipeline.retrieve;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import lombok.extern.slf4j.Slf4j;
import me.hanju.llmpipeline.exception.PipelineTimeoutException;
import me.hanju.llmpipeline.exception.RetrievalException;
import me.hanju.llmpipeline.payload.document.IDocument;
import me.hanju.llmpipeline.spi.retrieve.RetrievalResult;
import me.hanju.llmpipeline.spi.retrieve.RetrievalStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 활성 검색 전략 하나를 보관하고 실행하는 컨텍스트 (예: 채팅 세션).
 *
 * <p>
 * {@link #retrieve(String)}는 호출 시점의 전략을 고정해서 사용하므로,
 * 검색 도중 {@link #setStrategy(RetrievalStrategy)}가 호출되어도 진행 중인 검색에는 영향이 없고
 * 다음 검색부터 새 전략이 적용됩니다.
 */
@Slf4j
public class RetrievalContext {

  static final String RETRIEVAL_STAGE = "retrieval";

  private final AtomicReference<RetrievalStrategy> strategy;

  public RetrievalContext(final RetrievalStrategy strategy) {
    this.strategy = new AtomicReference<>(Objects.requireNonNull(strategy, "strategy"));
  }

  /**
   * 활성 전략을 교체합니다.
   *
   * @param strategy 새 전략
   * @return 이전 전략
   */
  public RetrievalStrategy setStrategy(final RetrievalStrategy strategy) {
    Objects.requireNonNull(strategy, "strategy");
    final RetrievalStrategy previous = this.strategy.getAndSet(strategy);
    log.debug("[RETRIEVAL] Strategy switched | from={} | to={}", previous.getName(), strategy.getName());
    return previous;
  }

  public RetrievalStrategy getStrategy() {
    return strategy.get();
  }

  /**
   * 현재 활성 전략으로 문서를 검색합니다.
   *
   * @param query 사용자 질의
   * @return 검색 결과. 문서가 없으면 빈 목록을 담은 결과
   */
  public Mono<RetrievalResult> retrieve(final String query) {
    final RetrievalStrategy active = strategy.get();
    final String name = active.getName();

    return Flux.defer(() -> active.retrieve(query))
        .subscribeOn(Schedulers.boundedElastic())
        .collectList()
        .map(docs -> toResult(name, docs))
        .onErrorMap(e -> !(e instanceof RetrievalException),
            e -> new RetrievalException(name, "Retrieval failed in " + name + ": " + e.getMessage(), e))
        .doOnNext(result -> log.debug("[RETRIEVAL] Completed | strategy={} | documents={}",
            name, result.getDocuments().size()))
        .doOnError(e -> log.warn("[RETRIEVAL] Failed | strategy={} | error={}", name, e.getMessage()));
  }

  /**
   * 제한 시간을 두고 검색합니다. 시간을 넘기면 진행 중인 검색을 취소하고
   * {@link PipelineTimeoutException}으로 종료합니다.
   */
  public Mono<RetrievalResult> retrieve(final String query, final Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    return retrieve(query)
        .timeout(timeout)
        .onErrorMap(TimeoutException.class, e -> new PipelineTimeoutException(RETRIEVAL_STAGE, timeout, e));
  }

  private static RetrievalResult toResult(final String strategyName, final List<IDocument> documents) {
    return RetrievalResult.builder()
        .strategyName(strategyName)
        .documents(List.copyOf(documents))
        .build();
  }
}
