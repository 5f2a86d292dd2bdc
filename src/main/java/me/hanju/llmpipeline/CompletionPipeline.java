package me.hanju.llmpipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;
import me.hanju.llmpipeline.adapter.AdapterRegistry;
import me.hanju.llmpipeline.exception.InvalidRequestException;
import me.hanju.llmpipeline.format.TaggedDocumentFormatter;
import me.hanju.llmpipeline.notify.Notifier;
import me.hanju.llmpipeline.notify.PublishOutcome;
import me.hanju.llmpipeline.payload.request.CompletionRequest;
import me.hanju.llmpipeline.payload.request.Example;
import me.hanju.llmpipeline.payload.result.CompletionResult;
import me.hanju.llmpipeline.retrieve.RetrievalContext;
import me.hanju.llmpipeline.spi.format.DocumentFormatter;
import me.hanju.llmpipeline.spi.retrieve.RetrievalResult;
import reactor.core.publisher.Mono;

/**
 * 검색 → 요청 조립 → 백엔드 호출 → 결과 발행 순서로 요청을 처리하는 파이프라인.
 *
 * <p>
 * 하나의 인스턴스를 여러 스레드에서 동시에 사용할 수 있습니다.
 * 검색이나 백엔드 호출이 실패하면 아무것도 발행하지 않고 요청을 중단합니다.
 */
@Slf4j
public class CompletionPipeline {

  private final AdapterRegistry adapterRegistry;
  private final RetrievalContext retrievalContext;
  private final Notifier<CompletionResult> notifier;
  private final PipelineProperties properties;
  private final DocumentFormatter documentFormatter;
  private final List<Example> examples;

  public CompletionPipeline(
      final AdapterRegistry adapterRegistry,
      final RetrievalContext retrievalContext,
      final Notifier<CompletionResult> notifier,
      final PipelineProperties properties,
      final DocumentFormatter documentFormatter,
      final List<Example> examples) {
    this.adapterRegistry = Objects.requireNonNull(adapterRegistry, "adapterRegistry");
    this.retrievalContext = Objects.requireNonNull(retrievalContext, "retrievalContext");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.documentFormatter = Objects.requireNonNull(documentFormatter, "documentFormatter");
    this.examples = List.copyOf(examples);
  }

  /**
   * 질의를 처리하고 결과를 반환합니다 (blocking).
   * 구독자 실패는 호출자에게 전달되지 않습니다.
   *
   * @param query   사용자 질의
   * @param modelId 호출할 모델 ID
   * @return 백엔드 응답
   */
  public CompletionResult handle(final String query, final String modelId) {
    return execute(query, modelId).getResult();
  }

  /**
   * 질의를 처리하고 실행 기록 전체를 반환합니다 (blocking).
   */
  public PipelineOutcome execute(final String query, final String modelId) {
    return executeAsync(query, modelId).block();
  }

  /**
   * 질의를 비동기로 처리합니다.
   * 구독을 dispose하면 진행 중인 검색/호출이 취소되고 결과는 발행되지 않습니다.
   *
   * @param query   사용자 질의
   * @param modelId 호출할 모델 ID
   * @return 실행 기록
   */
  public Mono<PipelineOutcome> executeAsync(final String query, final String modelId) {
    if (query == null || query.isBlank()) {
      return Mono.error(new InvalidRequestException("query must not be blank"));
    }
    Objects.requireNonNull(modelId, "modelId");

    return retrievalContext.retrieve(query, properties.getRetrievalTimeout())
        .flatMap(retrieval -> {
          final CompletionRequest request = buildRequest(query, retrieval);
          return adapterRegistry.invokeAsync(modelId, request.getPromptText(), properties.getInvocationTimeout())
              .map(result -> publish(query, modelId, retrieval, request, result));
        })
        .doOnError(e -> log.warn("[PIPELINE] Request aborted | modelId={} | error={}", modelId, e.getMessage()));
  }

  private CompletionRequest buildRequest(final String query, final RetrievalResult retrieval) {
    return CompletionRequest.builder()
        .prompt(query)
        .temperature(properties.getDefaultTemperature())
        .maxTokens(properties.getDefaultMaxTokens())
        .examples(examples)
        .documents(retrieval.getDocuments())
        .documentFormatter(documentFormatter)
        .build();
  }

  private PipelineOutcome publish(
      final String query,
      final String modelId,
      final RetrievalResult retrieval,
      final CompletionRequest request,
      final CompletionResult result) {

    final PublishOutcome publishOutcome = notifier.publish(result);
    if (publishOutcome.hasFailures()) {
      log.warn("[PIPELINE] Observers failed | modelId={} | failed={} | delivered={}",
          modelId, publishOutcome.getFailures().size(), publishOutcome.getDeliveredCount());
    }
    log.debug("[PIPELINE] Request completed | modelId={} | strategy={} | documents={}",
        modelId, retrieval.getStrategyName(), retrieval.getDocuments().size());

    return PipelineOutcome.builder()
        .query(query)
        .modelId(modelId)
        .retrieval(retrieval)
        .request(request)
        .result(result)
        .publishOutcome(publishOutcome)
        .build();
  }

  public AdapterRegistry getAdapterRegistry() {
    return adapterRegistry;
  }

  public RetrievalContext getRetrievalContext() {
    return retrievalContext;
  }

  public Notifier<CompletionResult> getNotifier() {
    return notifier;
  }

  /**
   * Builder를 반환합니다.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * CompletionPipeline Builder.
   */
  public static class Builder {
    private AdapterRegistry adapterRegistry;
    private RetrievalContext retrievalContext;
    private Notifier<CompletionResult> notifier = new Notifier<>();
    private PipelineProperties properties = new PipelineProperties();
    private DocumentFormatter documentFormatter = TaggedDocumentFormatter.INSTANCE;
    private final List<Example> examples = new ArrayList<>();

    public Builder adapterRegistry(final AdapterRegistry adapterRegistry) {
      this.adapterRegistry = adapterRegistry;
      return this;
    }

    public Builder retrievalContext(final RetrievalContext retrievalContext) {
      this.retrievalContext = retrievalContext;
      return this;
    }

    public Builder notifier(final Notifier<CompletionResult> notifier) {
      this.notifier = notifier;
      return this;
    }

    public Builder properties(final PipelineProperties properties) {
      this.properties = properties;
      return this;
    }

    public Builder documentFormatter(final DocumentFormatter documentFormatter) {
      this.documentFormatter = documentFormatter;
      return this;
    }

    public Builder addExample(final String input, final String output) {
      this.examples.add(Example.of(input, output));
      return this;
    }

    public Builder examples(final List<Example> examples) {
      this.examples.clear();
      this.examples.addAll(examples);
      return this;
    }

    public CompletionPipeline build() {
      return new CompletionPipeline(
          adapterRegistry, retrievalContext, notifier, properties, documentFormatter, examples);
    }
  }
}
