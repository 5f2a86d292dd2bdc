package me.hanju.llmpipeline.retrieve;

import java.util.ArrayList;
import java.util.List;

import me.hanju.llmpipeline.payload.document.IDocument;
import me.hanju.llmpipeline.spi.retrieve.RetrievalStrategy;
import reactor.core.publisher.Flux;

/**
 * 여러 전략을 차례로 실행하고 결과를 병합하는 전략.
 * 앞선 전략의 문서가 먼저 오며, ID가 같은 문서는 처음 나온 것만 남깁니다.
 */
public class CompositeRetrievalStrategy implements RetrievalStrategy {

  private final String name;
  private final List<RetrievalStrategy> strategies;
  private final int maxTotalDocuments;

  /**
   * CompositeRetrievalStrategy를 생성합니다.
   *
   * @param name              전략 이름
   * @param strategies        조합할 전략 목록
   * @param maxTotalDocuments 최대 총 문서 수
   */
  public CompositeRetrievalStrategy(
      final String name,
      final List<RetrievalStrategy> strategies,
      final int maxTotalDocuments) {
    if (maxTotalDocuments <= 0) {
      throw new IllegalArgumentException("maxTotalDocuments must be positive: " + maxTotalDocuments);
    }
    this.name = name;
    this.strategies = List.copyOf(strategies);
    this.maxTotalDocuments = maxTotalDocuments;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public Flux<IDocument> retrieve(final String query) {
    // 전략 순서 유지
    return Flux.fromIterable(strategies)
        .concatMap(strategy -> strategy.retrieve(query))
        .distinct(IDocument::getId)
        .take(maxTotalDocuments);
  }

  /**
   * 조합된 전략 수를 반환합니다.
   */
  public int getStrategyCount() {
    return strategies.size();
  }

  /**
   * Builder를 반환합니다.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * CompositeRetrievalStrategy Builder.
   */
  public static class Builder {
    private String name = "composite-retrieval";
    private final List<RetrievalStrategy> strategies = new ArrayList<>();
    private int maxTotalDocuments = 10;

    public Builder name(final String name) {
      this.name = name;
      return this;
    }

    public Builder addStrategy(final RetrievalStrategy strategy) {
      this.strategies.add(strategy);
      return this;
    }

    public Builder strategies(final List<RetrievalStrategy> strategies) {
      this.strategies.clear();
      this.strategies.addAll(strategies);
      return this;
    }

    public Builder maxTotalDocuments(final int maxTotalDocuments) {
      this.maxTotalDocuments = maxTotalDocuments;
      return this;
    }

    public CompositeRetrievalStrategy build() {
      return new CompositeRetrievalStrategy(name, strategies, maxTotalDocuments);
    }
  }
}
