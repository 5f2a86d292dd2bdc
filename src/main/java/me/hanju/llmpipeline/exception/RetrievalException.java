package me.hanju.llmpipeline.exception;

/**
 * 검색 전략이 문서를 가져오지 못한 경우.
 */
public class RetrievalException extends PipelineException {

  private final String strategyName;

  public RetrievalException(final String strategyName, final String message) {
    super(message);
    this.strategyName = strategyName;
  }

  public RetrievalException(final String strategyName, final String message, final Throwable cause) {
    super(message, cause);
    this.strategyName = strategyName;
  }

  /**
   * 실패한 전략의 이름. 알 수 없으면 null.
   */
  public String getStrategyName() {
    return strategyName;
  }
}
