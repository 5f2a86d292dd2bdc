package me.hanju.llmpipeline.exception;

/**
 * 등록되지 않은 모델 ID로 호출한 경우.
 */
public class UnknownModelException extends PipelineException {

  private final String modelId;

  public UnknownModelException(final String modelId) {
    super("No backend registered for model: " + modelId);
    this.modelId = modelId;
  }

  public String getModelId() {
    return modelId;
  }
}
