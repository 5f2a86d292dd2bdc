package me.hanju.llmpipeline.exception;

/**
 * 이미 등록된 모델 ID로 다시 등록을 시도한 경우.
 */
public class DuplicateModelException extends PipelineException {

  private final String modelId;

  public DuplicateModelException(final String modelId) {
    super("Model already registered: " + modelId);
    this.modelId = modelId;
  }

  public String getModelId() {
    return modelId;
  }
}
