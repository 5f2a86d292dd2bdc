package me.hanju.llmpipeline.exception;

/**
 * 백엔드 호출이 실패한 경우.
 * 백엔드가 던진 원본 예외는 {@link #getCause()}로 확인할 수 있습니다.
 */
public class BackendException extends PipelineException {

  private final String modelId;

  public BackendException(final String modelId, final String message) {
    super(message);
    this.modelId = modelId;
  }

  public BackendException(final String modelId, final String message, final Throwable cause) {
    super(message, cause);
    this.modelId = modelId;
  }

  public String getModelId() {
    return modelId;
  }
}
