package me.hanju.llmpipeline.exception;

/**
 * 파이프라인에서 발생하는 모든 예외의 최상위 타입.
 */
public class PipelineException extends RuntimeException {

  public PipelineException(final String message) {
    super(message);
  }

  public PipelineException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
