package me.hanju.llmpipeline.exception;

/**
 * 요청 값 검증 실패. 항상 build 시점에 발생하며 dispatch 단계까지 전달되지 않습니다.
 */
public class InvalidRequestException extends PipelineException {

  public InvalidRequestException(final String message) {
    super(message);
  }
}
