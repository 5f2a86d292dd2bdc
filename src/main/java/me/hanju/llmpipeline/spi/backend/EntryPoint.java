package me.hanju.llmpipeline.spi.backend;

/**
 * 백엔드 인스턴스의 생성 호출을 가리키는 함수 참조.
 * 예: {@code OpenAiModel::query}, {@code HuggingFaceModel::generate}
 *
 * <p>
 * 반환값은 문자열, {@link me.hanju.llmpipeline.payload.result.CompletionResult}
 * 또는 백엔드 고유의 응답 객체일 수 있습니다.
 *
 * @param <B> 백엔드 타입
 */
@FunctionalInterface
public interface EntryPoint<B> {

  Object call(B backend, String prompt) throws Exception;
}
