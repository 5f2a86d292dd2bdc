package me.hanju.llmpipeline.spi.backend;

/**
 * 프롬프트로부터 텍스트를 생성할 수 있는 백엔드.
 * 이 인터페이스를 직접 구현하지 않은 백엔드는 {@link EntryPoint}로 등록합니다.
 */
@FunctionalInterface
public interface GenerationBackend {

  /**
   * @param prompt 프롬프트 텍스트
   * @return 생성된 텍스트
   * @throws Exception 백엔드 호출 실패 시
   */
  String generate(String prompt) throws Exception;
}
