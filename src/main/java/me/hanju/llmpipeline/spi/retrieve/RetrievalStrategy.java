package me.hanju.llmpipeline.spi.retrieve;

import me.hanju.llmpipeline.payload.document.IDocument;
import reactor.core.publisher.Flux;

/**
 * 질의에 대한 컨텍스트 문서를 찾는 검색 전략 인터페이스.
 * 구현체는 {@link me.hanju.llmpipeline.retrieve.RetrievalContext}에서 실행 중에 교체될 수 있습니다.
 */
public interface RetrievalStrategy {

  /**
   * 전략 이름을 반환합니다.
   *
   * @return 전략 이름
   */
  String getName();

  /**
   * 질의와 관련된 문서를 관련도 높은 순으로 emit하고 complete됩니다.
   * 같은 질의와 같은 상태에서는 같은 결과를 내야 하며, 결과가 없으면 빈 스트림을 반환합니다.
   * 검색 자체가 불가능하면 에러로 종료합니다.
   *
   * @param query 사용자 질의
   * @return 문서 스트림
   */
  Flux<IDocument> retrieve(String query);
}
