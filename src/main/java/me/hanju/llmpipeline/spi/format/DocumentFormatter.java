package me.hanju.llmpipeline.spi.format;

import java.util.List;

import me.hanju.llmpipeline.payload.document.IDocument;

/**
 * 검색된 문서를 프롬프트에 합치는 정책.
 */
@FunctionalInterface
public interface DocumentFormatter {

  /**
   * 문서를 프롬프트에 합친 결과를 반환합니다.
   *
   * @param prompt    사용자 프롬프트 (비어 있지 않음)
   * @param documents 관련도 순으로 정렬된 문서 목록
   * @return 모델에 전달할 프롬프트 본문
   */
  String format(String prompt, List<? extends IDocument> documents);
}
