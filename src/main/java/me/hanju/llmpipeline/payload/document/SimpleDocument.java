package me.hanju.llmpipeline.payload.document;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 기본 문서 구현체. 생성 후에는 변경할 수 없습니다.
 */
@Builder
@Getter
@NoArgsConstructor(access = AccessLevel.PACKAGE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SimpleDocument implements IDocument {
  private String id;
  private String title;
  private String text;
  private Float score;

  public static SimpleDocument of(final String id, final String text) {
    return SimpleDocument.builder()
        .id(id)
        .text(text)
        .build();
  }
}
