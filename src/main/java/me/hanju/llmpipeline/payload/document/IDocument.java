package me.hanju.llmpipeline.payload.document;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 검색 결과로 얻은 컨텍스트 문서 인터페이스.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type", defaultImpl = SimpleDocument.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = SimpleDocument.class, name = "document")
})
public interface IDocument {

  String getId();

  String getText();

  /**
   * 관련도 점수. 전략이 점수를 매기지 않으면 null.
   */
  default Float getScore() {
    return null;
  }

  default String getTitle() {
    return null;
  }

  default String toSerializedPrompt() {
    final StringBuilder sb = new StringBuilder();
    sb.append("<document id=\"").append(getId()).append("\">\n");
    if (getTitle() != null && !getTitle().isBlank()) {
      sb.append("<title>").append(getTitle()).append("</title>\n");
    }
    sb.append("<content>").append(getText()).append("</content>\n");
    sb.append("</document>");
    return sb.toString();
  }
}
