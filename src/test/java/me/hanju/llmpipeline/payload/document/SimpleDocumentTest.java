package me.hanju.llmpipeline.payload.document;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("SimpleDocument")
class SimpleDocumentTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  @DisplayName("점수가 없으면 null")
  void scoreIsOptional() {
    SimpleDocument doc = SimpleDocument.of("doc-1", "text");

    assertThat(doc.getScore()).isNull();
    assertThat(doc.getTitle()).isNull();
  }

  @Test
  @DisplayName("type 속성과 함께 직렬화하고 null 필드는 생략")
  void serialize() throws Exception {
    IDocument doc = SimpleDocument.builder().id("doc-1").text("Basics of Python.").score(0.5f).build();

    String json = objectMapper.writeValueAsString(doc);

    assertThat(json).contains("\"type\":\"document\"");
    assertThat(json).contains("\"id\":\"doc-1\"");
    assertThat(json).contains("\"score\":0.5");
    assertThat(json).doesNotContain("title");
  }

  @Test
  @DisplayName("type 속성이 없어도 IDocument로 역직렬화")
  void deserializeAsIDocument() throws Exception {
    String json = """
        {
          "id": "doc-7",
          "text": "Strategy Pattern in Depth.",
          "score": 0.8
        }
        """;

    IDocument doc = objectMapper.readValue(json, IDocument.class);

    assertThat(doc).isInstanceOf(SimpleDocument.class);
    assertThat(doc.getId()).isEqualTo("doc-7");
    assertThat(doc.getText()).isEqualTo("Strategy Pattern in Depth.");
    assertThat(doc.getScore()).isEqualTo(0.8f);
  }
}
