package me.hanju.llmpipeline.payload.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fasterxml.jackson.databind.ObjectMapper;

import me.hanju.llmpipeline.exception.InvalidRequestException;
import me.hanju.llmpipeline.payload.document.IDocument;
import me.hanju.llmpipeline.payload.document.SimpleDocument;

@DisplayName("CompletionRequest.Builder")
class CompletionRequestBuilderTest {

  @Nested
  @DisplayName("프롬프트 조립")
  class PromptAssembly {

    @Test
    @DisplayName("예시가 없으면 프롬프트를 그대로 사용")
    void noShotUsesPromptVerbatim() {
      CompletionRequest request = CompletionRequest.builder()
          .prompt("Q3")
          .build();

      assertThat(request.getPromptText()).isEqualTo("Q3");
    }

    @Test
    @DisplayName("few-shot 예시를 삽입 순서대로 합치고 마지막에 Output: 큐를 붙임")
    void fewShotFormatting() {
      CompletionRequest request = CompletionRequest.builder()
          .addExample("Q1", "A1")
          .addExample("Q2", "A2")
          .prompt("Q3")
          .build();

      assertThat(request.getPromptText())
          .isEqualTo("Input: Q1\nOutput: A1\n\nInput: Q2\nOutput: A2\n\nInput: Q3\nOutput:");
    }

    @Test
    @DisplayName("예시 개수와 무관하게 원본 프롬프트가 마지막 Input 뒤에 위치")
    void promptTextAlwaysCarriesRawPrompt() {
      for (int count = 0; count <= 3; count++) {
        CompletionRequest.Builder builder = CompletionRequest.builder().prompt("What is C++?");
        for (int i = 0; i < count; i++) {
          builder.addExample("q" + i, "a" + i);
        }

        String promptText = builder.build().getPromptText();

        if (count == 0) {
          assertThat(promptText).isEqualTo("What is C++?");
        } else {
          assertThat(promptText).endsWith("Input: What is C++?\nOutput:");
        }
      }
    }

    @Test
    @DisplayName("문서를 지정하면 포매터가 프롬프트 앞에 문서 블록을 붙임")
    void foldsDocumentsBeforePrompt() {
      CompletionRequest request = CompletionRequest.builder()
          .prompt("Explain design patterns.")
          .documents(List.of(SimpleDocument.of("d1", "Strategy Pattern in Depth.")))
          .build();

      assertThat(request.getPromptText()).isEqualTo(
          "<documents>\n"
              + "<document id=\"d1\">\n<content>Strategy Pattern in Depth.</content>\n</document>\n"
              + "</documents>\n\n"
              + "Explain design patterns.");
    }

    @Test
    @DisplayName("문서와 예시를 함께 쓰면 문서가 마지막 Input 안에 들어감")
    void documentsInsideFewShotCue() {
      CompletionRequest request = CompletionRequest.builder()
          .addExample("Q1", "A1")
          .prompt("Q2")
          .documents(List.of(SimpleDocument.of("d1", "ctx")))
          .documentFormatter((prompt, docs) -> "[" + docs.size() + " docs] " + prompt)
          .build();

      assertThat(request.getPromptText())
          .isEqualTo("Input: Q1\nOutput: A1\n\nInput: [1 docs] Q2\nOutput:");
    }

    @Test
    @DisplayName("빈 문서 목록은 포매터를 거치지 않음")
    void emptyDocumentsSkipFormatter() {
      CompletionRequest request = CompletionRequest.builder()
          .prompt("Q")
          .documents(List.of())
          .documentFormatter((prompt, docs) -> "formatted")
          .build();

      assertThat(request.getPromptText()).isEqualTo("Q");
    }
  }

  @Nested
  @DisplayName("값 설정")
  class Settings {

    @Test
    @DisplayName("기본값은 temperature 1.0, maxTokens 100")
    void defaults() {
      CompletionRequest request = CompletionRequest.builder().prompt("p").build();

      assertThat(request.getTemperature()).isEqualTo(1.0);
      assertThat(request.getMaxTokens()).isEqualTo(100);
    }

    @Test
    @DisplayName("스칼라 값은 마지막 설정이 적용됨")
    void lastWriteWins() {
      CompletionRequest request = CompletionRequest.builder()
          .prompt("first")
          .prompt("second")
          .temperature(0.2)
          .temperature(0.7)
          .maxTokens(10)
          .maxTokens(50)
          .build();

      assertThat(request.getPromptText()).isEqualTo("second");
      assertThat(request.getTemperature()).isEqualTo(0.7);
      assertThat(request.getMaxTokens()).isEqualTo(50);
    }

    @Test
    @DisplayName("경계값 0과 2는 허용")
    void temperatureBoundsAreInclusive() {
      assertThat(CompletionRequest.builder().prompt("p").temperature(0.0).build().getTemperature()).isZero();
      assertThat(CompletionRequest.builder().prompt("p").temperature(2.0).build().getTemperature()).isEqualTo(2.0);
    }
  }

  @Nested
  @DisplayName("검증")
  class Validation {

    @Test
    @DisplayName("프롬프트를 설정하지 않으면 실패")
    void missingPrompt() {
      assertThatThrownBy(() -> CompletionRequest.builder().build())
          .isInstanceOf(InvalidRequestException.class)
          .hasMessageContaining("prompt");
    }

    @Test
    @DisplayName("빈 문자열 프롬프트는 설정하지 않은 것으로 간주")
    void emptyPrompt() {
      assertThatThrownBy(() -> CompletionRequest.builder().prompt("").build())
          .isInstanceOf(InvalidRequestException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = { -0.1, 2.01, Double.NaN, Double.POSITIVE_INFINITY })
    @DisplayName("temperature 범위 밖이면 실패")
    void temperatureOutOfRange(double temperature) {
      assertThatThrownBy(() -> CompletionRequest.builder().prompt("p").temperature(temperature).build())
          .isInstanceOf(InvalidRequestException.class)
          .hasMessageContaining("temperature");
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1 })
    @DisplayName("maxTokens가 양수가 아니면 실패")
    void nonPositiveMaxTokens(int maxTokens) {
      assertThatThrownBy(() -> CompletionRequest.builder().prompt("p").maxTokens(maxTokens).build())
          .isInstanceOf(InvalidRequestException.class)
          .hasMessageContaining("maxTokens");
    }
  }

  @Nested
  @DisplayName("재사용")
  class Reuse {

    @Test
    @DisplayName("변경 없이 두 번 build하면 같은 값의 요청")
    void buildIsIdempotent() {
      CompletionRequest.Builder builder = CompletionRequest.builder()
          .addExample("What is Python?", "Python is a programming language.")
          .prompt("What is Java?")
          .temperature(0.7)
          .maxTokens(50);

      CompletionRequest first = builder.build();
      CompletionRequest second = builder.build();

      assertThat(first).isNotSameAs(second);
      assertThat(first).isEqualTo(second);
      assertThat(first.hashCode()).isEqualTo(second.hashCode());
    }

    @Test
    @DisplayName("build 이후 예시를 추가해도 이전 요청은 바뀌지 않음")
    void laterExamplesDoNotAlterBuiltRequest() {
      CompletionRequest.Builder builder = CompletionRequest.builder().prompt("Q");
      CompletionRequest before = builder.build();

      builder.addExample("X", "Y");
      CompletionRequest after = builder.build();

      assertThat(before.getPromptText()).isEqualTo("Q");
      assertThat(after.getPromptText()).isEqualTo("Input: X\nOutput: Y\n\nInput: Q\nOutput:");
    }

    @Test
    @DisplayName("전달한 문서 목록을 나중에 바꿔도 빌더에는 반영되지 않음")
    void documentsAreSnapshotted() {
      List<IDocument> docs = new ArrayList<>();
      docs.add(SimpleDocument.of("d1", "first"));
      CompletionRequest.Builder builder = CompletionRequest.builder()
          .prompt("Q")
          .documentFormatter((prompt, attached) -> attached.size() + ":" + prompt);

      builder.documents(docs);
      docs.add(SimpleDocument.of("d2", "second"));

      assertThat(builder.build().getPromptText()).isEqualTo("1:Q");
    }
  }

  @Nested
  @DisplayName("JSON 직렬화")
  class JsonSerialization {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("snake_case 필드명으로 직렬화")
    void serialize() throws Exception {
      CompletionRequest request = CompletionRequest.builder()
          .prompt("What is the capital of France?")
          .maxTokens(20)
          .build();

      String json = objectMapper.writeValueAsString(request);

      assertThat(json).contains("\"prompt_text\":\"What is the capital of France?\"");
      assertThat(json).contains("\"max_tokens\":20");
      assertThat(json).contains("\"temperature\":1.0");
    }

    @Test
    @DisplayName("JSON에서 역직렬화")
    void deserialize() throws Exception {
      String json = """
          {
            "prompt_text": "Hello",
            "temperature": 0.5,
            "max_tokens": 64
          }
          """;

      CompletionRequest request = objectMapper.readValue(json, CompletionRequest.class);

      assertThat(request.getPromptText()).isEqualTo("Hello");
      assertThat(request.getTemperature()).isEqualTo(0.5);
      assertThat(request.getMaxTokens()).isEqualTo(64);
    }
  }
}
