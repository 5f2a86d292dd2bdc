package me.hanju.llmpipeline.payload.request;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import me.hanju.llmpipeline.exception.InvalidRequestException;
import me.hanju.llmpipeline.format.TaggedDocumentFormatter;
import me.hanju.llmpipeline.payload.document.IDocument;
import me.hanju.llmpipeline.spi.format.DocumentFormatter;

/**
 * 백엔드로 전달되는 완성된 요청. {@link Builder}로만 생성되며 이후 변경되지 않습니다.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompletionRequest {

  public static final double MIN_TEMPERATURE = 0.0;
  public static final double MAX_TEMPERATURE = 2.0;
  public static final double DEFAULT_TEMPERATURE = 1.0;
  public static final int DEFAULT_MAX_TOKENS = 100;

  @JsonProperty("prompt_text")
  private String promptText;

  private double temperature;

  @JsonProperty("max_tokens")
  private int maxTokens;

  private CompletionRequest(final String promptText, final double temperature, final int maxTokens) {
    this.promptText = promptText;
    this.temperature = temperature;
    this.maxTokens = maxTokens;
  }

  /**
   * Builder를 반환합니다.
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * CompletionRequest Builder.
   * build()는 상태를 초기화하지 않으므로 같은 설정으로 여러 번 호출할 수 있습니다.
   */
  public static class Builder {
    private String prompt;
    private double temperature = DEFAULT_TEMPERATURE;
    private int maxTokens = DEFAULT_MAX_TOKENS;
    private final List<Example> examples = new ArrayList<>();
    private List<IDocument> documents = List.of();
    private DocumentFormatter documentFormatter = TaggedDocumentFormatter.INSTANCE;

    public Builder prompt(final String prompt) {
      this.prompt = prompt;
      return this;
    }

    public Builder temperature(final double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder maxTokens(final int maxTokens) {
      this.maxTokens = maxTokens;
      return this;
    }

    public Builder addExample(final String input, final String output) {
      this.examples.add(Example.of(input, output));
      return this;
    }

    public Builder addExample(final Example example) {
      this.examples.add(Objects.requireNonNull(example, "example"));
      return this;
    }

    public Builder examples(final List<Example> examples) {
      for (final Example example : examples) {
        addExample(example);
      }
      return this;
    }

    /**
     * 프롬프트에 합칠 문서를 지정합니다. 전달된 목록의 사본이 저장됩니다.
     */
    public Builder documents(final List<? extends IDocument> documents) {
      this.documents = documents == null ? List.of() : List.copyOf(documents);
      return this;
    }

    public Builder documentFormatter(final DocumentFormatter documentFormatter) {
      this.documentFormatter = Objects.requireNonNull(documentFormatter, "documentFormatter");
      return this;
    }

    public CompletionRequest build() {
      validate();

      final String body = documents.isEmpty() ? prompt : documentFormatter.format(prompt, documents);
      final String promptText;
      if (examples.isEmpty()) {
        promptText = body;
      } else {
        final String exampleText = examples.stream()
            .map(Example::toPromptBlock)
            .collect(Collectors.joining("\n\n"));
        promptText = exampleText + "\n\nInput: " + body + "\nOutput:";
      }

      return new CompletionRequest(promptText, temperature, maxTokens);
    }

    private void validate() {
      if (prompt == null || prompt.isEmpty()) {
        throw new InvalidRequestException("prompt must be set");
      }
      if (Double.isNaN(temperature) || temperature < MIN_TEMPERATURE || temperature > MAX_TEMPERATURE) {
        throw new InvalidRequestException(
            "temperature must be within [" + MIN_TEMPERATURE + ", " + MAX_TEMPERATURE + "]: " + temperature);
      }
      if (maxTokens <= 0) {
        throw new InvalidRequestException("maxTokens must be positive: " + maxTokens);
      }
    }
  }
}
