package me.hanju.llmpipeline.payload.request;

import java.util.Objects;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Few-shot 프롬프트에 들어가는 입력/출력 예시 한 쌍.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PACKAGE)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public class Example {
  private String input;
  private String output;

  public static Example of(final String input, final String output) {
    return new Example(
        Objects.requireNonNull(input, "input"),
        Objects.requireNonNull(output, "output"));
  }

  String toPromptBlock() {
    return "Input: " + input + "\nOutput: " + output;
  }
}
