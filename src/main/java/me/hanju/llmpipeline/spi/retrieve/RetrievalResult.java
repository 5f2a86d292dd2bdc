package me.hanju.llmpipeline.spi.retrieve;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import me.hanju.llmpipeline.payload.document.IDocument;

/**
 * 한 번의 검색 결과. 어떤 전략이 문서를 찾았는지 함께 담습니다.
 */
@Builder
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public class RetrievalResult {

  @JsonProperty("strategy_name")
  private String strategyName;

  @Builder.Default
  private List<IDocument> documents = new ArrayList<>();

  @JsonIgnore
  public boolean isEmpty() {
    return documents == null || documents.isEmpty();
  }
}
