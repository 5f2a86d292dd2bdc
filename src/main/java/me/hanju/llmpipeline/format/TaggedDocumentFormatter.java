package me.hanju.llmpipeline.format;

import java.util.List;

import me.hanju.llmpipeline.payload.document.IDocument;
import me.hanju.llmpipeline.spi.format.DocumentFormatter;

/**
 * 문서를 {@code <documents>} 태그 블록으로 직렬화해 프롬프트 앞에 붙이는 기본 포매터.
 */
public class TaggedDocumentFormatter implements DocumentFormatter {

  public static final TaggedDocumentFormatter INSTANCE = new TaggedDocumentFormatter();

  @Override
  public String format(final String prompt, final List<? extends IDocument> documents) {
    final String documentsText = serializeDocuments(documents);
    if (documentsText.isEmpty()) {
      return prompt;
    }
    return documentsText + "\n\n" + prompt;
  }

  public String serializeDocuments(final List<? extends IDocument> documents) {
    if (documents == null || documents.isEmpty()) {
      return "";
    }
    final StringBuilder sb = new StringBuilder();
    sb.append("<documents>\n");
    for (final IDocument doc : documents) {
      sb.append(doc.toSerializedPrompt()).append("\n");
    }
    sb.append("</documents>");
    return sb.toString();
  }
}
