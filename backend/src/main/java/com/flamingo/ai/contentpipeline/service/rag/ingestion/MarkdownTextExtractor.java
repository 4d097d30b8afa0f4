package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import java.util.Locale;
import java.util.Set;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.text.TextContentRenderer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link DocumentTextExtractor} for Markdown files. Renders the commonmark AST to plain text so
 * markup characters do not end up in chunks and embeddings.
 */
@Component
@Order(10)
public class MarkdownTextExtractor implements DocumentTextExtractor {

  private static final Set<String> SUPPORTED_TYPES =
      Set.of("text/markdown", "text/x-markdown", "text/x-web-markdown");

  private static final Parser PARSER = Parser.builder().build();
  private static final TextContentRenderer TEXT_RENDERER = TextContentRenderer.builder().build();

  @Override
  public boolean supports(String mimeType) {
    return mimeType != null && SUPPORTED_TYPES.contains(mimeType.toLowerCase(Locale.ROOT));
  }

  @Override
  public String extract(byte[] content, String sourcePath) {
    String markdown = StrictUtf8.decode(content, sourcePath);
    return TEXT_RENDERER.render(PARSER.parse(markdown)).strip();
  }
}
