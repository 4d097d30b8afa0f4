package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import java.util.Locale;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** {@link DocumentTextExtractor} for plain text files. */
@Component
@Order(30)
public class PlainTextExtractor implements DocumentTextExtractor {

  @Override
  public boolean supports(String mimeType) {
    return mimeType != null && mimeType.toLowerCase(Locale.ROOT).startsWith("text/");
  }

  @Override
  public String extract(byte[] content, String sourcePath) {
    return StrictUtf8.decode(content, sourcePath);
  }
}
