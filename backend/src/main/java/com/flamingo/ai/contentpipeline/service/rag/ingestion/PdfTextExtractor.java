package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import com.flamingo.ai.contentpipeline.exception.IngestionException;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** {@link DocumentTextExtractor} for PDF files using Apache PDFBox. */
@Component
@Order(20)
@Slf4j
public class PdfTextExtractor implements DocumentTextExtractor {

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equalsIgnoreCase(mimeType);
  }

  @Override
  public String extract(byte[] content, String sourcePath) {
    try (PDDocument pdf = Loader.loadPDF(content)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      String text = stripper.getText(pdf);
      log.debug("Extracted {} chars from {} PDF pages", text.length(), pdf.getNumberOfPages());
      return text.strip();
    } catch (IOException e) {
      throw new IngestionException(sourcePath, "Unreadable PDF: " + sourcePath, e);
    }
  }
}
