package com.flamingo.ai.contentpipeline.service.rag.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.contentpipeline.domain.model.SourceDocument;
import com.flamingo.ai.contentpipeline.exception.IngestionException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DocumentLoader Tests")
class DocumentLoaderTest {

  @TempDir Path tempDir;

  private DocumentLoader loader;

  @BeforeEach
  void setUp() {
    loader =
        new DocumentLoader(
            List.of(
                new MarkdownTextExtractor(), new PdfTextExtractor(), new PlainTextExtractor()));
  }

  @Test
  @DisplayName("Should render markdown to plain text")
  void shouldRenderMarkdownToPlainText() throws IOException {
    Path file = tempDir.resolve("guide.md");
    Files.writeString(file, "# Virtual Threads\n\nThey are **cheap** to create.\n");

    SourceDocument document = loader.load(file);

    assertThat(document.text()).contains("Virtual Threads").contains("They are cheap to create.");
    assertThat(document.text()).doesNotContain("**").doesNotContain("# ");
    assertThat(document.ingestionOrder()).isEqualTo(SourceDocument.NOT_INGESTED);
    assertThat(document.sourcePath()).isEqualTo(file.toString());
  }

  @Test
  @DisplayName("Should load plain text as is")
  void shouldLoadPlainText() throws IOException {
    Path file = tempDir.resolve("notes.txt");
    Files.writeString(file, "Line one.\nLine two.");

    SourceDocument document = loader.load(file);

    assertThat(document.mimeType()).isEqualTo("text/plain");
    assertThat(document.text()).isEqualTo("Line one.\nLine two.");
  }

  @Test
  @DisplayName("Should identify documents by content hash")
  void shouldIdentifyDocumentsByContentHash() throws IOException {
    Path first = tempDir.resolve("a.txt");
    Path second = tempDir.resolve("b.txt");
    Files.writeString(first, "identical content");
    Files.writeString(second, "identical content");

    assertThat(loader.load(first).id()).isEqualTo(loader.load(second).id());
    assertThat(DocumentLoader.contentHash("abc".getBytes(StandardCharsets.UTF_8)))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  @DisplayName("Should reject text that is not valid UTF-8")
  void shouldRejectInvalidUtf8() throws IOException {
    Path file = tempDir.resolve("broken.txt");
    Files.write(file, new byte[] {'o', 'k', ' ', (byte) 0xC3, (byte) 0x28, ' ', 'x'});

    assertThatThrownBy(() -> loader.load(file)).isInstanceOf(IngestionException.class);
  }

  @Test
  @DisplayName("Should reject a document without any text")
  void shouldRejectBlankDocument() throws IOException {
    Path file = tempDir.resolve("blank.txt");
    Files.writeString(file, "  \n\t\n");

    assertThatThrownBy(() -> loader.load(file))
        .isInstanceOf(IngestionException.class)
        .hasMessageContaining("No text content");
  }

  @Test
  @DisplayName("Should strip a UTF-8 byte order mark")
  void shouldStripByteOrderMark() throws IOException {
    Path file = tempDir.resolve("bom.txt");
    byte[] text = "hello".getBytes(StandardCharsets.UTF_8);
    byte[] content = new byte[text.length + 3];
    content[0] = (byte) 0xEF;
    content[1] = (byte) 0xBB;
    content[2] = (byte) 0xBF;
    System.arraycopy(text, 0, content, 3, text.length);
    Files.write(file, content);

    assertThat(loader.load(file).text()).isEqualTo("hello");
  }

  @Test
  @DisplayName("Should extract text from a PDF")
  void shouldExtractTextFromPdf() throws IOException {
    Path file = tempDir.resolve("paper.pdf");
    try (PDDocument pdf = new PDDocument()) {
      PDPage page = new PDPage();
      pdf.addPage(page);
      try (PDPageContentStream stream = new PDPageContentStream(pdf, page)) {
        stream.beginText();
        stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
        stream.newLineAtOffset(72, 700);
        stream.showText("Structured concurrency in practice");
        stream.endText();
      }
      pdf.save(file.toFile());
    }

    SourceDocument document = loader.load(file);

    assertThat(document.mimeType()).isEqualTo("application/pdf");
    assertThat(document.text()).contains("Structured concurrency in practice");
  }

  @Test
  @DisplayName("Should fail for a missing file")
  void shouldFailForMissingFile() {
    assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.md")))
        .isInstanceOf(IngestionException.class);
  }
}
