package com.flamingo.ai.contentpipeline.service.pipeline.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.exception.ContentExportException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("MarkdownPostExporter Tests")
class MarkdownPostExporterTest {

  private static final Instant CREATED = Instant.parse("2026-03-14T09:26:53Z");
  private static final FinalContent CONTENT =
      new FinalContent(
          "Loom: \"virtual\" threads",
          "# Loom\n\nBody text.",
          "Meta",
          List.of("java", "loom"),
          "Tech",
          3);

  @TempDir Path tempDir;

  private PipelineConfig config;
  private MarkdownPostExporter exporter;

  @BeforeEach
  void setUp() {
    config = new PipelineConfig();
    config.getExport().setOutputDir(tempDir.resolve("output").toString());
    exporter = new MarkdownPostExporter(config);
  }

  @Test
  @DisplayName("Should write front matter followed by the post body")
  void shouldWriteFrontMatterAndBody() throws IOException {
    Path written = exporter.export("0123456789abcdef", CONTENT, CREATED).orElseThrow();

    assertThat(written.getFileName().toString()).isEqualTo("post_20260314_092653_01234567.md");
    assertThat(Files.readString(written))
        .isEqualTo(
            "---\n"
                + "title: \"Loom: \\\"virtual\\\" threads\"\n"
                + "tags: java, loom\n"
                + "category: Tech\n"
                + "word_count: 3\n"
                + "created: 2026-03-14T09:26:53Z\n"
                + "---\n\n"
                + "# Loom\n\nBody text.\n");
  }

  @Test
  @DisplayName("Should skip writing when export is disabled")
  void shouldSkipWhenDisabled() {
    config.getExport().setEnabled(false);

    Optional<Path> written = exporter.export("run-1", CONTENT, CREATED);

    assertThat(written).isEmpty();
    assertThat(tempDir.resolve("output")).doesNotExist();
  }

  @Test
  @DisplayName("Should wrap IO failures in ContentExportException")
  void shouldWrapIoFailures() throws IOException {
    Path file = Files.writeString(tempDir.resolve("occupied"), "x");
    config.getExport().setOutputDir(file.toString());

    assertThatThrownBy(() -> exporter.export("run-1", CONTENT, CREATED))
        .isInstanceOf(ContentExportException.class)
        .hasCauseInstanceOf(IOException.class);
  }
}
