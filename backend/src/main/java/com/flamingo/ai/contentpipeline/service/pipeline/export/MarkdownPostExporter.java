package com.flamingo.ai.contentpipeline.service.pipeline.export;

import com.flamingo.ai.contentpipeline.config.PipelineConfig;
import com.flamingo.ai.contentpipeline.domain.model.FinalContent;
import com.flamingo.ai.contentpipeline.exception.ContentExportException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes a completed post to {@code post_<timestamp>_<run>.md} under the output directory, with a
 * YAML front matter block carrying title, tags, category, word count and creation time.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MarkdownPostExporter {

  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final PipelineConfig pipelineConfig;

  /**
   * Exports the post.
   *
   * @return the written file, or empty when export is disabled
   * @throws ContentExportException if the file cannot be written
   */
  public Optional<Path> export(String runId, FinalContent content, Instant created) {
    PipelineConfig.Export settings = pipelineConfig.getExport();
    if (!settings.isEnabled()) {
      return Optional.empty();
    }
    Path dir = Path.of(settings.getOutputDir());
    String runPrefix = runId.length() > 8 ? runId.substring(0, 8) : runId;
    Path target = dir.resolve("post_" + FILE_TIMESTAMP.format(created) + "_" + runPrefix + ".md");
    try {
      Files.createDirectories(dir);
      Files.writeString(target, render(content, created));
    } catch (IOException e) {
      throw new ContentExportException(target, e);
    }
    log.info("Exported run {} to {}", runId, target);
    return Optional.of(target);
  }

  static String render(FinalContent content, Instant created) {
    return "---\n"
        + "title: "
        + quoted(content.title())
        + "\ntags: "
        + String.join(", ", content.tags())
        + "\ncategory: "
        + content.category()
        + "\nword_count: "
        + content.wordCount()
        + "\ncreated: "
        + DateTimeFormatter.ISO_INSTANT.format(created)
        + "\n---\n\n"
        + content.body()
        + (content.body().endsWith("\n") ? "" : "\n");
  }

  private static String quoted(String value) {
    return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
