package com.flamingo.ai.contentpipeline.config;

import com.flamingo.ai.contentpipeline.domain.enums.ExhaustionPolicy;
import com.flamingo.ai.contentpipeline.domain.enums.Visibility;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the content pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Validated
@Getter
@Setter
public class PipelineConfig {

  @Valid private Quality quality = new Quality();
  @Valid private Research research = new Research();
  @Valid private RetrySettings retry = new RetrySettings();
  private Publish publish = new Publish();
  private Persistence persistence = new Persistence();
  private Export export = new Export();

  @Getter
  @Setter
  public static class Quality {
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double approvalThreshold = 0.8;

    /** Maximum traversals of the Critique to Write edge. */
    @Min(1)
    private int maxIterations = 2;

    private ExhaustionPolicy onExhaustion = ExhaustionPolicy.ESCALATE;

    // Weights of the combined score; normalised by their sum.
    private double groundednessWeight = 0.5;
    private double redundancyWeight = 0.2;
    private double structureWeight = 0.3;

    /** Share of a sentence's content words that must appear in one chunk to count as grounded. */
    private double groundingOverlap = 0.5;

    /** Sections shorter than this many words count as absent. */
    private int minSectionWords = 30;
  }

  @Getter
  @Setter
  public static class Research {
    /** Extra research attempts, each with a broader query, after an empty retrieval. */
    @Min(0)
    private int retryBudget = 2;
  }

  @Getter
  @Setter
  public static class RetrySettings {
    @Min(1)
    private int maxAttempts = 3;

    private Duration backoffBase = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Publish {
    /** "dry-run" logs the post; "tistory" posts it to the Tistory Open API. */
    private String mode = "dry-run";

    private Visibility visibility = Visibility.DRAFT;

    /** Delay applied to {@link Visibility#SCHEDULED} posts. */
    private Duration scheduleDelay = Duration.ofHours(1);

    private List<String> defaultTags = new ArrayList<>(List.of("AI", "Tech", "Tutorial"));
    private String defaultCategory = "Tech";
    private Tistory tistory = new Tistory();

    @Getter
    @Setter
    public static class Tistory {
      private String baseUrl = "https://www.tistory.com/apis";
      private String accessToken = "";
      private String blogName = "";
      private String categoryId = "";
      private Duration timeout = Duration.ofSeconds(30);
    }
  }

  @Getter
  @Setter
  public static class Persistence {
    private String runsDir = "./data/runs";
  }

  @Getter
  @Setter
  public static class Export {
    /** Writes a markdown copy of every completed post. */
    private boolean enabled = true;

    private String outputDir = "./output";
  }
}
