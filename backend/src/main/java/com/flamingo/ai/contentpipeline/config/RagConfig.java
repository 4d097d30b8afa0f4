package com.flamingo.ai.contentpipeline.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the retrieval subsystem. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Validated
@Getter
@Setter
public class RagConfig {

  @Valid private Chunking chunking = new Chunking();
  @Valid private Retrieval retrieval = new Retrieval();
  private Corpus corpus = new Corpus();
  private Index index = new Index();

  @Getter
  @Setter
  public static class Chunking {
    /** Target chunk size in characters. */
    @Min(1)
    private int size = 1000;

    /** Share of the chunk size repeated at the start of the next chunk, in [0, 1). */
    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private double overlapFraction = 0.2;
  }

  @Getter
  @Setter
  public static class Retrieval {
    @Min(1)
    private int topK = 10;

    /** Maximum chunks kept from one source document. */
    @Min(1)
    private int perSourceCap = 2;

    /** Chunks scoring below this cosine similarity are dropped as noise. */
    private double minSimilarity = 0.2;

    /** Candidates fetched from the index per requested result, before filtering. */
    @Min(1)
    private int candidatesMultiplier = 3;

    /** A context whose best score is below this is flagged low confidence. */
    private double lowConfidenceScore = 0.35;

    /** A context citing fewer distinct documents than this is flagged low confidence. */
    @Min(1)
    private int minSources = 1;
  }

  @Getter
  @Setter
  public static class Corpus {
    private String sourceDir = "./data/knowledge";
    private boolean ingestOnStartup = false;
  }

  @Getter
  @Setter
  public static class Index {
    /** JSON file holding the persisted corpus and vectors. */
    private String path = "./data/index/corpus-index.json";
  }
}
