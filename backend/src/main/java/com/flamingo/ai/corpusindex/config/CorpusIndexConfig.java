package com.flamingo.ai.corpusindex.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the corpus indexing pipelines. */
@Configuration
@ConfigurationProperties(prefix = "corpus")
@Validated
@Getter
@Setter
public class CorpusIndexConfig {

  @Valid private Chunking chunking = new Chunking();
  @Valid private Index index = new Index();
  @Valid private Embedding embedding = new Embedding();
  @Valid private Taxonomy taxonomy = new Taxonomy();
  @Valid private Dedup dedup = new Dedup();

  @Getter
  @Setter
  public static class Chunking {
    @Positive private int targetTokens = 400;
    @PositiveOrZero private int overlapTokens = 50;

    /** jtokkit encoding name, matching the tokenizer of the embedding model. */
    private String encoding = "cl100k_base";

    /**
     * Fraction of a window that may be given up so a chunk ends on a sentence or paragraph break.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double cleanBreakWindow = 0.2;
  }

  @Getter
  @Setter
  public static class Index {
    /** Backend selected once per process: "local" (embedded JSON file) or "pgvector". */
    private String backend = "local";

    @Positive private int upsertBatchSize = 100;
    @Positive private int defaultTopK = 5;

    /** Minimum normalized score (0-1) for a search hit to be returned. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minScore = 0.0;

    @Valid private Local local = new Local();
    @Valid private PgVector pgvector = new PgVector();

    @Getter
    @Setter
    public static class Local {
      private String path = "data/vectorstore/chunks.json";
    }

    @Getter
    @Setter
    public static class PgVector {
      private String table = "paper_chunks";
      private String matchFunction = "match_chunks";
      private boolean initializeSchema = true;
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    private String modelName = "text-embedding-3-small";
    @Positive private int dimensions = 1536;

    /**
     * Provider version stamped on every stored vector. Vectors of different versions are never
     * compared. Defaults to {@code modelName@dimensions} when blank.
     */
    private String version = "";

    private Duration timeout = Duration.ofSeconds(30);

    /** Number of concurrent embedding calls during a rebuild. */
    @Positive private int parallelism = 4;

    /**
     * Embedding tasks submitted at once during a rebuild. Also the capacity of the embedding
     * executor's queue, so a window is never rejected.
     */
    @Positive private int submitWindow = 256;

    public String resolvedVersion() {
      return version == null || version.isBlank() ? modelName + "@" + dimensions : version;
    }
  }

  @Getter
  @Setter
  public static class Taxonomy {
    @Min(1)
    private int minClusters = 8;

    @Min(1)
    private int maxClusters = 12;

    /** Forces a cluster count and skips model-order selection when set. */
    @Positive private Integer forcedClusterCount;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double softAssignmentThreshold = 0.1;

    @Positive private int labelSampleSize = 5;
    private Duration labelTimeout = Duration.ofSeconds(30);

    /** Layout method: "cosine-mds" (preferred) or "pca". */
    private String projection = "cosine-mds";

    private boolean includeDocumentPositions = true;
    private long randomSeed = 42L;
    private int emRestarts = 3;
    private int maxIterations = 200;
    private double convergenceTolerance = 1e-4;

    /** BIC is divided by this before being combined with the silhouette term. */
    private double bicScale = 10_000.0;

    private double silhouetteWeight = 5.0;
    private boolean skipLabels = false;
    private boolean skipClaims = false;
  }

  @Getter
  @Setter
  public static class Dedup {
    /** Restricts a dedup run to one episode; all episodes when blank. */
    private String episode;

    @NotEmpty
    @Valid
    private List<Pass> passes =
        new ArrayList<>(
            List.of(
                new Pass(0.95, Duration.ofSeconds(30)), new Pass(0.90, Duration.ofSeconds(180))));

    @Getter
    @Setter
    public static class Pass {
      @DecimalMin("-1.0")
      @DecimalMax("1.0")
      private double similarityThreshold;
      private Duration temporalWindow;

      public Pass() {}

      public Pass(double similarityThreshold, Duration temporalWindow) {
        this.similarityThreshold = similarityThreshold;
        this.temporalWindow = temporalWindow;
      }
    }
  }
}
