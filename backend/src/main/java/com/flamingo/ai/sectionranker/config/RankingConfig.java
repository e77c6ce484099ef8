package com.flamingo.ai.sectionranker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for section extraction and relevance ranking. */
@Configuration
@ConfigurationProperties(prefix = "ranking")
@Getter
@Setter
public class RankingConfig {

  /** Number of ranked sections kept in the analysis output. */
  private int topK = 5;

  private Extraction extraction = new Extraction();
  private Embedding embedding = new Embedding();
  private Parallelism parallelism = new Parallelism();
  private Collection collection = new Collection();
  private Runner runner = new Runner();

  /** Thresholds used by the layout-based title classifier. */
  @Getter
  @Setter
  public static class Extraction {
    /** A title spans at most this many lines. */
    private int maxTitleLines = 2;

    /** A title has strictly fewer words than this. */
    private int maxTitleWords = 10;

    /**
     * Points a title's font size must exceed the page's dominant size by. Zero still requires a
     * strictly larger font.
     */
    private float fontSizeMargin = 0.5f;

    /**
     * Consecutive lines with the same style are merged into one block while the baseline distance
     * stays below {@code fontSize * blockGapRatio}.
     */
    private float blockGapRatio = 1.6f;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Embedding backend: "local" (all-MiniLM-L6-v2, quantized ONNX) or "openai". */
    private String provider = "local";

    /** Input longer than this is truncated before embedding. */
    private int maxChars = 5000;

    private OpenAi openai = new OpenAi();

    @Getter
    @Setter
    public static class OpenAi {
      private String apiKey = "";
      private String modelName = "text-embedding-3-small";
      private Integer dimensions = 1536;
      private int timeoutSeconds = 30;
    }
  }

  @Getter
  @Setter
  public static class Parallelism {
    /** Parse documents and embed sections on the shared ranking executor. */
    private boolean enabled = true;

    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 500;
  }

  /** File layout of a collection directory. */
  @Getter
  @Setter
  public static class Collection {
    private String inputFile = "challenge1b_input.json";
    private String outputFile = "challenge1b_output.json";
    private String pdfDir = "PDFs";
  }

  /** Startup runner that analyses one collection and writes its output file. */
  @Getter
  @Setter
  public static class Runner {
    private boolean enabled = false;
    private String baseDir = ".";
    private String collection = "Collection_1";
  }
}
