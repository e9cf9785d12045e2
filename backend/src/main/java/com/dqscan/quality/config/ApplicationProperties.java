package com.dqscan.quality.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** Analysis thresholds, limits and seeds bound from the {@code quality.*} namespace. */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "quality")
public class ApplicationProperties {

  /** Cell values treated as missing, compared after trimming. */
  @NotNull
  private List<String> missingTokens =
      new ArrayList<>(
          List.of(
              "", "NA", "N/A", "n/a", "NaN", "nan", "-NaN", "-nan", "NULL", "null", "None",
              "#N/A", "#N/A N/A", "#NA", "<NA>", "1.#IND", "1.#QNAN", "-1.#IND", "-1.#QNAN"));

  @Valid private Preview preview = new Preview();
  @Valid private Outlier outlier = new Outlier();
  @Valid private Target target = new Target();
  @Valid private Label label = new Label();
  @Valid private Execution execution = new Execution();

  @Data
  public static class Preview {
    @Min(0)
    private int duplicateRows = 5;

    @Min(0)
    private int labelIssues = 10;
  }

  @Data
  public static class Outlier {
    @DecimalMin(value = "0.0", inclusive = false)
    private double iqrMultiplier = 1.5;

    @Min(2)
    private int minNumericValues = 4;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minPopulatedRatio = 0.5;

    @Valid private Semantic semantic = new Semantic();
  }

  @Data
  public static class Semantic {
    @Min(1)
    private int trees = 100;

    @Min(2)
    private int sampleSize = 256;

    /** Share of rows flagged, ceil(rows x contamination) and at least one row. */
    @DecimalMin("0.0")
    @DecimalMax("0.5")
    private double contamination = 0.05;

    @Min(2)
    private int minRows = 10;

    @Min(2)
    private int maxCategories = 50;

    private long seed = 42L;
  }

  @Data
  public static class Target {
    @NotNull
    private List<String> vocabulary =
        new ArrayList<>(List.of("label", "target", "class", "outcome", "y"));

    @Min(2)
    private int maxClasses = 20;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double maxCardinalityRatio = 0.5;
  }

  @Data
  public static class Label {
    @Min(2)
    private int minRows = 5;

    @Min(2)
    private int folds = 5;

    @Min(1)
    private int trees = 100;

    private long seed = 42L;

    /** Extra probability the best other class needs over the given label. */
    @DecimalMin("0.0")
    private double margin = 0.0;

    @Min(2)
    private int maxFeatureCategories = 50;
  }

  @Data
  public static class Execution {
    @Min(1)
    private int corePoolSize = 4;

    @Min(1)
    private int maxPoolSize = 8;

    @Min(0)
    private int queueCapacity = 100;

    @Min(1)
    private long timeoutSeconds = 60;
  }
}
