package com.dqscan.quality.service.analysis.outlier;

import static com.dqscan.quality.fixtures.DatasetFixtures.categorical;
import static com.dqscan.quality.fixtures.DatasetFixtures.dataset;
import static com.dqscan.quality.fixtures.DatasetFixtures.numeric;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.SortedSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.AnalysisReason;
import com.dqscan.quality.dto.report.AnalysisStatus;
import com.dqscan.quality.dto.report.OutlierCategory;
import com.dqscan.quality.service.analysis.ml.WekaDatasetEncoder;

@DisplayName("SemanticOutlierDetector Tests")
class SemanticOutlierDetectorTest {

  private ApplicationProperties properties;
  private SemanticOutlierDetector detector;

  @BeforeEach
  void setUp() {
    properties = new ApplicationProperties();
    detector = new SemanticOutlierDetector(properties, new WekaDatasetEncoder());
  }

  @Test
  @DisplayName("Should flag the contamination share with the odd row among them")
  void shouldFlagMostAnomalousRows() {
    Dataset data = clusteredWithAnomaly(40, 17);

    AnalysisOutcome<SortedSet<Integer>> outcome = detector.detect(data);

    assertThat(outcome.getStatus()).isEqualTo(AnalysisStatus.OK);
    assertThat(outcome.getValue()).hasSize(2).contains(17);
    assertThat(detector.getCategory()).isEqualTo(OutlierCategory.AI_BASED);
  }

  @Test
  @DisplayName("Should still flag the odd row when the contamination share rounds below one")
  void shouldFlagAtLeastOneRowOnSmallDatasets() {
    Dataset data = clusteredWithAnomaly(15, 7);

    AnalysisOutcome<SortedSet<Integer>> outcome = detector.detect(data);

    assertThat(outcome.getStatus()).isEqualTo(AnalysisStatus.OK);
    assertThat(outcome.getValue()).containsExactly(7);
  }

  @Test
  @DisplayName("Should round the flagged share up and never below one row")
  void rowsToFlagRoundsUp() {
    assertThat(SemanticOutlierDetector.rowsToFlag(15, 0.05)).isEqualTo(1);
    assertThat(SemanticOutlierDetector.rowsToFlag(30, 0.05)).isEqualTo(2);
    assertThat(SemanticOutlierDetector.rowsToFlag(40, 0.05)).isEqualTo(2);
    assertThat(SemanticOutlierDetector.rowsToFlag(40, 0.0)).isZero();
  }

  @Test
  @DisplayName("Should give identical results on repeated runs")
  void shouldBeDeterministic() {
    Dataset data = clusteredWithAnomaly(30, 5);

    assertThat(detector.detect(data).getValue()).isEqualTo(detector.detect(data).getValue());
  }

  @Test
  @DisplayName("Should be unavailable below the minimum row count")
  void shouldBeUnavailableForSmallDatasets() {
    Dataset data = clusteredWithAnomaly(9, 3);

    AnalysisOutcome<SortedSet<Integer>> outcome = detector.detect(data);

    assertThat(outcome.getStatus()).isEqualTo(AnalysisStatus.UNAVAILABLE);
    assertThat(outcome.getReason()).isEqualTo(AnalysisReason.INSUFFICIENT_DATA);
    assertThat(outcome.getNote()).isNotBlank();
    assertThat(outcome.getValue()).isEmpty();
  }

  @Test
  @DisplayName("Should be unavailable when no column carries signal")
  void shouldBeUnavailableWithoutUsableColumns() {
    String[] constant = new String[12];
    Arrays.fill(constant, "same");

    AnalysisOutcome<SortedSet<Integer>> outcome =
        detector.detect(dataset("flat", categorical("kind", constant)));

    assertThat(outcome.getStatus()).isEqualTo(AnalysisStatus.UNAVAILABLE);
    assertThat(outcome.getReason()).isEqualTo(AnalysisReason.NO_USABLE_COLUMNS);
  }

  @Test
  @DisplayName("Should break score ties toward the lower row index")
  void topScoringPrefersLowerIndexOnTies() {
    double[] scores = {0.5, 0.9, 0.7, 0.9, 0.1};

    assertThat(SemanticOutlierDetector.topScoring(scores, 2)).containsExactly(1, 3);
    assertThat(SemanticOutlierDetector.topScoring(scores, 0)).isEmpty();
  }

  private static Dataset clusteredWithAnomaly(int rows, int anomaly) {
    String[] height = new String[rows];
    String[] weight = new String[rows];
    String[] team = new String[rows];
    for (int i = 0; i < rows; i++) {
      height[i] = Integer.toString(170 + (i % 5));
      weight[i] = Integer.toString(70 + (i % 4));
      team[i] = i % 2 == 0 ? "red" : "blue";
    }
    height[anomaly] = "420";
    weight[anomaly] = "3";
    return dataset(
        "athletes",
        numeric("height", height),
        numeric("weight", weight),
        categorical("team", team));
  }
}
