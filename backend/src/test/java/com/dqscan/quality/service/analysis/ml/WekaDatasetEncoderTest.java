package com.dqscan.quality.service.analysis.ml;

import static com.dqscan.quality.fixtures.DatasetFixtures.bool;
import static com.dqscan.quality.fixtures.DatasetFixtures.categorical;
import static com.dqscan.quality.fixtures.DatasetFixtures.dataset;
import static com.dqscan.quality.fixtures.DatasetFixtures.dates;
import static com.dqscan.quality.fixtures.DatasetFixtures.numeric;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;

import weka.core.Instances;

@DisplayName("WekaDatasetEncoder Tests")
class WekaDatasetEncoderTest {

  private WekaDatasetEncoder encoder;
  private Dataset data;

  @BeforeEach
  void setUp() {
    encoder = new WekaDatasetEncoder();
    data =
        dataset(
            "mixed",
            numeric("amount", "1.5", null, "3"),
            bool("active", "true", "false", "true"),
            dates("joined", "1970-01-02", "2024-01-01", null),
            categorical("color", "red", "blue", "red"),
            categorical("constant", "x", "x", "x"),
            numeric("empty", null, null, null));
  }

  @Test
  @DisplayName("Should keep typed columns with values and varied categorical columns")
  void shouldSelectUsableFeatures() {
    List<Column> features = encoder.featureColumns(data, "active", 50);

    assertThat(features)
        .extracting(Column::getName)
        .containsExactly("amount", "joined", "color");
  }

  @Test
  @DisplayName("Should encode cells with missing values and a nominal class")
  void shouldEncodeInstances() {
    List<Column> features = encoder.featureColumns(data, "active", 50);
    Column label = data.findColumn("active").orElseThrow();

    Instances instances =
        encoder.encode("mixed", features, Arrays.asList(0, 1, 2), label, List.of("false", "true"));

    assertThat(instances.numInstances()).isEqualTo(3);
    assertThat(instances.classIndex()).isEqualTo(3);
    assertThat(instances.instance(0).value(0)).isEqualTo(1.5);
    assertThat(instances.instance(1).isMissing(0)).isTrue();
    assertThat(instances.instance(0).value(1)).isEqualTo(86400.0);
    assertThat(instances.instance(2).isMissing(1)).isTrue();
    assertThat(instances.instance(0).stringValue(2)).isEqualTo("red");
    assertThat(instances.instance(1).stringValue(3)).isEqualTo("false");
  }

  @Test
  @DisplayName("Anomaly-scoring rows should be finite with a placeholder class last")
  void forAnomalyScoringShouldImputeAndAppendClass() throws Exception {
    List<Column> features = encoder.featureColumns(data, null, 50);
    Instances encoded = encoder.encode("mixed", features, Arrays.asList(0, 1, 2), null, null);
    Instances preprocessed = encoder.preprocess(encoded);

    Instances scoring = WekaDatasetEncoder.forAnomalyScoring(preprocessed);

    assertThat(scoring.numInstances()).isEqualTo(3);
    assertThat(scoring.numAttributes()).isEqualTo(preprocessed.numAttributes() + 1);
    assertThat(scoring.classIndex()).isEqualTo(scoring.numAttributes() - 1);
    assertThat(scoring.classAttribute().numValues()).isEqualTo(2);
    for (int i = 0; i < scoring.numInstances(); i++) {
      for (int a = 0; a < scoring.numAttributes(); a++) {
        assertThat(Double.isFinite(scoring.instance(i).value(a))).isTrue();
      }
    }
    assertThat(preprocessed.classIndex()).isEqualTo(-1);
  }

  @Test
  @DisplayName("Should render integral numeric labels without a fraction")
  void labelOfIntegralNumbers() {
    Column labels = numeric("y", "1", "0.0", null, "2.5");

    assertThat(WekaDatasetEncoder.labelOf(labels, 0)).isEqualTo("1");
    assertThat(WekaDatasetEncoder.labelOf(labels, 1)).isEqualTo("0");
    assertThat(WekaDatasetEncoder.labelOf(labels, 2)).isNull();
    assertThat(WekaDatasetEncoder.labelOf(labels, 3)).isEqualTo("2.5");
  }

  @Test
  @DisplayName("Should convert local datetimes to UTC epoch seconds")
  void epochSeconds() {
    assertThat(WekaDatasetEncoder.epochSeconds(LocalDate.of(1970, 1, 2)))
        .isCloseTo(86400.0, within(0.0));
    assertThat(WekaDatasetEncoder.epochSeconds(LocalDateTime.of(1970, 1, 1, 0, 1)))
        .isCloseTo(60.0, within(0.0));
  }
}
