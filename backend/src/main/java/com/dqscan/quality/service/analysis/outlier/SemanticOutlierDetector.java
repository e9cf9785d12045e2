package com.dqscan.quality.service.analysis.outlier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.springframework.stereotype.Component;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.AnalysisReason;
import com.dqscan.quality.dto.report.OutlierCategory;
import com.dqscan.quality.service.analysis.ml.WekaDatasetEncoder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.misc.IsolationForest;
import weka.core.Instances;

/**
 * Scores whole rows jointly with Weka's isolation forest and flags the most anomalous share of
 * them. Reported as the "AI-Based" category.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SemanticOutlierDetector implements OutlierDetector {

  private final ApplicationProperties properties;
  private final WekaDatasetEncoder encoder;

  @Override
  public OutlierCategory getCategory() {
    return OutlierCategory.AI_BASED;
  }

  @Override
  public AnalysisOutcome<SortedSet<Integer>> detect(Dataset dataset) {
    ApplicationProperties.Semantic config = properties.getOutlier().getSemantic();
    int rowCount = dataset.getRowCount();

    if (rowCount < config.getMinRows()) {
      return AnalysisOutcome.unavailable(
          new TreeSet<>(),
          AnalysisReason.INSUFFICIENT_DATA,
          "semantic outlier detection needs at least " + config.getMinRows() + " rows");
    }
    List<Column> features = encoder.featureColumns(dataset, null, config.getMaxCategories());
    if (features.isEmpty()) {
      return AnalysisOutcome.unavailable(
          new TreeSet<>(),
          AnalysisReason.NO_USABLE_COLUMNS,
          "no usable columns for semantic outlier detection");
    }

    List<Integer> rows = IntStream.range(0, rowCount).boxed().collect(Collectors.toList());
    double[] scores;
    try {
      Instances encoded = encoder.encode(dataset.getName(), features, rows, null, null);
      scores = score(WekaDatasetEncoder.forAnomalyScoring(encoder.preprocess(encoded)), config);
    } catch (CancellationException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Isolation forest scoring failed: " + e.getMessage(), e);
    }

    SortedSet<Integer> flagged =
        new TreeSet<>(topScoring(scores, rowsToFlag(rowCount, config.getContamination())));
    log.debug(
        "Semantic detector scored {} rows over {} columns, flagged {}",
        rowCount,
        features.size(),
        flagged.size());
    return AnalysisOutcome.ok(flagged);
  }

  private static double[] score(Instances data, ApplicationProperties.Semantic config)
      throws Exception {
    IsolationForest forest = new IsolationForest();
    forest.setOptions(
        new String[] {
          "-I", Integer.toString(config.getTrees()),
          "-N", Integer.toString(Math.min(config.getSampleSize(), data.numInstances())),
          "-S", Long.toString(config.getSeed())
        });
    forest.buildClassifier(data);

    double[] scores = new double[data.numInstances()];
    for (int i = 0; i < scores.length; i++) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("semantic outlier scoring cancelled");
      }
      // first entry of the distribution is 1 - anomaly score
      scores[i] = 1.0 - forest.distributionForInstance(data.instance(i))[0];
    }
    return scores;
  }

  /** ceil(rows x contamination), but never zero while contamination is positive. */
  static int rowsToFlag(int rowCount, double contamination) {
    if (contamination <= 0.0 || rowCount == 0) {
      return 0;
    }
    return Math.min(rowCount, Math.max(1, (int) Math.ceil(rowCount * contamination)));
  }

  /** Indices of the {@code k} highest scores; equal scores favour the lower index. */
  static List<Integer> topScoring(double[] scores, int k) {
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < scores.length; i++) {
      order.add(i);
    }
    order.sort((a, b) -> {
      int byScore = Double.compare(scores[b], scores[a]);
      return byScore != 0 ? byScore : Integer.compare(a, b);
    });
    if (k <= 0) {
      return Collections.emptyList();
    }
    return order.subList(0, Math.min(k, order.size()));
  }
}
