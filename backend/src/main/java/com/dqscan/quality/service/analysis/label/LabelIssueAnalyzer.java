package com.dqscan.quality.service.analysis.label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisReason;
import com.dqscan.quality.dto.report.LabelIssueReport;
import com.dqscan.quality.dto.report.LabelIssueReport.LabelIssueRow;
import com.dqscan.quality.service.analysis.ml.WekaDatasetEncoder;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import weka.classifiers.AbstractClassifier;
import weka.classifiers.Classifier;
import weka.classifiers.trees.RandomForest;
import weka.core.Instances;

/**
 * Flags rows whose recorded label disagrees with out-of-fold predictions of a random forest trained
 * on the remaining columns. Never throws: every condition that prevents detection is reported as a
 * note on an empty report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LabelIssueAnalyzer {

  public static final String NOTE_TARGET_NOT_FOUND = "target column not found";
  public static final String NOTE_NOT_CATEGORICAL =
      "label-issue detection requires a categorical target";
  public static final String NOTE_INSUFFICIENT_DATA = "insufficient data for label-issue detection";
  public static final String NOTE_NO_FEATURES =
      "no usable feature columns for label-issue detection";
  public static final String NOTE_UNAVAILABLE_PREFIX = "label-issue detection unavailable: ";

  private final ApplicationProperties properties;
  private final WekaDatasetEncoder encoder;

  public LabelIssueReport analyze(Dataset dataset, String targetColumn) {
    ApplicationProperties.Label config = properties.getLabel();

    Optional<Column> target = dataset.findColumn(targetColumn);
    if (target.isEmpty()) {
      return LabelIssueReport.skipped(AnalysisReason.TARGET_NOT_FOUND, NOTE_TARGET_NOT_FOUND);
    }
    Column labels = target.get();
    if (!isCategorical(labels, properties.getTarget().getMaxClasses())) {
      return LabelIssueReport.skipped(AnalysisReason.NON_CATEGORICAL_TARGET, NOTE_NOT_CATEGORICAL);
    }

    List<Integer> labelledRows = new ArrayList<>();
    Map<String, Integer> classCounts = new LinkedHashMap<>();
    for (int row = 0; row < labels.size(); row++) {
      String label = WekaDatasetEncoder.labelOf(labels, row);
      if (label != null) {
        labelledRows.add(row);
        classCounts.merge(label, 1, Integer::sum);
      }
    }
    if (labelledRows.size() < config.getMinRows() || classCounts.size() < 2) {
      return LabelIssueReport.skipped(AnalysisReason.INSUFFICIENT_DATA, NOTE_INSUFFICIENT_DATA);
    }

    List<Column> features =
        encoder.featureColumns(dataset, labels.getName(), config.getMaxFeatureCategories());
    if (features.isEmpty()) {
      return LabelIssueReport.skipped(AnalysisReason.NO_FEATURE_COLUMNS, NOTE_NO_FEATURES);
    }

    List<String> classLabels = new ArrayList<>(new TreeSet<>(classCounts.keySet()));
    try {
      Instances data =
          encoder.encode(dataset.getName(), features, labelledRows, labels, classLabels);
      double[][] probabilities = outOfFoldProbabilities(data, classCounts, config);
      return findIssues(data, labelledRows, classLabels, probabilities, config.getMargin());
    } catch (CancellationException e) {
      log.warn("Label-issue detection for '{}' stopped: {}", dataset.getName(), e.getMessage());
      return LabelIssueReport.skipped(
          AnalysisReason.TIMEOUT, NOTE_UNAVAILABLE_PREFIX + e.getMessage());
    } catch (Exception e) {
      log.error("Label-issue detection failed for '{}': {}", dataset.getName(), e.getMessage(), e);
      return LabelIssueReport.skipped(
          AnalysisReason.DETECTOR_FAILURE, NOTE_UNAVAILABLE_PREFIX + e.getMessage());
    }
  }

  /**
   * A target is categorical when it is boolean, or textual or integral with at most {@code
   * maxClasses} distinct values. Datetimes never are.
   */
  static boolean isCategorical(Column column, int maxClasses) {
    switch (column.getType()) {
      case BOOLEAN:
        return true;
      case CATEGORICAL:
        return column.distinctValues().size() <= maxClasses;
      case NUMERIC:
        Set<Double> distinct = new TreeSet<>();
        for (int row = 0; row < column.size(); row++) {
          Double value = column.numericAt(row);
          if (value == null) {
            continue;
          }
          if (value != Math.rint(value)) {
            return false;
          }
          distinct.add(value);
        }
        return distinct.size() <= maxClasses;
      default:
        return false;
    }
  }

  private double[][] outOfFoldProbabilities(
      Instances data, Map<String, Integer> classCounts, ApplicationProperties.Label config)
      throws Exception {
    int[] folds = assignFolds(data, classCounts, config.getFolds(), config.getSeed());
    int foldCount = 0;
    for (int fold : folds) {
      foldCount = Math.max(foldCount, fold + 1);
    }

    RandomForest template = new RandomForest();
    template.setOptions(
        new String[] {
          "-I", Integer.toString(config.getTrees()),
          "-S", Long.toString(config.getSeed()),
          "-num-slots", "1"
        });

    double[][] probabilities = new double[data.numInstances()][];
    for (int fold = 0; fold < foldCount; fold++) {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("label-issue detection cancelled");
      }
      Instances train = new Instances(data, data.numInstances());
      List<Integer> test = new ArrayList<>();
      for (int i = 0; i < data.numInstances(); i++) {
        if (folds[i] == fold) {
          test.add(i);
        } else {
          train.add(data.instance(i));
        }
      }
      if (test.isEmpty()) {
        continue;
      }
      Classifier model = AbstractClassifier.makeCopy(template);
      model.buildClassifier(train);
      for (int i : test) {
        probabilities[i] = model.distributionForInstance(data.instance(i));
      }
      log.debug("Fold {}: trained on {} rows, scored {}", fold, train.numInstances(), test.size());
    }
    return probabilities;
  }

  /**
   * Stratified fold assignment: each class is shuffled and dealt round-robin. The fold count is the
   * configured one capped by the smallest class; a singleton class forces two plainly shuffled
   * folds.
   */
  static int[] assignFolds(Instances data, Map<String, Integer> classCounts, int folds, long seed) {
    int smallestClass = Collections.min(classCounts.values());
    int k = Math.min(folds, smallestClass);
    Random random = new Random(seed);
    int[] assignment = new int[data.numInstances()];

    if (k < 2) {
      List<Integer> order = new ArrayList<>();
      for (int i = 0; i < data.numInstances(); i++) {
        order.add(i);
      }
      Collections.shuffle(order, random);
      for (int position = 0; position < order.size(); position++) {
        assignment[order.get(position)] = position % 2;
      }
      return assignment;
    }

    Map<Integer, List<Integer>> byClass = new LinkedHashMap<>();
    for (int i = 0; i < data.numInstances(); i++) {
      byClass.computeIfAbsent((int) data.instance(i).classValue(), c -> new ArrayList<>()).add(i);
    }
    int dealt = 0;
    for (List<Integer> members : byClass.values()) {
      Collections.shuffle(members, random);
      for (int member : members) {
        assignment[member] = dealt++ % k;
      }
    }
    return assignment;
  }

  private LabelIssueReport findIssues(
      Instances data,
      List<Integer> rows,
      List<String> classLabels,
      double[][] probabilities,
      double margin) {
    int classes = classLabels.size();

    // per-class self-confidence threshold
    double[] thresholds = new double[classes];
    int[] counts = new int[classes];
    for (int i = 0; i < data.numInstances(); i++) {
      int given = (int) data.instance(i).classValue();
      thresholds[given] += probabilities[i][given];
      counts[given]++;
    }
    for (int c = 0; c < classes; c++) {
      thresholds[c] = counts[c] > 0 ? thresholds[c] / counts[c] : 0.0;
    }

    List<LabelIssueRow> issues = new ArrayList<>();
    for (int i = 0; i < data.numInstances(); i++) {
      int given = (int) data.instance(i).classValue();
      double[] distribution = probabilities[i];
      int suggested = -1;
      for (int c = 0; c < classes; c++) {
        if (c != given && (suggested < 0 || distribution[c] > distribution[suggested])) {
          suggested = c;
        }
      }
      double givenProbability = distribution[given];
      if (givenProbability < thresholds[given]
          && distribution[suggested] > givenProbability + margin) {
        issues.add(
            LabelIssueRow.builder()
                .rowIndex(rows.get(i))
                .currentLabel(classLabels.get(given))
                .suggestedLabel(classLabels.get(suggested))
                .labelConfidence(givenProbability)
                .suggestedConfidence(distribution[suggested])
                .build());
      }
    }

    issues.sort(
        Comparator.comparingDouble(LabelIssueRow::getLabelConfidence)
            .thenComparingInt(LabelIssueRow::getRowIndex));
    int previewLimit = Math.max(0, properties.getPreview().getLabelIssues());
    log.info("Label-issue detection flagged {} of {} rows", issues.size(), rows.size());

    return LabelIssueReport.builder()
        .labelIssueCount(issues.size())
        .preview(issues.stream().limit(previewLimit).collect(Collectors.toList()))
        .build();
  }
}
