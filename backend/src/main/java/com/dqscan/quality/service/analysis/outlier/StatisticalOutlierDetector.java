package com.dqscan.quality.service.analysis.outlier;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.springframework.stereotype.Component;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.ColumnType;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.OutlierCategory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Interquartile-range fences applied to every numeric column; the flagged rows are unioned. */
@Slf4j
@Component
@RequiredArgsConstructor
public class StatisticalOutlierDetector implements OutlierDetector {

  private final ApplicationProperties properties;

  @Override
  public OutlierCategory getCategory() {
    return OutlierCategory.STATISTICAL;
  }

  @Override
  public AnalysisOutcome<SortedSet<Integer>> detect(Dataset dataset) {
    ApplicationProperties.Outlier config = properties.getOutlier();
    SortedSet<Integer> flagged = new TreeSet<>();

    for (Column column : dataset.columnsOfType(ColumnType.NUMERIC)) {
      List<Integer> rows = new ArrayList<>();
      List<Double> values = new ArrayList<>();
      for (int row = 0; row < column.size(); row++) {
        Double value = column.numericAt(row);
        if (value != null && Double.isFinite(value)) {
          rows.add(row);
          values.add(value);
        }
      }
      if (values.size() < config.getMinNumericValues()) {
        continue;
      }

      double[] sorted = values.stream().mapToDouble(Double::doubleValue).sorted().toArray();
      double q1 = quantile(sorted, 0.25);
      double q3 = quantile(sorted, 0.75);
      double iqr = q3 - q1;
      if (iqr <= 0) {
        continue;
      }
      double lower = q1 - config.getIqrMultiplier() * iqr;
      double upper = q3 + config.getIqrMultiplier() * iqr;

      int before = flagged.size();
      for (int i = 0; i < values.size(); i++) {
        double value = values.get(i);
        if (value < lower || value > upper) {
          flagged.add(rows.get(i));
        }
      }
      log.debug(
          "Column '{}': fences [{}, {}], {} new rows flagged",
          column.getName(),
          lower,
          upper,
          flagged.size() - before);
    }

    return AnalysisOutcome.ok(flagged);
  }

  /** Quantile with linear interpolation between the closest ranks of a sorted array. */
  static double quantile(double[] sorted, double p) {
    double position = p * (sorted.length - 1);
    int lower = (int) Math.floor(position);
    int upper = Math.min(lower + 1, sorted.length - 1);
    double fraction = position - lower;
    return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
  }
}
