package com.dqscan.quality.service.analysis.outlier;

import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;

import org.springframework.stereotype.Component;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.OutlierCategory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Flags rows that break the shape of the table: a value that does not parse as its column's
 * inferred type, or far fewer populated fields than a typical row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StructuralOutlierDetector implements OutlierDetector {

  private final ApplicationProperties properties;

  @Override
  public OutlierCategory getCategory() {
    return OutlierCategory.STRUCTURAL;
  }

  @Override
  public AnalysisOutcome<SortedSet<Integer>> detect(Dataset dataset) {
    SortedSet<Integer> flagged = new TreeSet<>();

    for (Column column : dataset.getColumns()) {
      if (!column.getType().isStrictlyTyped()) {
        continue;
      }
      for (int row = 0; row < column.size(); row++) {
        if (column.isMalformed(row)) {
          flagged.add(row);
        }
      }
    }

    if (dataset.getColumnCount() >= 2 && dataset.getRowCount() > 0) {
      int[] populated = new int[dataset.getRowCount()];
      for (int row = 0; row < populated.length; row++) {
        populated[row] = dataset.populatedCount(row);
      }
      double threshold = properties.getOutlier().getMinPopulatedRatio() * median(populated);
      for (int row = 0; row < populated.length; row++) {
        if (populated[row] < threshold) {
          flagged.add(row);
        }
      }
    }

    log.debug("Structural detector flagged {} rows in '{}'", flagged.size(), dataset.getName());
    return AnalysisOutcome.ok(flagged);
  }

  static double median(int[] values) {
    int[] sorted = values.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    if (sorted.length % 2 == 1) {
      return sorted[mid];
    }
    return (sorted[mid - 1] + sorted[mid]) / 2.0;
  }
}
