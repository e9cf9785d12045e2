package com.dqscan.quality.service.analysis.outlier;

import java.util.SortedSet;

import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.OutlierCategory;

/** Flags rows of a dataset as outliers under one strategy. Implementations must be stateless. */
public interface OutlierDetector {

  OutlierCategory getCategory();

  /**
   * Returns the flagged row indices in ascending order. An outcome other than OK explains why the
   * detector did not apply.
   */
  AnalysisOutcome<SortedSet<Integer>> detect(Dataset dataset);
}
