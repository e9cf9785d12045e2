package com.dqscan.quality.service.analysis.outlier;

import java.util.SortedSet;
import java.util.TreeSet;

import org.springframework.stereotype.Service;

import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.AnalysisReason;
import com.dqscan.quality.dto.report.OutlierIndexSets;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Runs the three outlier detectors independently. A failing detector leaves the others intact. */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutlierAnalysisService {

  private final StructuralOutlierDetector structuralDetector;
  private final StatisticalOutlierDetector statisticalDetector;
  private final SemanticOutlierDetector semanticDetector;

  public OutlierIndexSets analyze(Dataset dataset) {
    return OutlierIndexSets.builder()
        .structural(runDetector(structuralDetector, dataset))
        .statistical(runDetector(statisticalDetector, dataset))
        .semantic(runDetector(semanticDetector, dataset))
        .build();
  }

  public AnalysisOutcome<SortedSet<Integer>> runStructural(Dataset dataset) {
    return runDetector(structuralDetector, dataset);
  }

  public AnalysisOutcome<SortedSet<Integer>> runStatistical(Dataset dataset) {
    return runDetector(statisticalDetector, dataset);
  }

  public AnalysisOutcome<SortedSet<Integer>> runSemantic(Dataset dataset) {
    return runDetector(semanticDetector, dataset);
  }

  AnalysisOutcome<SortedSet<Integer>> runDetector(OutlierDetector detector, Dataset dataset) {
    try {
      return detector.detect(dataset);
    } catch (Exception e) {
      log.error(
          "{} outlier detection failed for '{}': {}",
          detector.getCategory().getLabel(),
          dataset.getName(),
          e.getMessage(),
          e);
      return AnalysisOutcome.degraded(
          new TreeSet<>(),
          AnalysisReason.DETECTOR_FAILURE,
          detector.getCategory().getLabel() + " outlier detection failed: " + e.getMessage());
    }
  }
}
