package com.dqscan.quality.dto.report;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Builder;
import lombok.Getter;

/** Row indices flagged by each outlier detector, with each detector's outcome. */
@Getter
@Builder
public class OutlierIndexSets {

  private final AnalysisOutcome<SortedSet<Integer>> structural;
  private final AnalysisOutcome<SortedSet<Integer>> statistical;
  private final AnalysisOutcome<SortedSet<Integer>> semantic;

  public SortedSet<Integer> structuralIndices() {
    return indices(structural);
  }

  public SortedSet<Integer> statisticalIndices() {
    return indices(statistical);
  }

  public SortedSet<Integer> semanticIndices() {
    return indices(semantic);
  }

  public SortedSet<Integer> indicesFor(OutlierCategory category) {
    switch (category) {
      case STATISTICAL:
        return statisticalIndices();
      case AI_BASED:
        return semanticIndices();
      default:
        return structuralIndices();
    }
  }

  public AnalysisOutcome<SortedSet<Integer>> outcomeFor(OutlierCategory category) {
    switch (category) {
      case STATISTICAL:
        return statistical;
      case AI_BASED:
        return semantic;
      default:
        return structural;
    }
  }

  /** Rows flagged by at least one detector; a row flagged several times counts once. */
  public int totalUnique() {
    SortedSet<Integer> union = new TreeSet<>(structuralIndices());
    union.addAll(statisticalIndices());
    union.addAll(semanticIndices());
    return union.size();
  }

  private static SortedSet<Integer> indices(AnalysisOutcome<SortedSet<Integer>> outcome) {
    if (outcome == null || outcome.getValue() == null) {
      return Collections.emptySortedSet();
    }
    return Collections.unmodifiableSortedSet(outcome.getValue());
  }
}
