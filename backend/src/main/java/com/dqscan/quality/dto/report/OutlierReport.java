package com.dqscan.quality.dto.report;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutlierReport {

  @JsonProperty("statistical_count")
  private int statisticalCount;

  @JsonProperty("semantic_count")
  private int semanticCount;

  @JsonProperty("structural_count")
  private int structuralCount;

  /** Rows flagged by any detector, each counted once. */
  @JsonProperty("total_unique_outliers")
  private int totalUniqueOutliers;

  /** Length of the tagged view: a row flagged by two detectors counts twice. */
  @JsonProperty("tagged_outlier_rows")
  private int taggedOutlierRows;

  @JsonProperty("selected_filter")
  private OutlierFilter selectedFilter;

  /** Tagged rows matching {@link #selectedFilter}. */
  @JsonProperty("rows")
  private List<TaggedOutlierRow> rows;

  /** Outcome per detector, keyed by category label. */
  @JsonProperty("detectors")
  private Map<String, AnalysisOutcome<?>> detectors;
}
