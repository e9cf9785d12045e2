package com.dqscan.quality.dto.report;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MissingReport {

  /** One entry per column, worst offenders first. */
  @JsonProperty("columns")
  private List<ColumnMissing> columns;

  @JsonProperty("total_cells")
  private long totalCells;

  @JsonProperty("total_missing_cells")
  private long totalMissingCells;

  @JsonProperty("columns_with_missing")
  private int columnsWithMissing;

  @JsonProperty("has_missing_values")
  public boolean hasMissingValues() {
    return totalMissingCells > 0;
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ColumnMissing {

    @JsonProperty("column")
    private String column;

    @JsonProperty("missing_count")
    private long missingCount;

    @JsonProperty("non_missing_count")
    private long nonMissingCount;

    @JsonProperty("missing_percent")
    private double missingPercent;
  }
}
