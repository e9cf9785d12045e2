package com.dqscan.quality.dto.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalProfileStats {

  @JsonProperty("missing_cells")
  private ProfileMetric missingCells;

  @JsonProperty("missing_cells_percent")
  private ProfileMetric missingCellsPercent;

  @JsonProperty("duplicate_rows")
  private ProfileMetric duplicateRows;

  @JsonProperty("duplicate_rows_percent")
  private ProfileMetric duplicateRowsPercent;

  public static ExternalProfileStats allUnavailable() {
    return ExternalProfileStats.builder()
        .missingCells(ProfileMetric.unavailable())
        .missingCellsPercent(ProfileMetric.unavailable())
        .duplicateRows(ProfileMetric.unavailable())
        .duplicateRowsPercent(ProfileMetric.unavailable())
        .build();
  }
}
