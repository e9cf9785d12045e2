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
public class DuplicateReport {

  @JsonProperty("duplicate_rows_count")
  private int duplicateRowsCount;

  @JsonProperty("duplicate_rows_percent")
  private double duplicateRowsPercent;

  @JsonProperty("preview")
  private List<PreviewRow> preview;
}
