package com.dqscan.quality.dto.report;

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
public class TaggedOutlierRow {

  @JsonProperty("row_index")
  private int rowIndex;

  @JsonProperty("outlier_type")
  private OutlierCategory category;

  @JsonProperty("values")
  private Map<String, Object> values;
}
