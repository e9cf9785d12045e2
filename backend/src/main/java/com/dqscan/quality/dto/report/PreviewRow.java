package com.dqscan.quality.dto.report;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A dataset row as it appeared in the source file. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreviewRow {

  @JsonProperty("row_index")
  private int rowIndex;

  @JsonProperty("values")
  private Map<String, Object> values;
}
