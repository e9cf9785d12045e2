package com.dqscan.quality.dto.report;

import java.util.List;

import com.dqscan.quality.dto.dataset.ColumnType;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Column listing of an uploaded dataset, used to offer a manual target choice. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetColumnsResponse {

  @JsonProperty("dataset_name")
  private String datasetName;

  @JsonProperty("row_count")
  private int rowCount;

  @JsonProperty("columns")
  private List<ColumnInfo> columns;

  @JsonProperty("inferred_target")
  private TargetSelection inferredTarget;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ColumnInfo {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private ColumnType type;

    @JsonProperty("missing_count")
    private long missingCount;

    @JsonProperty("distinct_count")
    private int distinctCount;
  }
}
