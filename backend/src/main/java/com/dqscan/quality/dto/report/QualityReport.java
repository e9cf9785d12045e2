package com.dqscan.quality.dto.report;

import java.util.List;
import java.util.Map;

import com.dqscan.quality.dto.dataset.ColumnType;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Complete quality report for one dataset. Built per request and never cached. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityReport {

  @JsonProperty("dataset_name")
  private String datasetName;

  @JsonProperty("row_count")
  private int rowCount;

  @JsonProperty("columns")
  private List<String> columns;

  @JsonProperty("column_types")
  private Map<String, ColumnType> columnTypes;

  @JsonProperty("target_column")
  private String targetColumn;

  @JsonProperty("target_selection")
  private TargetSelection targetSelection;

  @JsonProperty("missing_report")
  private MissingReport missingReport;

  @JsonProperty("duplicate_report")
  private DuplicateReport duplicateReport;

  @JsonProperty("outlier_report")
  private OutlierReport outlierReport;

  @JsonProperty("label_issue_report")
  private LabelIssueReport labelIssueReport;

  @JsonProperty("external_overview")
  private ExternalProfileStats externalOverview;
}
