package com.dqscan.quality.dto.report;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.dqscan.quality.config.CoreConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

@DisplayName("QualityReport JSON Tests")
class QualityReportSerializationTest {

  private final ObjectMapper objectMapper = new CoreConfig().objectMapper();

  @Test
  @DisplayName("Should use stable snake_case field names and category labels")
  void shouldSerializeStableFieldNames() throws Exception {
    QualityReport report =
        QualityReport.builder()
            .datasetName("d")
            .rowCount(3)
            .columns(List.of("a"))
            .targetColumn("a")
            .outlierReport(
                OutlierReport.builder()
                    .totalUniqueOutliers(1)
                    .taggedOutlierRows(1)
                    .selectedFilter(OutlierFilter.AI)
                    .rows(
                        List.of(
                            TaggedOutlierRow.builder()
                                .rowIndex(2)
                                .category(OutlierCategory.AI_BASED)
                                .values(Map.of("a", "x"))
                                .build()))
                    .build())
            .labelIssueReport(
                LabelIssueReport.skipped(
                    AnalysisReason.TARGET_NOT_FOUND, "target column not found"))
            .externalOverview(ExternalProfileStats.allUnavailable())
            .build();

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(report));

    assertThat(json.get("dataset_name").asText()).isEqualTo("d");
    assertThat(json.get("target_column").asText()).isEqualTo("a");
    JsonNode outliers = json.get("outlier_report");
    assertThat(outliers.get("total_unique_outliers").asInt()).isEqualTo(1);
    assertThat(outliers.get("selected_filter").asText()).isEqualTo("ai");
    assertThat(outliers.get("rows").get(0).get("outlier_type").asText()).isEqualTo("AI-Based");
    assertThat(json.get("label_issue_report").get("note").asText())
        .isEqualTo("target column not found");
    JsonNode missingCells = json.get("external_overview").get("missing_cells");
    assertThat(missingCells.get("available").asBoolean()).isFalse();
    assertThat(missingCells.get("display").asText()).isEqualTo("N/A");
  }

  @Test
  @DisplayName("Outcome JSON should carry status and note but not the raw value")
  void outcomeHidesValue() throws Exception {
    AnalysisOutcome<String> outcome =
        AnalysisOutcome.degraded("fallback", AnalysisReason.TIMEOUT, "timed out");

    JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(outcome));

    assertThat(json.get("status").asText()).isEqualTo("DEGRADED");
    assertThat(json.get("reason").asText()).isEqualTo("TIMEOUT");
    assertThat(json.get("note").asText()).isEqualTo("timed out");
    assertThat(json.has("value")).isFalse();
    assertThat(json.has("ok")).isFalse();
  }
}
