package com.dqscan.quality.dto.report;

import java.util.Collections;
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
public class LabelIssueReport {

  @JsonProperty("label_issue_count")
  private int labelIssueCount;

  /** Explains why detection was skipped or degraded; null when it ran fully. */
  @JsonProperty("note")
  private String note;

  @JsonProperty("reason")
  private AnalysisReason reason;

  @JsonProperty("preview")
  private List<LabelIssueRow> preview;

  public static LabelIssueReport skipped(AnalysisReason reason, String note) {
    return LabelIssueReport.builder()
        .labelIssueCount(0)
        .note(note)
        .reason(reason)
        .preview(Collections.emptyList())
        .build();
  }

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class LabelIssueRow {

    @JsonProperty("row_index")
    private int rowIndex;

    @JsonProperty("current_label")
    private String currentLabel;

    @JsonProperty("suggested_label")
    private String suggestedLabel;

    /** Out-of-fold probability the model gives the recorded label. */
    @JsonProperty("label_confidence")
    private double labelConfidence;

    @JsonProperty("suggested_confidence")
    private double suggestedConfidence;
  }
}
