package com.dqscan.quality.dto.report;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TargetSelection {

  /** Resolved target column, null when no suitable target exists. */
  @JsonProperty("column")
  private String column;

  @JsonProperty("source")
  private TargetSource source;

  /** A manual override was supplied but names no column of this dataset; callers should drop it. */
  @JsonProperty("override_rejected")
  private boolean overrideRejected;

  /** Heuristic score per column, absent when a manual override was applied. */
  @JsonProperty("scores")
  private Map<String, Double> scores;

  public static TargetSelection none(boolean overrideRejected, Map<String, Double> scores) {
    return TargetSelection.builder()
        .source(TargetSource.NONE)
        .overrideRejected(overrideRejected)
        .scores(scores)
        .build();
  }
}
