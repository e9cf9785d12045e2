package com.dqscan.quality.dto.report;

import com.fasterxml.jackson.annotation.JsonValue;

/** Tag attached to a flagged row, in the order categories are listed in the tagged view. */
public enum OutlierCategory {
  STATISTICAL("Statistical"),
  AI_BASED("AI-Based"),
  STRUCTURAL("Structural");

  private final String label;

  OutlierCategory(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
