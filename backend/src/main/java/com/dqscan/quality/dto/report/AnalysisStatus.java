package com.dqscan.quality.dto.report;

public enum AnalysisStatus {
  /** The analysis ran to completion. */
  OK,
  /** The analysis started but failed or timed out; its value is a safe fallback. */
  DEGRADED,
  /** The analysis does not apply to this dataset. */
  UNAVAILABLE
}
