package com.dqscan.quality.dto.report;

public enum AnalysisReason {
  TARGET_NOT_FOUND,
  NON_CATEGORICAL_TARGET,
  INSUFFICIENT_DATA,
  NO_FEATURE_COLUMNS,
  NO_USABLE_COLUMNS,
  DOCUMENT_ABSENT,
  DOCUMENT_UNREADABLE,
  DETECTOR_FAILURE,
  TIMEOUT
}
