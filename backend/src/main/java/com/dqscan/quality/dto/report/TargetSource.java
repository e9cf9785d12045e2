package com.dqscan.quality.dto.report;

public enum TargetSource {
  MANUAL,
  INFERRED,
  NONE
}
