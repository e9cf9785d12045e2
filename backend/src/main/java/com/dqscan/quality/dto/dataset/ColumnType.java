package com.dqscan.quality.dto.dataset;

/** Semantic type of a column, inferred once when the dataset is built. */
public enum ColumnType {
  NUMERIC,
  CATEGORICAL,
  DATETIME,
  BOOLEAN;

  /** Whether a non-missing raw value in a column of this type must parse to a typed value. */
  public boolean isStrictlyTyped() {
    return this != CATEGORICAL;
  }
}
