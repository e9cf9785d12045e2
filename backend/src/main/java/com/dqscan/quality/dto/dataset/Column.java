package com.dqscan.quality.dto.dataset;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import lombok.Getter;

/**
 * A single named column. Holds the raw cell text (null when missing) and the value parsed according
 * to the inferred {@link ColumnType} (null when missing or when the raw text does not parse).
 */
@Getter
public final class Column {

  private final String name;
  private final ColumnType type;

  /** Format reported by type inference for datetime columns, null otherwise. */
  private final String format;

  private final List<String> rawValues;
  private final List<Object> values;

  public Column(
      String name, ColumnType type, String format, List<String> rawValues, List<Object> values) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (rawValues.size() != values.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Column '%s' has %d raw and %d values", name, rawValues.size(), values.size()));
    }
    this.name = name;
    this.type = type;
    this.format = format;
    this.rawValues = Collections.unmodifiableList(new ArrayList<>(rawValues));
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  public int size() {
    return rawValues.size();
  }

  public String rawAt(int row) {
    return rawValues.get(row);
  }

  public Object valueAt(int row) {
    return values.get(row);
  }

  public boolean isMissing(int row) {
    return rawValues.get(row) == null;
  }

  /** A present value that does not conform to the column's inferred type. */
  public boolean isMalformed(int row) {
    return type.isStrictlyTyped() && rawValues.get(row) != null && values.get(row) == null;
  }

  public Double numericAt(int row) {
    Object value = values.get(row);
    return value instanceof Double ? (Double) value : null;
  }

  public Boolean booleanAt(int row) {
    Object value = values.get(row);
    return value instanceof Boolean ? (Boolean) value : null;
  }

  public Temporal temporalAt(int row) {
    Object value = values.get(row);
    return value instanceof Temporal ? (Temporal) value : null;
  }

  public String textAt(int row) {
    Object value = values.get(row);
    return value != null ? value.toString() : rawValues.get(row);
  }

  /**
   * Value used for equality across rows: the typed value when parsed, the raw text for malformed
   * cells, null for missing cells.
   */
  public Object comparableAt(int row) {
    Object value = values.get(row);
    return value != null ? value : rawValues.get(row);
  }

  public long missingCount() {
    return rawValues.stream().filter(Objects::isNull).count();
  }

  public long nonMissingCount() {
    return size() - missingCount();
  }

  /** Distinct non-missing comparable values in first-seen order. */
  public Set<Object> distinctValues() {
    Set<Object> distinct = new LinkedHashSet<>();
    for (int i = 0; i < size(); i++) {
      Object value = comparableAt(i);
      if (value != null) {
        distinct.add(value);
      }
    }
    return distinct;
  }
}
