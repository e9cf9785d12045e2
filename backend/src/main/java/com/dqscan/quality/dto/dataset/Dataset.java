package com.dqscan.quality.dto.dataset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * Immutable column-oriented table. All columns share the same length and rows are addressed by a
 * 0-based contiguous index.
 */
@Getter
public final class Dataset {

  private final String name;
  private final List<Column> columns;
  private final int rowCount;

  public Dataset(String name, List<Column> columns) {
    this.name = name;
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rowCount = columns.isEmpty() ? 0 : columns.get(0).size();

    Set<String> seen = new HashSet<>();
    for (Column column : columns) {
      if (!seen.add(column.getName())) {
        throw new IllegalArgumentException("Duplicate column name: " + column.getName());
      }
      if (column.size() != rowCount) {
        throw new IllegalArgumentException(
            "Column '"
                + column.getName()
                + "' has "
                + column.size()
                + " rows, expected "
                + rowCount);
      }
    }
  }

  public int getColumnCount() {
    return columns.size();
  }

  public List<String> getColumnNames() {
    return columns.stream().map(Column::getName).collect(Collectors.toList());
  }

  public Optional<Column> findColumn(String columnName) {
    if (columnName == null) {
      return Optional.empty();
    }
    return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
  }

  public boolean hasColumn(String columnName) {
    return findColumn(columnName).isPresent();
  }

  public List<Column> columnsOfType(ColumnType type) {
    return columns.stream().filter(c -> c.getType() == type).collect(Collectors.toList());
  }

  /** Original cell text of one row keyed by column name, in column order. */
  public Map<String, Object> row(int rowIndex) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (Column column : columns) {
      row.put(column.getName(), column.rawAt(rowIndex));
    }
    return row;
  }

  /** Number of non-missing cells in a row. */
  public int populatedCount(int rowIndex) {
    int count = 0;
    for (Column column : columns) {
      if (!column.isMissing(rowIndex)) {
        count++;
      }
    }
    return count;
  }
}
