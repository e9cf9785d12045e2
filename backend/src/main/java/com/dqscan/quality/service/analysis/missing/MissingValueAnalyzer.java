package com.dqscan.quality.service.analysis.missing;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Service;

import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.MissingReport;
import com.dqscan.quality.dto.report.MissingReport.ColumnMissing;
import com.dqscan.quality.util.Percentages;

import lombok.extern.slf4j.Slf4j;

/**
 * Counts missing cells per column. Missing-value tokens are normalized to null when the dataset is
 * loaded, so a cell is missing here exactly when its raw value is null.
 */
@Slf4j
@Service
public class MissingValueAnalyzer {

  public MissingReport analyze(Dataset dataset) {
    int rowCount = dataset.getRowCount();
    List<ColumnMissing> entries = new ArrayList<>();
    long totalMissing = 0;
    int columnsWithMissing = 0;

    for (Column column : dataset.getColumns()) {
      long missing = column.missingCount();
      totalMissing += missing;
      if (missing > 0) {
        columnsWithMissing++;
      }
      entries.add(
          ColumnMissing.builder()
              .column(column.getName())
              .missingCount(missing)
              .nonMissingCount(rowCount - missing)
              .missingPercent(Percentages.of(missing, rowCount))
              .build());
    }

    // List.sort is stable, so equal counts keep column order
    entries.sort(Comparator.comparingLong(ColumnMissing::getMissingCount).reversed());

    long totalCells = (long) rowCount * dataset.getColumnCount();
    log.debug(
        "Missing-value analysis of '{}': {} of {} cells missing across {} columns",
        dataset.getName(),
        totalMissing,
        totalCells,
        columnsWithMissing);

    return MissingReport.builder()
        .columns(entries)
        .totalCells(totalCells)
        .totalMissingCells(totalMissing)
        .columnsWithMissing(columnsWithMissing)
        .build();
  }
}
