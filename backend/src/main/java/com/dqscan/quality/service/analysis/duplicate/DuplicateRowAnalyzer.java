package com.dqscan.quality.service.analysis.duplicate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.DuplicateReport;
import com.dqscan.quality.dto.report.PreviewRow;
import com.dqscan.quality.util.Percentages;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Finds rows whose every column value equals that of an earlier row. The first occurrence is the
 * original; each later occurrence counts once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateRowAnalyzer {

  private final ApplicationProperties properties;

  public DuplicateReport analyze(Dataset dataset) {
    int previewLimit = Math.max(0, properties.getPreview().getDuplicateRows());
    Set<List<Object>> seen = new HashSet<>();
    List<PreviewRow> preview = new ArrayList<>();
    int duplicates = 0;

    for (int row = 0; row < dataset.getRowCount(); row++) {
      if (!seen.add(rowKey(dataset, row))) {
        duplicates++;
        if (preview.size() < previewLimit) {
          preview.add(PreviewRow.builder().rowIndex(row).values(dataset.row(row)).build());
        }
      }
    }

    log.debug("Duplicate-row analysis of '{}': {} duplicates", dataset.getName(), duplicates);
    return DuplicateReport.builder()
        .duplicateRowsCount(duplicates)
        .duplicateRowsPercent(Percentages.of(duplicates, dataset.getRowCount()))
        .preview(preview)
        .build();
  }

  private static List<Object> rowKey(Dataset dataset, int row) {
    List<Object> key = new ArrayList<>(dataset.getColumnCount());
    for (Column column : dataset.getColumns()) {
      key.add(normalize(column.comparableAt(row)));
    }
    return key;
  }

  // Double.equals tells -0.0 from 0.0
  private static Object normalize(Object value) {
    if (value instanceof Double && (Double) value == 0.0d) {
      return 0.0d;
    }
    return value;
  }
}
