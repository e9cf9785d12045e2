package com.dqscan.quality.service.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.ColumnType;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.AnalysisOutcome;
import com.dqscan.quality.dto.report.DuplicateReport;
import com.dqscan.quality.dto.report.ExternalProfileStats;
import com.dqscan.quality.dto.report.LabelIssueReport;
import com.dqscan.quality.dto.report.MissingReport;
import com.dqscan.quality.dto.report.OutlierCategory;
import com.dqscan.quality.dto.report.OutlierFilter;
import com.dqscan.quality.dto.report.OutlierIndexSets;
import com.dqscan.quality.dto.report.OutlierReport;
import com.dqscan.quality.dto.report.QualityReport;
import com.dqscan.quality.dto.report.TaggedOutlierRow;
import com.dqscan.quality.dto.report.TargetSelection;

/** Combines analyzer outputs into a {@link QualityReport}. Holds no state between calls. */
@Component
public class QualityReportAggregator {

  /**
   * One entry per (row, detector) pair: Statistical rows first, then AI-Based, then Structural,
   * each in ascending row order. A row flagged by several detectors appears once per tag.
   */
  public List<TaggedOutlierRow> buildTaggedView(Dataset dataset, OutlierIndexSets outliers) {
    List<TaggedOutlierRow> tagged = new ArrayList<>();
    for (OutlierCategory category : OutlierCategory.values()) {
      for (int row : outliers.indicesFor(category)) {
        tagged.add(
            TaggedOutlierRow.builder()
                .rowIndex(row)
                .category(category)
                .values(dataset.row(row))
                .build());
      }
    }
    return tagged;
  }

  public List<TaggedOutlierRow> filter(List<TaggedOutlierRow> taggedView, OutlierFilter filter) {
    OutlierFilter effective = filter == null ? OutlierFilter.ALL : filter;
    return taggedView.stream()
        .filter(row -> effective.matches(row.getCategory()))
        .collect(Collectors.toList());
  }

  public OutlierReport buildOutlierReport(
      Dataset dataset, OutlierIndexSets outliers, OutlierFilter filter) {
    OutlierFilter effective = filter == null ? OutlierFilter.ALL : filter;
    List<TaggedOutlierRow> taggedView = buildTaggedView(dataset, outliers);

    Map<String, AnalysisOutcome<?>> detectors = new LinkedHashMap<>();
    for (OutlierCategory category : OutlierCategory.values()) {
      detectors.put(category.getLabel(), outliers.outcomeFor(category));
    }

    return OutlierReport.builder()
        .statisticalCount(outliers.statisticalIndices().size())
        .semanticCount(outliers.semanticIndices().size())
        .structuralCount(outliers.structuralIndices().size())
        .totalUniqueOutliers(outliers.totalUnique())
        .taggedOutlierRows(taggedView.size())
        .selectedFilter(effective)
        .rows(filter(taggedView, effective))
        .detectors(detectors)
        .build();
  }

  public QualityReport aggregate(
      Dataset dataset,
      TargetSelection target,
      MissingReport missing,
      DuplicateReport duplicates,
      OutlierIndexSets outliers,
      LabelIssueReport labelIssues,
      ExternalProfileStats overview,
      OutlierFilter filter) {
    Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
    for (Column column : dataset.getColumns()) {
      columnTypes.put(column.getName(), column.getType());
    }

    return QualityReport.builder()
        .datasetName(dataset.getName())
        .rowCount(dataset.getRowCount())
        .columns(dataset.getColumnNames())
        .columnTypes(columnTypes)
        .targetColumn(target != null ? target.getColumn() : null)
        .targetSelection(target)
        .missingReport(missing)
        .duplicateReport(duplicates)
        .outlierReport(buildOutlierReport(dataset, outliers, filter))
        .labelIssueReport(labelIssues)
        .externalOverview(overview != null ? overview : ExternalProfileStats.allUnavailable())
        .build();
  }
}
