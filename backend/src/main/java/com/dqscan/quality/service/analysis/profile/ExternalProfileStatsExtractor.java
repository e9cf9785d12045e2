package com.dqscan.quality.service.analysis.profile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import com.dqscan.quality.dto.report.ExternalProfileStats;
import com.dqscan.quality.dto.report.ProfileMetric;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the overview numbers of an HTML profiling report. Each metric is looked up by the label
 * cell that precedes its value; a metric that cannot be found or parsed is reported as unavailable
 * rather than guessed.
 */
@Slf4j
@Service
public class ExternalProfileStatsExtractor {

  static final String MISSING_CELLS = "Missing cells";
  static final String MISSING_CELLS_PERCENT = "Missing cells (%)";
  static final String DUPLICATE_ROWS = "Duplicate rows";
  static final String DUPLICATE_ROWS_PERCENT = "Duplicate rows (%)";

  public ExternalProfileStats extract(Path overviewDocument) {
    if (overviewDocument == null || !Files.isRegularFile(overviewDocument)) {
      log.debug("No overview document supplied, profile metrics unavailable");
      return ExternalProfileStats.allUnavailable();
    }
    Document document;
    try {
      document = Jsoup.parse(overviewDocument.toFile(), StandardCharsets.UTF_8.name());
    } catch (IOException e) {
      log.warn("Failed to read overview document {}: {}", overviewDocument, e.getMessage());
      return ExternalProfileStats.allUnavailable();
    }
    return extract(document);
  }

  public ExternalProfileStats extractFromHtml(String html) {
    if (html == null || html.isBlank()) {
      return ExternalProfileStats.allUnavailable();
    }
    return extract(Jsoup.parse(html));
  }

  private ExternalProfileStats extract(Document document) {
    ExternalProfileStats stats =
        ExternalProfileStats.builder()
            .missingCells(metric(document, MISSING_CELLS))
            .missingCellsPercent(metric(document, MISSING_CELLS_PERCENT))
            .duplicateRows(metric(document, DUPLICATE_ROWS))
            .duplicateRowsPercent(metric(document, DUPLICATE_ROWS_PERCENT))
            .build();
    log.debug(
        "Overview metrics: missing={}, duplicates={}",
        stats.getMissingCells().getDisplay(),
        stats.getDuplicateRows().getDisplay());
    return stats;
  }

  private static ProfileMetric metric(Document document, String label) {
    String wanted = normalize(label);
    for (Element cell : document.select("th, td")) {
      if (!normalize(cell.text()).equals(wanted)) {
        continue;
      }
      Element valueCell = cell.nextElementSibling();
      if (valueCell == null) {
        continue;
      }
      String display = valueCell.text().trim();
      Double value = parseNumber(display);
      if (value == null) {
        log.debug("Overview value '{}' for '{}' is not numeric", display, label);
        return ProfileMetric.unavailable();
      }
      return ProfileMetric.of(value, display);
    }
    return ProfileMetric.unavailable();
  }

  /** Parses values such as {@code 1,234} or {@code 12.5%}; null when not a number. */
  static Double parseNumber(String text) {
    if (text == null) {
      return null;
    }
    String cleaned = text.replace(",", "").replace("%", "").trim();
    if (cleaned.isEmpty()) {
      return null;
    }
    try {
      double value = Double.parseDouble(cleaned);
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String normalize(String text) {
    return text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
  }
}
