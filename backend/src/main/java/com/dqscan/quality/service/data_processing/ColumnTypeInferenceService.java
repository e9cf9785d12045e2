package com.dqscan.quality.service.data_processing;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.cobber.fta.TextAnalysisResult;
import com.cobber.fta.TextAnalyzer;
import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.ColumnType;
import com.dqscan.quality.dto.dataset.Dataset;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds an immutable {@link Dataset} from raw cell text. Each column's base type is detected once
 * with FTA and every cell is parsed against it, so analyzers never re-infer types.
 */
@Slf4j
@Service
public class ColumnTypeInferenceService {

  private static final Set<String> TRUE_TOKENS = Set.of("true", "yes", "y", "t", "1");
  private static final Set<String> FALSE_TOKENS = Set.of("false", "no", "n", "f", "0");

  private final Set<String> missingTokens;

  @Value("${fta.detect.window:20}")
  private int detectWindow = 20;

  @Value("${fta.max.cardinality:12000}")
  private int maxCardinality = 12000;

  // Cells are parsed with locale-neutral rules, so FTA must detect against the same conventions.
  @Value("${fta.locale:en-US}")
  private String localeTag = "en-US";

  public ColumnTypeInferenceService(ApplicationProperties properties) {
    this.missingTokens = new HashSet<>(properties.getMissingTokens());
  }

  /**
   * @param name dataset name
   * @param headers unique column names
   * @param rows row-major cell text, each row exactly {@code headers.size()} long
   */
  public Dataset buildDataset(String name, List<String> headers, List<String[]> rows) {
    List<Column> columns = new ArrayList<>(headers.size());
    for (int c = 0; c < headers.size(); c++) {
      List<String> raw = new ArrayList<>(rows.size());
      for (String[] row : rows) {
        raw.add(normalizeMissing(row[c]));
      }
      columns.add(inferColumn(headers.get(c), raw));
    }
    log.debug("Built dataset '{}' with {} columns and {} rows", name, columns.size(), rows.size());
    return new Dataset(name, columns);
  }

  /** Infers the column type of already-normalized raw values (null = missing). */
  public Column inferColumn(String name, List<String> rawValues) {
    boolean allMissing = rawValues.stream().allMatch(v -> v == null);
    if (allMissing) {
      return parseColumn(name, ColumnType.CATEGORICAL, null, null, rawValues);
    }

    String baseType;
    String typeModifier;
    try {
      TextAnalyzer analyzer = new TextAnalyzer(name);
      analyzer.setLocale(Locale.forLanguageTag(localeTag));
      analyzer.setDetectWindow(detectWindow);
      analyzer.setMaxCardinality(maxCardinality);
      analyzer.configure(TextAnalyzer.Feature.DEFAULT_SEMANTIC_TYPES, false);
      for (String value : rawValues) {
        analyzer.train(value);
      }
      TextAnalysisResult result = analyzer.getResult();
      baseType = result.getType() != null ? result.getType().toString() : "STRING";
      typeModifier = result.getTypeModifier();
    } catch (Exception e) {
      log.warn(
          "FTA type detection failed for column '{}', treating as text: {}", name, e.getMessage());
      return parseColumn(name, ColumnType.CATEGORICAL, null, null, rawValues);
    }

    ColumnType type = toColumnType(baseType);
    log.debug("Column '{}': FTA base type {} ({}) -> {}", name, baseType, typeModifier, type);
    return parseColumn(name, type, baseType, typeModifier, rawValues);
  }

  static ColumnType toColumnType(String ftaBaseType) {
    switch (ftaBaseType) {
      case "LONG":
      case "DOUBLE":
        return ColumnType.NUMERIC;
      case "BOOLEAN":
        return ColumnType.BOOLEAN;
      case "LOCALDATE":
      case "LOCALTIME":
      case "LOCALDATETIME":
      case "ZONEDDATETIME":
      case "OFFSETDATETIME":
        return ColumnType.DATETIME;
      default:
        return ColumnType.CATEGORICAL;
    }
  }

  private Column parseColumn(
      String name, ColumnType type, String baseType, String typeModifier, List<String> rawValues) {
    DateTimeFormatter formatter = type == ColumnType.DATETIME ? formatterFor(typeModifier) : null;
    boolean grouping = typeModifier != null && typeModifier.contains("GROUPING");

    List<Object> values = new ArrayList<>(rawValues.size());
    for (String raw : rawValues) {
      if (raw == null) {
        values.add(null);
        continue;
      }
      String trimmed = raw.trim();
      switch (type) {
        case NUMERIC:
          values.add(parseNumber(trimmed, grouping));
          break;
        case BOOLEAN:
          values.add(parseBoolean(trimmed));
          break;
        case DATETIME:
          // Without a usable format the cells stay text and are never reported as malformed.
          values.add(formatter == null ? raw : parseTemporal(trimmed, baseType, formatter));
          break;
        default:
          values.add(raw);
      }
    }
    String format = type == ColumnType.DATETIME ? typeModifier : null;
    return new Column(name, type, format, rawValues, values);
  }

  private String normalizeMissing(String value) {
    if (value == null || missingTokens.contains(value.trim())) {
      return null;
    }
    return value;
  }

  static Double parseNumber(String value, boolean grouping) {
    String candidate = grouping ? value.replace(",", "") : value;
    try {
      double parsed = Double.parseDouble(candidate);
      return Double.isNaN(parsed) ? null : parsed;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static Boolean parseBoolean(String value) {
    String lower = value.toLowerCase(Locale.ROOT);
    if (TRUE_TOKENS.contains(lower)) {
      return Boolean.TRUE;
    }
    if (FALSE_TOKENS.contains(lower)) {
      return Boolean.FALSE;
    }
    return null;
  }

  private static DateTimeFormatter formatterFor(String format) {
    if (format == null || format.isEmpty() || format.contains("?")) {
      return null;
    }
    try {
      return DateTimeFormatter.ofPattern(format, Locale.ENGLISH);
    } catch (IllegalArgumentException e) {
      log.debug("Unusable datetime format '{}': {}", format, e.getMessage());
      return null;
    }
  }

  private static Object parseTemporal(String value, String baseType, DateTimeFormatter formatter) {
    try {
      switch (baseType) {
        case "LOCALDATE":
          return LocalDate.parse(value, formatter);
        case "LOCALTIME":
          return LocalTime.parse(value, formatter);
        case "LOCALDATETIME":
          return LocalDateTime.parse(value, formatter);
        case "ZONEDDATETIME":
          return ZonedDateTime.parse(value, formatter);
        default:
          return OffsetDateTime.parse(value, formatter);
      }
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
