package com.dqscan.quality.service.analysis.target;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.dqscan.quality.config.ApplicationProperties;
import com.dqscan.quality.dto.dataset.Column;
import com.dqscan.quality.dto.dataset.Dataset;
import com.dqscan.quality.dto.report.TargetSelection;
import com.dqscan.quality.dto.report.TargetSource;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the column most likely to be a classification target. A manual override naming an existing
 * column always wins; otherwise columns are scored on low cardinality and on label-like names.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TargetColumnInferenceService {

  private static final Pattern TOKEN_SPLIT =
      Pattern.compile("[^A-Za-z0-9]+|(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

  private static final double NAME_BONUS = 1.0;

  private final ApplicationProperties properties;

  public TargetSelection resolve(Dataset dataset, String manualOverride) {
    boolean overrideRejected = false;
    if (manualOverride != null && !manualOverride.isBlank()) {
      if (dataset.hasColumn(manualOverride)) {
        log.info("Using manual target column '{}'", manualOverride);
        return TargetSelection.builder()
            .column(manualOverride)
            .source(TargetSource.MANUAL)
            .build();
      }
      log.warn(
          "Manual target column '{}' not found in '{}', falling back to inference",
          manualOverride,
          dataset.getName());
      overrideRejected = true;
    }

    Map<String, Double> scores = score(dataset);
    if (scores.isEmpty()) {
      return TargetSelection.none(overrideRejected, scores);
    }

    String best = null;
    double bestScore = 0.0;
    for (Map.Entry<String, Double> entry : scores.entrySet()) {
      // >= so that later columns win ties
      if (entry.getValue() > 0 && entry.getValue() >= bestScore) {
        best = entry.getKey();
        bestScore = entry.getValue();
      }
    }

    if (best == null) {
      if (dataset.getColumnCount() < 2) {
        return TargetSelection.none(overrideRejected, scores);
      }
      List<String> names = dataset.getColumnNames();
      best = names.get(names.size() - 1);
    }

    log.debug("Inferred target column '{}' for '{}' (scores {})", best, dataset.getName(), scores);
    return TargetSelection.builder()
        .column(best)
        .source(TargetSource.INFERRED)
        .overrideRejected(overrideRejected)
        .scores(scores)
        .build();
  }

  /** Heuristic score of every column, in column order. */
  Map<String, Double> score(Dataset dataset) {
    ApplicationProperties.Target config = properties.getTarget();
    Set<String> vocabulary =
        config.getVocabulary().stream()
            .map(word -> word.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());

    Map<String, Double> scores = new LinkedHashMap<>();
    for (Column column : dataset.getColumns()) {
      double score = 0.0;

      long nonMissing = column.nonMissingCount();
      int distinct = column.distinctValues().size();
      if (nonMissing > 0 && distinct >= 2 && distinct <= config.getMaxClasses()) {
        double ratio = (double) distinct / nonMissing;
        if (ratio <= config.getMaxCardinalityRatio()) {
          score += 1.0 - ratio;
        }
      }

      if (tokens(column.getName()).stream().anyMatch(vocabulary::contains)) {
        score += NAME_BONUS;
      }
      scores.put(column.getName(), score);
    }
    return scores;
  }

  /** Lowercase tokens of a column name split on punctuation and camelCase boundaries. */
  static List<String> tokens(String columnName) {
    return Arrays.stream(TOKEN_SPLIT.split(columnName))
        .filter(token -> !token.isEmpty())
        .map(token -> token.toLowerCase(Locale.ROOT))
        .collect(Collectors.toList());
  }
}
