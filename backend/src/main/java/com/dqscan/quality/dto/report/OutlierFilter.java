package com.dqscan.quality.dto.report;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/** Category selector for the tagged outlier view. */
public enum OutlierFilter {
  ALL("all", null),
  STATISTICAL("statistical", OutlierCategory.STATISTICAL),
  AI("ai", OutlierCategory.AI_BASED),
  STRUCTURAL("structural", OutlierCategory.STRUCTURAL);

  private final String parameter;
  private final OutlierCategory category;

  OutlierFilter(String parameter, OutlierCategory category) {
    this.parameter = parameter;
    this.category = category;
  }

  @JsonValue
  public String getParameter() {
    return parameter;
  }

  public boolean matches(OutlierCategory candidate) {
    return category == null || category == candidate;
  }

  /** Parses a request parameter; unknown or absent values select {@link #ALL}. */
  public static OutlierFilter fromParameter(String value) {
    if (value == null) {
      return ALL;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (OutlierFilter filter : values()) {
      if (filter.parameter.equals(normalized)) {
        return filter;
      }
    }
    return ALL;
  }
}
