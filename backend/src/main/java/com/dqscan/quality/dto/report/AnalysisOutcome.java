package com.dqscan.quality.dto.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of one analysis step. A degraded or unavailable outcome still carries a usable value (an
 * empty set, a zero count) together with a reason code and a note for the reader of the report.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisOutcome<T> {

  @JsonProperty("status")
  private final AnalysisStatus status;

  @JsonIgnore private final T value;

  @JsonProperty("reason")
  private final AnalysisReason reason;

  @JsonProperty("note")
  private final String note;

  public static <T> AnalysisOutcome<T> ok(T value) {
    return new AnalysisOutcome<>(AnalysisStatus.OK, value, null, null);
  }

  public static <T> AnalysisOutcome<T> degraded(T fallback, AnalysisReason reason, String note) {
    return new AnalysisOutcome<>(AnalysisStatus.DEGRADED, fallback, reason, note);
  }

  public static <T> AnalysisOutcome<T> unavailable(T fallback, AnalysisReason reason, String note) {
    return new AnalysisOutcome<>(AnalysisStatus.UNAVAILABLE, fallback, reason, note);
  }

  @JsonIgnore
  public boolean isOk() {
    return status == AnalysisStatus.OK;
  }
}
