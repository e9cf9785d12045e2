package com.dqscan.quality.dto.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** One overview number read back from a profiling report; either found or explicitly "N/A". */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProfileMetric {

  public static final String UNAVAILABLE_TEXT = "N/A";

  private static final ProfileMetric UNAVAILABLE = new ProfileMetric(false, null, UNAVAILABLE_TEXT);

  @JsonProperty("available")
  private final boolean available;

  @JsonProperty("value")
  private final Double value;

  /** Text as shown in the source document, or "N/A". */
  @JsonProperty("display")
  private final String display;

  public static ProfileMetric of(double value, String display) {
    return new ProfileMetric(true, value, display);
  }

  public static ProfileMetric unavailable() {
    return UNAVAILABLE;
  }
}
