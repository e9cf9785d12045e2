package com.dqscan.quality.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Percentages {

  private Percentages() {}

  /** {@code part / whole * 100} rounded half-up to two decimals; 0 when {@code whole} is 0. */
  public static double of(long part, long whole) {
    if (whole <= 0) {
      return 0.0;
    }
    return BigDecimal.valueOf(part)
        .multiply(BigDecimal.valueOf(100))
        .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
