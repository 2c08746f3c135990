package com.vigil.anomaly.service;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Coarse look-back labels such as {@code 30m}, {@code 24h} or {@code 7d}. */
public final class AlertWindow {

  public static final Duration DEFAULT = Duration.ofHours(24);

  private static final Pattern LABEL = Pattern.compile("^(\\d{1,6})([smhdw])$");

  private AlertWindow() {}

  /** Unknown, malformed or zero-length labels fall back to 24 hours. */
  public static Duration parse(String label) {
    if (label == null) return DEFAULT;
    Matcher m = LABEL.matcher(label.trim());
    if (!m.matches()) return DEFAULT;
    long n = Long.parseLong(m.group(1));
    if (n == 0) return DEFAULT;
    return switch (m.group(2)) {
      case "s" -> Duration.ofSeconds(n);
      case "m" -> Duration.ofMinutes(n);
      case "h" -> Duration.ofHours(n);
      case "d" -> Duration.ofDays(n);
      case "w" -> Duration.ofDays(7 * n);
      default -> DEFAULT;
    };
  }
}
