package dev.campfire.source;

import java.util.Locale;

/** Operator list filters. {@code HEALTHY} and {@code ACTIVE} are the same filter. */
public enum SourceFilter {
  ALL,
  HEALTHY,
  FAILING,
  NODATA;

  /**
   * Parse a filter name case-insensitively; {@code "active"} is accepted as {@link #HEALTHY}.
   *
   * @throws IllegalArgumentException for an unknown filter
   */
  public static SourceFilter parse(String value) {
    if (value == null || value.isBlank()) {
      return ALL;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    if ("ACTIVE".equals(normalized)) {
      return HEALTHY;
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown source filter '%s' (expected all, healthy, active, failing or nodata)"
              .formatted(value));
    }
  }
}
