package dev.campfire.discovery;

import java.util.Locale;

public enum ReviewDecision {
  APPROVED,
  REJECTED;

  /**
   * Parses {@code approved}/{@code approve} or {@code rejected}/{@code reject}, case-insensitively.
   *
   * @throws IllegalArgumentException for anything else
   */
  public static ReviewDecision parse(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "approved", "approve" -> APPROVED;
      case "rejected", "reject" -> REJECTED;
      default ->
          throw new IllegalArgumentException(
              "Unknown review decision '%s' (expected approved or rejected)".formatted(value));
    };
  }
}
