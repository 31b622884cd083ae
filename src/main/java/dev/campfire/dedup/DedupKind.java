package dev.campfire.dedup;

import java.util.Locale;

/** Catalog entity kinds the deduplication engine can merge. */
public enum DedupKind {
  ORGANIZATIONS,
  LOCATIONS,
  CAMPS;

  /**
   * Parses a kind case-insensitively, singular or plural.
   *
   * @throws IllegalArgumentException for an unknown kind
   */
  public static DedupKind parse(String value) {
    String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    if (!normalized.endsWith("S")) {
      normalized = normalized + "S";
    }
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown dedup kind '%s' (expected organizations, locations or camps)".formatted(value));
    }
  }
}
