package dev.campfire.dedup;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Keyset position in creation order: the {@code (createdAt, id)} of the last candidate read.
 * Encoded as {@code <ISO instant>_<uuid>}.
 */
public record DedupCursor(Instant createdAt, UUID id) {

  private static final char SEPARATOR = '_';

  public String encode() {
    return createdAt.toString() + SEPARATOR + id;
  }

  /** @throws IllegalArgumentException if {@code value} is not an encoded cursor */
  public static DedupCursor decode(String value) {
    int split = value.lastIndexOf(SEPARATOR);
    if (split <= 0) {
      throw new IllegalArgumentException("Malformed dedup cursor: " + value);
    }
    try {
      return new DedupCursor(
          Instant.parse(value.substring(0, split)), UUID.fromString(value.substring(split + 1)));
    } catch (DateTimeParseException | IllegalArgumentException e) {
      throw new IllegalArgumentException("Malformed dedup cursor: " + value, e);
    }
  }
}
