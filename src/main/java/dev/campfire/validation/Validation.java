package dev.campfire.validation;

import java.util.List;

/**
 * Outcome of validating one {@link ExtractedRecord}.
 *
 * <p>{@code complete} holds exactly when {@code missingFields} is empty, which is exactly when
 * {@code completenessScore} is 100. Entries in {@code errors} that do not correspond to a missing
 * field are quality warnings and do not affect the score.
 */
public record Validation(
    boolean complete,
    int completenessScore,
    List<String> missingFields,
    List<FieldError> errors,
    NormalizedSession normalized) {

  public Validation {
    missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }

  /** Publication status derived from this validation. */
  public SessionStatus status() {
    return SessionStatus.of(completenessScore, normalized.priceInCents(), normalized.priceRaw());
  }
}
