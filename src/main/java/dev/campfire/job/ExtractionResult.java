package dev.campfire.job;

import dev.campfire.source.FailureKind;
import dev.campfire.validation.ExtractedRecord;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Callback payload of the extraction collaborator: either a record list (possibly empty) or an
 * error. A failure kind without error text still counts as an error.
 *
 * @param records extracted records; ignored when the result is a failure; null elements are
 *     dropped
 * @param error verbatim error text; null when the extraction succeeded
 * @param failureKind {@code STRUCTURAL} when the page layout is no longer understood; anything else
 *     is treated as {@code TRANSIENT}
 * @param logs collaborator log lines, stored with the job
 */
public record ExtractionResult(
    @Nullable List<ExtractedRecord> records,
    @Nullable String error,
    @Nullable FailureKind failureKind,
    @Nullable List<String> logs) {

  public ExtractionResult {
    records = records == null ? List.of() : records.stream().filter(Objects::nonNull).toList();
    logs = logs == null ? List.of() : logs.stream().filter(Objects::nonNull).toList();
  }

  public static ExtractionResult success(List<ExtractedRecord> records) {
    return new ExtractionResult(records, null, null, List.of());
  }

  public static ExtractionResult failure(FailureKind kind, String error) {
    return new ExtractionResult(List.of(), error, kind, List.of());
  }

  public boolean isFailure() {
    return error != null || failureKind != null;
  }

  /** The collaborator's error text, or a generic message when it only sent a failure kind. */
  String errorMessage() {
    if (error != null && !error.isBlank()) {
      return error;
    }
    return "Extractor reported a %s failure without details".formatted(effectiveFailureKind());
  }

  /** Collaborators may only report structural or transient failures. */
  FailureKind effectiveFailureKind() {
    return failureKind == FailureKind.STRUCTURAL ? FailureKind.STRUCTURAL : FailureKind.TRANSIENT;
  }
}
