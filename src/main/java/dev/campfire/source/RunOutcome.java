package dev.campfire.source;

import org.jspecify.annotations.Nullable;

/**
 * Terminal outcome of one extraction attempt, as reported to the {@link SourceHealthTracker}.
 *
 * @param success whether the job completed
 * @param recordsFound records extracted; 0 for failures
 * @param failureKind why the job failed; null on success
 * @param error verbatim collaborator error text; null on success
 */
public record RunOutcome(
    boolean success,
    int recordsFound,
    @Nullable FailureKind failureKind,
    @Nullable String error) {

  public static RunOutcome success(int recordsFound) {
    return new RunOutcome(true, recordsFound, null, null);
  }

  public static RunOutcome failure(FailureKind kind, String error) {
    return new RunOutcome(false, 0, kind, error);
  }
}
