package dev.campfire.job;

/**
 * Lifecycle of an {@link ExtractionJob}: {@code PENDING -> RUNNING -> COMPLETED | FAILED}.
 *
 * <p>{@code PENDING} only exists inside the trigger transaction; a committed job is at least
 * {@code RUNNING}. Terminal states have no outgoing transitions.
 */
public enum JobStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public boolean canTransitionTo(JobStatus target) {
    return switch (this) {
      case PENDING -> target == RUNNING || target == FAILED;
      case RUNNING -> target == COMPLETED || target == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }
}
