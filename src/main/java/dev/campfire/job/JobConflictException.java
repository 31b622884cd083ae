package dev.campfire.job;

import dev.campfire.error.ConflictException;
import java.util.UUID;

/** Raised when a job is triggered for a source whose lease is held by another running job. */
public class JobConflictException extends ConflictException {

  private final UUID sourceId;

  public JobConflictException(UUID sourceId) {
    super("A job is already running for source " + sourceId);
    this.sourceId = sourceId;
  }

  public UUID getSourceId() {
    return sourceId;
  }
}
