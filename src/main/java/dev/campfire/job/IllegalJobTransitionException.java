package dev.campfire.job;

import dev.campfire.error.ConflictException;
import java.util.UUID;

public class IllegalJobTransitionException extends ConflictException {

  private final JobStatus from;
  private final JobStatus to;

  public IllegalJobTransitionException(UUID jobId, JobStatus from, JobStatus to) {
    super("Job %s cannot move from %s to %s".formatted(jobId, from, to));
    this.from = from;
    this.to = to;
  }

  public JobStatus getFrom() {
    return from;
  }

  public JobStatus getTo() {
    return to;
  }
}
