package dev.campfire.job;

import dev.campfire.error.NotFoundException;
import java.util.UUID;

public class JobNotFoundException extends NotFoundException {

  public JobNotFoundException(UUID jobId) {
    super("Job", jobId);
  }
}
