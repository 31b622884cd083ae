package dev.campfire.source;

import dev.campfire.error.ConflictException;
import java.util.UUID;

/** Raised when an operation needs an idle source but a job holds its lease. */
public class SourceBusyException extends ConflictException {

  public SourceBusyException(UUID sourceId, String operation) {
    super("Cannot %s source %s while a job is running".formatted(operation, sourceId));
  }
}
