package dev.campfire.source;

import dev.campfire.error.NotFoundException;
import java.util.UUID;

public class SourceNotFoundException extends NotFoundException {

  public SourceNotFoundException(UUID sourceId) {
    super("Source", sourceId);
  }
}
