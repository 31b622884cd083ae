package dev.campfire.error;

import java.util.UUID;

/** Raised when an operation references an entity that does not exist. Mapped to HTTP 404. */
public class NotFoundException extends RuntimeException {

  private final String entity;
  private final UUID id;

  public NotFoundException(String entity, UUID id) {
    super("%s %s not found".formatted(entity, id));
    this.entity = entity;
    this.id = id;
  }

  public String getEntity() {
    return entity;
  }

  public UUID getId() {
    return id;
  }
}
