package dev.campfire.error;

/**
 * Raised when an operation is valid in isolation but conflicts with the current state of the
 * entity it targets (a held lease, an illegal state transition). Mapped to HTTP 409.
 */
public class ConflictException extends RuntimeException {

  public ConflictException(String message) {
    super(message);
  }
}
