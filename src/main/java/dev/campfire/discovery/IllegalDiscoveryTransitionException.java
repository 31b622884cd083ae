package dev.campfire.discovery;

import dev.campfire.error.ConflictException;
import java.util.UUID;

public class IllegalDiscoveryTransitionException extends ConflictException {

  public IllegalDiscoveryTransitionException(
      UUID discoveryId, DiscoveryStatus from, DiscoveryStatus to) {
    super("Discovered source %s cannot move from %s to %s".formatted(discoveryId, from, to));
  }
}
