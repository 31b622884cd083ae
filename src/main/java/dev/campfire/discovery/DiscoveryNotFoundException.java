package dev.campfire.discovery;

import dev.campfire.error.NotFoundException;
import java.util.UUID;

public class DiscoveryNotFoundException extends NotFoundException {

  public DiscoveryNotFoundException(UUID discoveryId) {
    super("DiscoveredSource", discoveryId);
  }
}
