package dev.campfire.discovery;

import java.util.EnumSet;
import java.util.Set;

/**
 * Review lifecycle of a {@link DiscoveredSource}.
 *
 * <pre>
 * PENDING_ANALYSIS -> PENDING_REVIEW -> APPROVED -> SCRAPER_GENERATED
 *        |                  |
 *        +------------------+-> REJECTED
 * any non-terminal state -> DUPLICATE
 * </pre>
 *
 * <p>An operator may review an item that was never analysed, so {@code PENDING_ANALYSIS} may also
 * move straight to {@code APPROVED}.
 */
public enum DiscoveryStatus {
  PENDING_ANALYSIS,
  PENDING_REVIEW,
  APPROVED,
  REJECTED,
  SCRAPER_GENERATED,
  DUPLICATE;

  /** Both states that still wait for a human or the analyser. */
  public static final Set<DiscoveryStatus> PENDING = EnumSet.of(PENDING_ANALYSIS, PENDING_REVIEW);

  public boolean isTerminal() {
    return this == REJECTED || this == SCRAPER_GENERATED || this == DUPLICATE;
  }

  public boolean isPending() {
    return PENDING.contains(this);
  }

  public boolean canTransitionTo(DiscoveryStatus target) {
    if (isTerminal()) {
      return false;
    }
    if (target == DUPLICATE) {
      return true;
    }
    return switch (this) {
      case PENDING_ANALYSIS -> target == PENDING_REVIEW || target == APPROVED || target == REJECTED;
      case PENDING_REVIEW -> target == APPROVED || target == REJECTED;
      case APPROVED -> target == SCRAPER_GENERATED;
      default -> false;
    };
  }
}
