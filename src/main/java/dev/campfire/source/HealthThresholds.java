package dev.campfire.source;

/** Health classification thresholds shared by {@link HealthStatus} and the source list filters. */
public final class HealthThresholds {

  /** Consecutive failures at which a source is critical. */
  public static final int CRITICAL_FAILURES = 5;

  /** Consecutive failures at which a source is degraded and listed as failing. */
  public static final int DEGRADED_FAILURES = 3;

  public static final double HEALTHY_SUCCESS_RATE = 0.9;

  public static final double FAIR_SUCCESS_RATE = 0.7;

  private HealthThresholds() {
    // constants
  }
}
