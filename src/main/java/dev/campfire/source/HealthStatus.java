package dev.campfire.source;

import static dev.campfire.source.HealthThresholds.CRITICAL_FAILURES;
import static dev.campfire.source.HealthThresholds.DEGRADED_FAILURES;
import static dev.campfire.source.HealthThresholds.FAIR_SUCCESS_RATE;
import static dev.campfire.source.HealthThresholds.HEALTHY_SUCCESS_RATE;

/** Health classification of a source, computed on read and never stored. */
public enum HealthStatus {
  CRITICAL,
  DEGRADED,
  HEALTHY,
  FAIR,
  UNKNOWN;

  /** First matching rule wins: regeneration or failure streaks before the success rate. */
  public static HealthStatus classify(Health health) {
    if (health.isNeedsRegeneration() || health.getConsecutiveFailures() >= CRITICAL_FAILURES) {
      return CRITICAL;
    }
    if (health.getConsecutiveFailures() >= DEGRADED_FAILURES) {
      return DEGRADED;
    }
    double rate = health.getSuccessRate();
    if (rate >= HEALTHY_SUCCESS_RATE) {
      return HEALTHY;
    }
    if (rate >= FAIR_SUCCESS_RATE) {
      return FAIR;
    }
    return UNKNOWN;
  }
}
