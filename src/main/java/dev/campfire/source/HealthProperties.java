package dev.campfire.source;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised tuning for failure handling in the {@link SourceHealthTracker}.
 *
 * <p>Properties are bound from {@code campfire.health.*}.
 *
 * <ul>
 *   <li>{@code max-backoff-hours} - ceiling of the exponential retry backoff (default 168, one week)
 *   <li>{@code rate-limit-backoff-hours} - fixed wait after a rate-limited attempt (default 6)
 *   <li>{@code not-found-disable-threshold} - consecutive 404 failures before the source is
 *       disabled (default 5)
 *   <li>{@code zero-results-alert-threshold} - consecutive empty runs before an alert (default 3)
 * </ul>
 *
 * <p>The classification thresholds are not configurable; see {@link HealthThresholds}.
 */
@Configuration
@ConfigurationProperties(prefix = "campfire.health")
public class HealthProperties {

  private int maxBackoffHours = 168;
  private int rateLimitBackoffHours = 6;
  private int notFoundDisableThreshold = 5;
  private int zeroResultsAlertThreshold = 3;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (maxBackoffHours < 1) {
      throw new IllegalStateException(
          "campfire.health.max-backoff-hours must be >= 1, got: " + maxBackoffHours);
    }
    if (rateLimitBackoffHours < 1) {
      throw new IllegalStateException(
          "campfire.health.rate-limit-backoff-hours must be >= 1, got: " + rateLimitBackoffHours);
    }
    if (notFoundDisableThreshold < 1) {
      throw new IllegalStateException(
          "campfire.health.not-found-disable-threshold must be >= 1, got: "
              + notFoundDisableThreshold);
    }
    if (zeroResultsAlertThreshold < 1) {
      throw new IllegalStateException(
          "campfire.health.zero-results-alert-threshold must be >= 1, got: "
              + zeroResultsAlertThreshold);
    }
  }

  public int getMaxBackoffHours() {
    return maxBackoffHours;
  }

  public void setMaxBackoffHours(int maxBackoffHours) {
    this.maxBackoffHours = maxBackoffHours;
  }

  public int getRateLimitBackoffHours() {
    return rateLimitBackoffHours;
  }

  public void setRateLimitBackoffHours(int rateLimitBackoffHours) {
    this.rateLimitBackoffHours = rateLimitBackoffHours;
  }

  public int getNotFoundDisableThreshold() {
    return notFoundDisableThreshold;
  }

  public void setNotFoundDisableThreshold(int notFoundDisableThreshold) {
    this.notFoundDisableThreshold = notFoundDisableThreshold;
  }

  public int getZeroResultsAlertThreshold() {
    return zeroResultsAlertThreshold;
  }

  public void setZeroResultsAlertThreshold(int zeroResultsAlertThreshold) {
    this.zeroResultsAlertThreshold = zeroResultsAlertThreshold;
  }
}
