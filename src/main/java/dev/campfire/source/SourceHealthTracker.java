package dev.campfire.source;

import dev.campfire.alert.AlertService;
import dev.campfire.alert.AlertSeverity;
import dev.campfire.alert.AlertType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies terminal job outcomes to a source's {@link Health} and scheduling state.
 *
 * <p>Called exactly once per terminal job, inside the job's terminal transaction, on a managed
 * {@link Source}; the changes are flushed with that transaction. Besides the counters it decides
 * when the source is next attempted and raises operator alerts:
 *
 * <ul>
 *   <li>structural failure - {@code needsRegeneration} is set, {@code SCRAPER_NEEDS_REGENERATION}
 *   <li>rate limited - fixed backoff, {@code RATE_LIMITED}
 *   <li>repeated 404 - the source is disabled, {@code SCRAPER_DISABLED}
 *   <li>failure streak reaching {@link HealthThresholds#DEGRADED_FAILURES} - {@code
 *       SCRAPER_DEGRADED}
 *   <li>repeated empty runs - {@code ZERO_RESULTS}
 * </ul>
 */
@Component
public class SourceHealthTracker {

  private static final Logger log = LoggerFactory.getLogger(SourceHealthTracker.class);

  static final String SYSTEM_ACTOR = "system";

  private final AlertService alertService;
  private final HealthProperties properties;
  private final Clock clock;

  public SourceHealthTracker(AlertService alertService, HealthProperties properties, Clock clock) {
    this.alertService = alertService;
    this.properties = properties;
    this.clock = clock;
  }

  public void recordOutcome(Source source, RunOutcome outcome) {
    Instant now = clock.instant();
    if (outcome.success()) {
      recordSuccess(source, outcome.recordsFound(), now);
    } else {
      recordFailure(source, outcome, now);
    }
  }

  private void recordSuccess(Source source, int recordsFound, Instant now) {
    Health health = source.getHealth();
    health.recordSuccess(now, recordsFound);
    source.markScraped(now);
    log.info(
        "Source {} run succeeded with {} records (success rate {}/{})",
        source.getId(),
        recordsFound,
        health.getSuccessfulRuns(),
        health.getTotalRuns());

    if (recordsFound == 0
        && health.getConsecutiveZeroResults() == properties.getZeroResultsAlertThreshold()) {
      alertService.raise(
          source.getId(),
          AlertType.ZERO_RESULTS,
          AlertSeverity.WARNING,
          "Source '%s' returned no sessions %d runs in a row"
              .formatted(source.getName(), health.getConsecutiveZeroResults()));
    }
  }

  private void recordFailure(Source source, RunOutcome outcome, Instant now) {
    Health health = source.getHealth();
    String error = outcome.error() != null ? outcome.error() : "Unknown error";
    FailureKind kind = outcome.failureKind() != null ? outcome.failureKind() : FailureKind.TRANSIENT;
    ErrorSignal signal = kind.requiresRegeneration() ? ErrorSignal.OTHER : ErrorSignal.of(error);

    health.recordFailure(now, error, signal == ErrorSignal.NOT_FOUND);
    log.warn(
        "Source {} run failed ({}, {} consecutive): {}",
        source.getId(),
        kind,
        health.getConsecutiveFailures(),
        error);

    if (kind.requiresRegeneration()) {
      source.scheduleNextAttempt(backoff(source, now));
      if (health.flagRegeneration()) {
        alertService.raise(
            source.getId(),
            AlertType.SCRAPER_NEEDS_REGENERATION,
            AlertSeverity.ERROR,
            "Source '%s' needs its extractor regenerated: %s".formatted(source.getName(), error));
      }
    } else if (signal == ErrorSignal.RATE_LIMITED) {
      source.scheduleNextAttempt(now.plus(Duration.ofHours(properties.getRateLimitBackoffHours())));
      alertService.raise(
          source.getId(),
          AlertType.RATE_LIMITED,
          AlertSeverity.INFO,
          "Source '%s' is rate limited, next attempt in %d hours"
              .formatted(source.getName(), properties.getRateLimitBackoffHours()));
    } else {
      source.scheduleNextAttempt(backoff(source, now));
      if (signal == ErrorSignal.NOT_FOUND
          && source.isActive()
          && health.getConsecutiveNotFound() >= properties.getNotFoundDisableThreshold()) {
        disable(source, now);
      }
    }

    if (health.getConsecutiveFailures() == HealthThresholds.DEGRADED_FAILURES) {
      alertService.raise(
          source.getId(),
          AlertType.SCRAPER_DEGRADED,
          AlertSeverity.WARNING,
          "Source '%s' has failed %d times in a row: %s"
              .formatted(source.getName(), health.getConsecutiveFailures(), error));
    }
  }

  private void disable(Source source, Instant now) {
    int notFound = source.getHealth().getConsecutiveNotFound();
    String reason = "Page not found (404) on %d consecutive runs".formatted(notFound);
    source.close(reason, SYSTEM_ACTOR, now);
    log.warn("Source {} disabled: {}", source.getId(), reason);
    alertService.raise(
        source.getId(),
        AlertType.SCRAPER_DISABLED,
        AlertSeverity.ERROR,
        "Source '%s' was disabled: %s".formatted(source.getName(), reason));
  }

  /** {@code min(frequency * 2^consecutiveFailures, maxBackoff)} hours from now. */
  Instant backoff(Source source, Instant now) {
    int failures = Math.min(source.getHealth().getConsecutiveFailures(), 20);
    long hours =
        Math.min(
            (long) source.getScrapeFrequencyHours() << failures, properties.getMaxBackoffHours());
    return now.plus(Duration.ofHours(hours));
  }
}
