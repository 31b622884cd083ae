package dev.campfire.source;

import dev.campfire.validation.QualityTier;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Health snapshot of one source with its computed classification. */
public record SourceHealthView(
    UUID sourceId,
    String name,
    HealthStatus status,
    int totalRuns,
    int successfulRuns,
    double successRate,
    int consecutiveFailures,
    int consecutiveZeroResults,
    @Nullable Instant lastSuccessAt,
    @Nullable Instant lastFailureAt,
    @Nullable String lastError,
    boolean needsRegeneration,
    boolean needsRescan,
    boolean active,
    @Nullable String closureReason,
    @Nullable Instant nextScheduledScrapeAt,
    @Nullable Integer dataQualityScore,
    @Nullable QualityTier qualityTier,
    @Nullable UUID runningJobId) {

  public static SourceHealthView of(Source source) {
    Health health = source.getHealth();
    return new SourceHealthView(
        source.getId(),
        source.getName(),
        HealthStatus.classify(health),
        health.getTotalRuns(),
        health.getSuccessfulRuns(),
        health.getSuccessRate(),
        health.getConsecutiveFailures(),
        health.getConsecutiveZeroResults(),
        health.getLastSuccessAt(),
        health.getLastFailureAt(),
        health.getLastError(),
        health.isNeedsRegeneration(),
        source.isNeedsRescan(),
        source.isActive(),
        source.getClosureReason(),
        source.getNextScheduledScrapeAt(),
        source.getDataQualityScore(),
        source.getQualityTier(),
        source.getRunningJobId());
  }
}
