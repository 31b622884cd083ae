package dev.campfire.source;

import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** One row of the operator source list. */
public record SourceSummary(
    UUID id,
    String name,
    String url,
    String domain,
    boolean active,
    HealthStatus healthStatus,
    double successRate,
    int consecutiveFailures,
    boolean needsRegeneration,
    boolean hasActiveSessions,
    @Nullable Instant lastScrapedAt,
    @Nullable UUID runningJobId) {

  public static SourceSummary of(Source source, boolean hasActiveSessions) {
    Health health = source.getHealth();
    return new SourceSummary(
        source.getId(),
        source.getName(),
        source.getUrl(),
        source.getDomain(),
        source.isActive(),
        HealthStatus.classify(health),
        health.getSuccessRate(),
        health.getConsecutiveFailures(),
        health.isNeedsRegeneration(),
        hasActiveSessions,
        source.getLastScrapedAt(),
        source.getRunningJobId());
  }
}
