package dev.campfire.source;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.time.Instant;

/**
 * Rolling reliability counters of a {@link Source}, embedded in the {@code sources} row.
 *
 * <p>Counters only move through {@link #recordSuccess} and {@link #recordFailure}, which keeps
 * {@code successfulRuns <= totalRuns} and {@code consecutiveFailures >= 0}. {@code
 * needsRegeneration} is sticky: nothing but {@link #clearRegeneration()} resets it.
 */
@Embeddable
public class Health {

    @Column(name = "total_runs", nullable = false)
    private int totalRuns;

    @Column(name = "successful_runs", nullable = false)
    private int successfulRuns;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures;

    @Column(name = "consecutive_not_found", nullable = false)
    private int consecutiveNotFound;

    @Column(name = "consecutive_zero_results", nullable = false)
    private int consecutiveZeroResults;

    @Column(name = "last_success_at")
    private Instant lastSuccessAt;

    @Column(name = "last_failure_at")
    private Instant lastFailureAt;

    @Column(name = "last_error")
    private String lastError;

    @Column(name = "needs_regeneration", nullable = false)
    private boolean needsRegeneration;

    void recordSuccess(Instant at, int recordsFound) {
        totalRuns++;
        successfulRuns++;
        consecutiveFailures = 0;
        consecutiveNotFound = 0;
        consecutiveZeroResults = recordsFound == 0 ? consecutiveZeroResults + 1 : 0;
        lastSuccessAt = at;
    }

    void recordFailure(Instant at, String error, boolean notFound) {
        totalRuns++;
        consecutiveFailures++;
        consecutiveNotFound = notFound ? consecutiveNotFound + 1 : 0;
        lastFailureAt = at;
        lastError = error;
    }

    /** @return true when the flag was newly raised */
    boolean flagRegeneration() {
        boolean raised = !needsRegeneration;
        needsRegeneration = true;
        return raised;
    }

    void clearRegeneration() {
        needsRegeneration = false;
    }

    void resetStreaks() {
        consecutiveFailures = 0;
        consecutiveNotFound = 0;
    }

    /** Exactly {@code successfulRuns / totalRuns}; 0 before the first run. */
    public double getSuccessRate() {
        return totalRuns == 0 ? 0.0 : (double) successfulRuns / totalRuns;
    }

    public int getTotalRuns() {
        return totalRuns;
    }

    public int getSuccessfulRuns() {
        return successfulRuns;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public int getConsecutiveNotFound() {
        return consecutiveNotFound;
    }

    public int getConsecutiveZeroResults() {
        return consecutiveZeroResults;
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    public Instant getLastFailureAt() {
        return lastFailureAt;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isNeedsRegeneration() {
        return needsRegeneration;
    }
}
