package dev.campfire.api;

import dev.campfire.job.ExtractionJob;
import dev.campfire.job.JobStatus;
import dev.campfire.source.FailureKind;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** REST view of an extraction job. The raw collaborator output is not included. */
public record JobView(
    UUID id,
    @Nullable UUID sourceId,
    JobStatus status,
    @Nullable String triggeredBy,
    Instant createdAt,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt,
    @Nullable Integer sessionsFound,
    @Nullable Integer sessionsCreated,
    @Nullable Integer sessionsUpdated,
    @Nullable Integer averageCompleteness,
    @Nullable FailureKind failureKind,
    @Nullable String errorMessage) {

  static JobView of(ExtractionJob job) {
    return new JobView(
        job.getId(),
        job.getSourceId(),
        job.getStatus(),
        job.getTriggeredBy(),
        job.getCreatedAt(),
        job.getStartedAt(),
        job.getCompletedAt(),
        job.getSessionsFound(),
        job.getSessionsCreated(),
        job.getSessionsUpdated(),
        job.getAverageCompleteness(),
        job.getFailureKind(),
        job.getErrorMessage());
  }
}
