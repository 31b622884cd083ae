package dev.campfire.job;

import dev.campfire.source.FailureKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * One extraction attempt against a {@link dev.campfire.source.Source}.
 *
 * <p>State only changes through {@link #start}, {@link #complete} and {@link #fail}, each checked
 * against {@link JobStatus#canTransitionTo}. Concurrent terminal transitions (callback, timeout,
 * cancel) are serialized by the optimistic {@code version}: the second writer fails on flush.
 *
 * <p>Maps to the {@code extraction_jobs} table managed by Flyway migrations.
 */
@Entity
@Table(name = "extraction_jobs")
public class ExtractionJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_id")
    private UUID sourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(name = "triggered_by")
    private String triggeredBy;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "raw_output")
    private JobOutput rawOutput;

    @Column(name = "sessions_found")
    private Integer sessionsFound;

    @Column(name = "sessions_created")
    private Integer sessionsCreated;

    @Column(name = "sessions_updated")
    private Integer sessionsUpdated;

    @Column(name = "average_completeness")
    private Integer averageCompleteness;

    @Column(name = "error_message")
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind")
    private FailureKind failureKind;

    @Version
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ExtractionJob() {
        // JPA requires no-arg constructor
    }

    public ExtractionJob(UUID sourceId, String triggeredBy) {
        this.sourceId = sourceId;
        this.triggeredBy = triggeredBy;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    void start(Instant at) {
        transition(JobStatus.RUNNING);
        this.startedAt = at;
    }

    void complete(Instant at, JobOutput output, JobStats stats) {
        transition(JobStatus.COMPLETED);
        this.completedAt = at;
        this.rawOutput = output;
        this.sessionsFound = stats.found();
        this.sessionsCreated = stats.created();
        this.sessionsUpdated = stats.updated();
        this.averageCompleteness = stats.averageCompleteness();
    }

    void fail(Instant at, FailureKind kind, String error, JobOutput output) {
        transition(JobStatus.FAILED);
        this.completedAt = at;
        this.failureKind = kind;
        this.errorMessage = error;
        this.rawOutput = output;
    }

    /** @throws IllegalJobTransitionException unless the job may move to {@code target} */
    void requireTransition(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalJobTransitionException(id, status, target);
        }
    }

    private void transition(JobStatus target) {
        requireTransition(target);
        this.status = target;
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public JobStatus getStatus() {
        return status;
    }

    public String getTriggeredBy() {
        return triggeredBy;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public JobOutput getRawOutput() {
        return rawOutput;
    }

    public Integer getSessionsFound() {
        return sessionsFound;
    }

    public Integer getSessionsCreated() {
        return sessionsCreated;
    }

    public Integer getSessionsUpdated() {
        return sessionsUpdated;
    }

    public Integer getAverageCompleteness() {
        return averageCompleteness;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
