package dev.campfire.job;

import dev.campfire.catalog.CatalogWriter;
import dev.campfire.catalog.SessionTarget;
import dev.campfire.catalog.UpsertOutcome;
import dev.campfire.source.AdditionalUrl;
import dev.campfire.source.FailureKind;
import dev.campfire.source.RunOutcome;
import dev.campfire.source.Source;
import dev.campfire.source.SourceHealthTracker;
import dev.campfire.source.SourceNotFoundException;
import dev.campfire.source.SourceRepository;
import dev.campfire.validation.ExtractedRecord;
import dev.campfire.validation.RecordValidator;
import dev.campfire.validation.SourceQuality;
import dev.campfire.validation.Validation;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Drives extraction jobs through their lifecycle.
 *
 * <p>A job is created and moved to {@code RUNNING} in the same transaction that takes its source's
 * lease, so a committed job always holds the lease. Every terminal transition (completion,
 * failure, cancellation, timeout) runs in one transaction that writes the job, the catalog and the
 * source health, and releases the lease.
 */
@Service
public class JobService {

  private static final Logger log = LoggerFactory.getLogger(JobService.class);

  static final String CLEANUP_MESSAGE = "Manually marked as failed (cleanup)";

  private final ExtractionJobRepository jobRepository;
  private final SourceRepository sourceRepository;
  private final RecordValidator recordValidator;
  private final CatalogWriter catalogWriter;
  private final SourceHealthTracker healthTracker;
  private final ApplicationEventPublisher eventPublisher;
  private final JobProperties properties;
  private final Clock clock;

  public JobService(
      ExtractionJobRepository jobRepository,
      SourceRepository sourceRepository,
      RecordValidator recordValidator,
      CatalogWriter catalogWriter,
      SourceHealthTracker healthTracker,
      ApplicationEventPublisher eventPublisher,
      JobProperties properties,
      Clock clock) {
    this.jobRepository = jobRepository;
    this.sourceRepository = sourceRepository;
    this.recordValidator = recordValidator;
    this.catalogWriter = catalogWriter;
    this.healthTracker = healthTracker;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Starts a job for a source. The job is dispatched to the extraction collaborator after commit.
   *
   * @throws SourceNotFoundException if the source does not exist
   * @throws JobConflictException if another job holds the source's lease; nothing is persisted
   */
  @Transactional
  public ExtractionJob triggerJob(UUID sourceId, String triggeredBy) {
    Source source =
        sourceRepository.findById(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
    ExtractionJob job = jobRepository.save(new ExtractionJob(sourceId, triggeredBy));

    if (sourceRepository.claimLease(sourceId, job.getId()) == 0) {
      log.info("Trigger of source {} by {} rejected: lease held", sourceId, triggeredBy);
      throw new JobConflictException(sourceId);
    }

    job.start(clock.instant());
    eventPublisher.publishEvent(
        new JobClaimedEvent(
            job.getId(),
            sourceId,
            source.getUrl(),
            source.getAdditionalUrls().stream().map(AdditionalUrl::url).toList(),
            source.getParsingNotes()));
    log.info("Job {} started for source {} (triggered by {})", job.getId(), sourceId, triggeredBy);
    return job;
  }

  /**
   * Applies the collaborator's result to a running job.
   *
   * <p>With records, each one is validated and merged into the catalog; the job completes even
   * when no record was found. With an error, the job fails with the verbatim error text.
   *
   * @throws JobNotFoundException if the job does not exist
   * @throws IllegalJobTransitionException if the job is already terminal
   */
  @Transactional
  public ExtractionJob submitExtractionResult(UUID jobId, ExtractionResult result) {
    ExtractionJob job = getJob(jobId);
    JobOutput output = new JobOutput(result.records(), result.logs());
    if (result.isFailure()) {
      return terminateWithFailure(
          job, result.effectiveFailureKind(), result.errorMessage(), output);
    }

    job.requireTransition(JobStatus.COMPLETED);
    Source source = loadSource(job);
    Instant now = clock.instant();
    SessionTarget target =
        new SessionTarget(source.getId(), source.getOrganizationId(), source.getCityId());

    List<Validation> validations = new ArrayList<>();
    int created = 0;
    int updated = 0;
    for (ExtractedRecord record : result.records()) {
      Validation validation = recordValidator.validate(record);
      validations.add(validation);
      if (validation.normalized().name().isEmpty()) {
        log.warn("Job {}: skipping record without a usable name: {}", jobId, record);
        continue;
      }
      if (catalogWriter.upsertSession(target, record, validation, now) == UpsertOutcome.CREATED) {
        created++;
      } else {
        updated++;
      }
    }

    SourceQuality quality = SourceQuality.of(validations);
    job.complete(now, output, new JobStats(validations.size(), created, updated, quality.score()));
    jobRepository.flush();

    healthTracker.recordOutcome(source, RunOutcome.success(validations.size()));
    if (!validations.isEmpty()) {
      source.recordQuality(quality);
    }
    sourceRepository.releaseLease(source.getId(), jobId);
    log.info(
        "Job {} completed: {} found, {} created, {} updated, completeness {}",
        jobId,
        validations.size(),
        created,
        updated,
        quality.score());
    return job;
  }

  /** Fails a running job as {@link FailureKind#CANCELLED}. */
  @Transactional
  public ExtractionJob cancelJob(UUID jobId, String actor) {
    ExtractionJob job = getJob(jobId);
    return terminateWithFailure(
        job, FailureKind.CANCELLED, "Cancelled by " + actor, new JobOutput(List.of(), List.of()));
  }

  /** Fails a running job as {@link FailureKind#TIMEOUT}. */
  @Transactional
  public ExtractionJob timeOut(UUID jobId) {
    ExtractionJob job = getJob(jobId);
    job.requireTransition(JobStatus.FAILED);
    Duration timeout = timeoutFor(loadSource(job));
    return terminateWithFailure(
        job,
        FailureKind.TIMEOUT,
        "Job exceeded its timeout of %d seconds".formatted(timeout.toSeconds()),
        new JobOutput(List.of(), List.of()));
  }

  /** Ids of running jobs whose start lies further back than their source's timeout. */
  @Transactional(readOnly = true)
  public List<UUID> findTimedOutJobIds() {
    List<ExtractionJob> running = jobRepository.findByStatus(JobStatus.RUNNING);
    if (running.isEmpty()) {
      return List.of();
    }
    Map<UUID, Source> sources =
        sourceRepository
            .findAllById(running.stream().map(ExtractionJob::getSourceId).distinct().toList())
            .stream()
            .collect(Collectors.toMap(Source::getId, Function.identity()));
    Instant now = clock.instant();
    return running.stream()
        .filter(
            job -> {
              Source source = sources.get(job.getSourceId());
              Duration timeout = source != null ? timeoutFor(source) : properties.defaultTimeout();
              return job.getStartedAt() != null
                  && job.getStartedAt().plus(timeout).isBefore(now);
            })
        .map(ExtractionJob::getId)
        .toList();
  }

  /**
   * Operator cleanup: fails every running job of a source and frees its lease, whoever holds it.
   *
   * @return the number of jobs failed
   */
  @Transactional
  public int releaseStuckJobs(UUID sourceId) {
    Source source =
        sourceRepository.findById(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
    Instant now = clock.instant();
    List<ExtractionJob> stuck = jobRepository.findBySourceIdAndStatus(sourceId, JobStatus.RUNNING);
    for (ExtractionJob job : stuck) {
      job.fail(now, FailureKind.CANCELLED, CLEANUP_MESSAGE, new JobOutput(List.of(), List.of()));
      healthTracker.recordOutcome(source, RunOutcome.failure(FailureKind.CANCELLED, CLEANUP_MESSAGE));
    }
    jobRepository.flush();
    sourceRepository.forceReleaseLease(sourceId);
    log.info("Released {} stuck job(s) on source {}", stuck.size(), sourceId);
    return stuck.size();
  }

  /** Active, due sources that are not running and do not need their extractor regenerated. */
  @Transactional(readOnly = true)
  public List<UUID> findDueSourceIds() {
    return sourceRepository
        .findDueForExtraction(clock.instant(), PageRequest.of(0, properties.dueSourceBatchSize()))
        .stream()
        .map(Source::getId)
        .toList();
  }

  @Transactional(readOnly = true)
  public ExtractionJob getJob(UUID jobId) {
    return jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  @Transactional(readOnly = true)
  public List<ExtractionJob> listJobsForSource(UUID sourceId, int limit) {
    return jobRepository.findBySourceIdOrderByCreatedAtDesc(sourceId, PageRequest.of(0, limit));
  }

  private ExtractionJob terminateWithFailure(
      ExtractionJob job, FailureKind kind, String error, JobOutput output) {
    job.requireTransition(JobStatus.FAILED);
    Source source = loadSource(job);
    job.fail(clock.instant(), kind, error, output);
    jobRepository.flush();

    healthTracker.recordOutcome(source, RunOutcome.failure(kind, error));
    sourceRepository.releaseLease(source.getId(), job.getId());
    log.warn("Job {} failed ({}): {}", job.getId(), kind, error);
    return job;
  }

  private Source loadSource(ExtractionJob job) {
    return sourceRepository
        .findById(job.getSourceId())
        .orElseThrow(() -> new SourceNotFoundException(job.getSourceId()));
  }

  private Duration timeoutFor(Source source) {
    Integer override = source.getExtractionTimeoutSeconds();
    return override != null ? Duration.ofSeconds(override) : properties.defaultTimeout();
  }
}
