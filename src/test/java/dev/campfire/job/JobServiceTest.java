package dev.campfire.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import dev.campfire.catalog.CatalogWriter;
import dev.campfire.catalog.SessionTarget;
import dev.campfire.catalog.UpsertOutcome;
import dev.campfire.fixture.Entities;
import dev.campfire.fixture.ExtractedRecordBuilder;
import dev.campfire.fixture.SourceBuilder;
import dev.campfire.source.AdditionalUrl;
import dev.campfire.source.FailureKind;
import dev.campfire.source.RunOutcome;
import dev.campfire.source.Source;
import dev.campfire.source.SourceHealthTracker;
import dev.campfire.source.SourceNotFoundException;
import dev.campfire.source.SourceRepository;
import dev.campfire.validation.QualityTier;
import dev.campfire.validation.RecordValidator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class JobServiceTest {

  private static final Instant NOW = Instant.parse("2025-05-01T12:00:00Z");

  @Mock ExtractionJobRepository jobRepository;

  @Mock SourceRepository sourceRepository;

  @Mock CatalogWriter catalogWriter;

  @Mock SourceHealthTracker healthTracker;

  @Mock ApplicationEventPublisher eventPublisher;

  JobService jobService;

  @BeforeEach
  void setUp() {
    JobProperties properties =
        new JobProperties(Duration.ofMinutes(10), Duration.ofMinutes(1), Duration.ofMinutes(5), 25);
    jobService =
        new JobService(
            jobRepository,
            sourceRepository,
            new RecordValidator(),
            catalogWriter,
            healthTracker,
            eventPublisher,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private ExtractionJob runningJob(Source source, Instant startedAt) {
    ExtractionJob job = Entities.withId(new ExtractionJob(source.getId(), "ops"));
    job.start(startedAt);
    return job;
  }

  private ExtractionJob storedRunningJob(Source source) {
    ExtractionJob job = runningJob(source, NOW.minusSeconds(60));
    given(jobRepository.findById(job.getId())).willReturn(Optional.of(job));
    return job;
  }

  private void stored(Source source) {
    given(sourceRepository.findById(source.getId())).willReturn(Optional.of(source));
  }

  @Nested
  class Trigger {

    @Test
    void takes_the_lease_and_announces_the_job() {
      Source source = new SourceBuilder().build();
      source.setAdditionalUrls(
          List.of(new AdditionalUrl("https://campsunshine.example.com/teens", "teens")));
      stored(source);
      given(jobRepository.save(any(ExtractionJob.class)))
          .willAnswer(inv -> Entities.withId(inv.getArgument(0, ExtractionJob.class)));
      given(sourceRepository.claimLease(eq(source.getId()), any(UUID.class))).willReturn(1);

      ExtractionJob job = jobService.triggerJob(source.getId(), "alice");

      assertThat(job.getStatus()).isEqualTo(JobStatus.RUNNING);
      assertThat(job.getStartedAt()).isEqualTo(NOW);
      assertThat(job.getTriggeredBy()).isEqualTo("alice");
      then(sourceRepository).should().claimLease(source.getId(), job.getId());

      ArgumentCaptor<JobClaimedEvent> event = ArgumentCaptor.forClass(JobClaimedEvent.class);
      then(eventPublisher).should().publishEvent(event.capture());
      assertThat(event.getValue().jobId()).isEqualTo(job.getId());
      assertThat(event.getValue().url()).isEqualTo(source.getUrl());
      assertThat(event.getValue().additionalUrls())
          .containsExactly("https://campsunshine.example.com/teens");
    }

    @Test
    void held_lease_is_a_conflict_and_nothing_is_announced() {
      Source source = new SourceBuilder().runningJobId(UUID.randomUUID()).build();
      stored(source);
      given(jobRepository.save(any(ExtractionJob.class)))
          .willAnswer(inv -> Entities.withId(inv.getArgument(0, ExtractionJob.class)));
      given(sourceRepository.claimLease(eq(source.getId()), any(UUID.class))).willReturn(0);

      assertThatThrownBy(() -> jobService.triggerJob(source.getId(), "alice"))
          .isInstanceOf(JobConflictException.class)
          .hasMessageContaining(source.getId().toString());
      then(eventPublisher).shouldHaveNoInteractions();
    }

    @Test
    void unknown_source_is_not_found() {
      UUID id = UUID.randomUUID();
      given(sourceRepository.findById(id)).willReturn(Optional.empty());

      assertThatThrownBy(() -> jobService.triggerJob(id, "alice"))
          .isInstanceOf(SourceNotFoundException.class);
      then(jobRepository).shouldHaveNoInteractions();
    }
  }

  @Nested
  class Completion {

    @Test
    void validates_merges_and_scores_the_batch() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);
      given(catalogWriter.upsertSession(any(), any(), any(), any()))
          .willReturn(UpsertOutcome.CREATED, UpsertOutcome.UPDATED);

      jobService.submitExtractionResult(
          job.getId(),
          ExtractionResult.success(
              List.of(
                  ExtractedRecordBuilder.complete().build(),
                  ExtractedRecordBuilder.complete().withoutAgeOrGrade().build())));

      assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(job.getCompletedAt()).isEqualTo(NOW);
      assertThat(job.getSessionsFound()).isEqualTo(2);
      assertThat(job.getSessionsCreated()).isEqualTo(1);
      assertThat(job.getSessionsUpdated()).isEqualTo(1);
      assertThat(job.getAverageCompleteness()).isEqualTo(92);
      assertThat(job.getRawOutput().records()).hasSize(2);
      assertThat(source.getDataQualityScore()).isEqualTo(92);
      assertThat(source.getQualityTier()).isEqualTo(QualityTier.HIGH);
      then(catalogWriter)
          .should(times(2))
          .upsertSession(eq(new SessionTarget(source.getId(), null, null)), any(), any(), eq(NOW));
      then(healthTracker).should().recordOutcome(source, RunOutcome.success(2));
      then(sourceRepository).should().releaseLease(source.getId(), job.getId());
    }

    @Test
    void empty_result_still_completes_without_touching_quality() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);

      jobService.submitExtractionResult(job.getId(), ExtractionResult.success(List.of()));

      assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
      assertThat(job.getSessionsFound()).isZero();
      assertThat(job.getAverageCompleteness()).isZero();
      assertThat(source.getDataQualityScore()).isNull();
      then(catalogWriter).shouldHaveNoInteractions();
      then(healthTracker).should().recordOutcome(source, RunOutcome.success(0));
      then(sourceRepository).should().releaseLease(source.getId(), job.getId());
    }

    @Test
    void records_without_a_name_are_counted_but_not_stored() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);
      given(catalogWriter.upsertSession(any(), any(), any(), any()))
          .willReturn(UpsertOutcome.CREATED);

      jobService.submitExtractionResult(
          job.getId(),
          ExtractionResult.success(
              List.of(
                  ExtractedRecordBuilder.complete().name(null).build(),
                  ExtractedRecordBuilder.complete().build())));

      assertThat(job.getSessionsFound()).isEqualTo(2);
      assertThat(job.getSessionsCreated()).isEqualTo(1);
      assertThat(job.getSessionsUpdated()).isZero();
      then(catalogWriter).should(times(1)).upsertSession(any(), any(), any(), any());
    }

    @Test
    void finished_job_rejects_a_second_result() {
      Source source = new SourceBuilder().build();
      ExtractionJob job = runningJob(source, NOW.minusSeconds(60));
      job.complete(NOW, new JobOutput(List.of(), List.of()), new JobStats(0, 0, 0, 0));
      given(jobRepository.findById(job.getId())).willReturn(Optional.of(job));

      assertThatThrownBy(
              () -> jobService.submitExtractionResult(job.getId(), ExtractionResult.success(List.of())))
          .isInstanceOf(IllegalJobTransitionException.class);
      assertThatThrownBy(
              () ->
                  jobService.submitExtractionResult(
                      job.getId(), ExtractionResult.failure(FailureKind.TRANSIENT, "late")))
          .isInstanceOf(IllegalJobTransitionException.class);
      then(healthTracker).shouldHaveNoInteractions();
      then(sourceRepository).should(never()).releaseLease(any(), any());
    }

    @Test
    void unknown_job_is_not_found() {
      UUID id = UUID.randomUUID();
      given(jobRepository.findById(id)).willReturn(Optional.empty());

      assertThatThrownBy(() -> jobService.submitExtractionResult(id, ExtractionResult.success(List.of())))
          .isInstanceOf(JobNotFoundException.class);
    }
  }

  @Nested
  class Failure {

    @Test
    void structural_failure_keeps_its_kind_and_error_text() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);

      jobService.submitExtractionResult(
          job.getId(),
          ExtractionResult.failure(FailureKind.STRUCTURAL, "Selector .session-card matched nothing"));

      assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
      assertThat(job.getFailureKind()).isEqualTo(FailureKind.STRUCTURAL);
      assertThat(job.getErrorMessage()).isEqualTo("Selector .session-card matched nothing");
      then(healthTracker)
          .should()
          .recordOutcome(
              source,
              RunOutcome.failure(FailureKind.STRUCTURAL, "Selector .session-card matched nothing"));
      then(sourceRepository).should().releaseLease(source.getId(), job.getId());
      then(catalogWriter).shouldHaveNoInteractions();
    }

    @Test
    void structural_kind_without_error_text_still_fails_the_job() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);

      jobService.submitExtractionResult(
          job.getId(), new ExtractionResult(null, null, FailureKind.STRUCTURAL, null));

      assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
      assertThat(job.getFailureKind()).isEqualTo(FailureKind.STRUCTURAL);
      assertThat(job.getErrorMessage())
          .isEqualTo("Extractor reported a STRUCTURAL failure without details");
      then(healthTracker)
          .should()
          .recordOutcome(
              source,
              RunOutcome.failure(
                  FailureKind.STRUCTURAL, "Extractor reported a STRUCTURAL failure without details"));
      then(catalogWriter).shouldHaveNoInteractions();
    }

    @Test
    void reported_kinds_other_than_structural_become_transient() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);

      jobService.submitExtractionResult(
          job.getId(), new ExtractionResult(null, "HTTP 503", FailureKind.CANCELLED, null));

      assertThat(job.getFailureKind()).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void cancel_names_the_actor() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);

      jobService.cancelJob(job.getId(), "alice");

      assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
      assertThat(job.getFailureKind()).isEqualTo(FailureKind.CANCELLED);
      assertThat(job.getErrorMessage()).isEqualTo("Cancelled by alice");
      then(sourceRepository).should().releaseLease(source.getId(), job.getId());
    }

    @Test
    void timeout_uses_the_source_override() {
      Source source = new SourceBuilder().extractionTimeoutSeconds(900).build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);

      jobService.timeOut(job.getId());

      assertThat(job.getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
      assertThat(job.getErrorMessage()).isEqualTo("Job exceeded its timeout of 900 seconds");
    }

    @Test
    void timeout_falls_back_to_the_default() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob job = storedRunningJob(source);

      jobService.timeOut(job.getId());

      assertThat(job.getErrorMessage()).isEqualTo("Job exceeded its timeout of 600 seconds");
    }

    @Test
    void finished_job_cannot_be_cancelled() {
      Source source = new SourceBuilder().build();
      ExtractionJob job = runningJob(source, NOW.minusSeconds(60));
      job.fail(NOW, FailureKind.TRANSIENT, "boom", new JobOutput(List.of(), List.of()));
      given(jobRepository.findById(job.getId())).willReturn(Optional.of(job));

      assertThatThrownBy(() -> jobService.cancelJob(job.getId(), "alice"))
          .isInstanceOf(IllegalJobTransitionException.class);
      assertThat(job.getErrorMessage()).isEqualTo("boom");
    }
  }

  @Nested
  class Sweeps {

    @Test
    void finds_jobs_past_their_source_timeout() {
      Source defaults = new SourceBuilder().build();
      Source patient = new SourceBuilder().extractionTimeoutSeconds(1800).build();
      ExtractionJob late = runningJob(defaults, NOW.minus(Duration.ofMinutes(11)));
      ExtractionJob fine = runningJob(patient, NOW.minus(Duration.ofMinutes(11)));
      ExtractionJob fresh = runningJob(defaults, NOW.minus(Duration.ofMinutes(2)));
      given(jobRepository.findByStatus(JobStatus.RUNNING)).willReturn(List.of(late, fine, fresh));
      given(sourceRepository.findAllById(any())).willReturn(List.of(defaults, patient));

      assertThat(jobService.findTimedOutJobIds()).containsExactly(late.getId());
    }

    @Test
    void nothing_running_means_nothing_timed_out() {
      given(jobRepository.findByStatus(JobStatus.RUNNING)).willReturn(List.of());

      assertThat(jobService.findTimedOutJobIds()).isEmpty();
      then(sourceRepository).shouldHaveNoInteractions();
    }

    @Test
    void cleanup_fails_every_running_job_and_frees_the_lease() {
      Source source = new SourceBuilder().build();
      stored(source);
      ExtractionJob first = runningJob(source, NOW.minus(Duration.ofHours(3)));
      ExtractionJob second = runningJob(source, NOW.minus(Duration.ofHours(2)));
      given(jobRepository.findBySourceIdAndStatus(source.getId(), JobStatus.RUNNING))
          .willReturn(List.of(first, second));

      int released = jobService.releaseStuckJobs(source.getId());

      assertThat(released).isEqualTo(2);
      assertThat(List.of(first, second))
          .allSatisfy(
              job -> {
                assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
                assertThat(job.getErrorMessage()).isEqualTo(JobService.CLEANUP_MESSAGE);
              });
      then(healthTracker)
          .should(times(2))
          .recordOutcome(source, RunOutcome.failure(FailureKind.CANCELLED, JobService.CLEANUP_MESSAGE));
      then(sourceRepository).should().forceReleaseLease(source.getId());
    }

    @Test
    void due_sources_are_read_in_one_batch() {
      Source due = new SourceBuilder().build();
      given(sourceRepository.findDueForExtraction(NOW, PageRequest.of(0, 25)))
          .willReturn(List.of(due));

      assertThat(jobService.findDueSourceIds()).containsExactly(due.getId());
    }
  }
}
