package dev.campfire.job;

import dev.campfire.BaseIntegrationTest;
import dev.campfire.catalog.CampSession;
import dev.campfire.catalog.CampSessionRepository;
import dev.campfire.fixture.ExtractedRecordBuilder;
import dev.campfire.source.FailureKind;
import dev.campfire.source.NewSource;
import dev.campfire.source.Source;
import dev.campfire.source.SourceRepository;
import dev.campfire.source.SourceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

class JobLifecycleIT extends BaseIntegrationTest {

    @MockitoBean
    ExtractorClient extractorClient;

    @Autowired
    SourceService sourceService;

    @Autowired
    JobService jobService;

    @Autowired
    SourceRepository sourceRepository;

    @Autowired
    ExtractionJobRepository jobRepository;

    @Autowired
    CampSessionRepository sessionRepository;

    @BeforeEach
    void acceptDispatches() {
        given(extractorClient.submit(any())).willReturn(DispatchResult.ok());
    }

    @Test
    void concurrent_triggers_start_exactly_one_job() throws Exception {
        Source source = newSource();
        CountDownLatch start = new CountDownLatch(1);
        Callable<ExtractionJob> trigger = () -> {
            start.await();
            return jobService.triggerJob(source.getId(), "race");
        };

        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<ExtractionJob>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(trigger));
            }
            start.countDown();

            int started = 0;
            int conflicts = 0;
            for (Future<ExtractionJob> future : futures) {
                try {
                    future.get();
                    started++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(JobConflictException.class);
                    conflicts++;
                }
            }
            assertThat(started).isEqualTo(1);
            assertThat(conflicts).isEqualTo(3);
        } finally {
            pool.shutdownNow();
        }

        assertThat(jobRepository.findBySourceIdAndStatus(source.getId(), JobStatus.RUNNING)).hasSize(1);
        assertThat(sourceRepository.findById(source.getId()).orElseThrow().getRunningJobId()).isNotNull();
    }

    @Test
    void result_callback_completes_the_job_and_stores_sessions() {
        Source source = newSource();
        ExtractionJob job = jobService.triggerJob(source.getId(), "it");

        ExtractionResult result = new ExtractionResult(
                List.of(
                        ExtractedRecordBuilder.complete().build(),
                        ExtractedRecordBuilder.complete()
                                .name("Nature Explorers")
                                .startDate("2025-07-07")
                                .endDate("2025-07-11")
                                .build()),
                null,
                null,
                List.of("fetched 1 page"));
        ExtractionJob completed = jobService.submitExtractionResult(job.getId(), result);

        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.getSessionsFound()).isEqualTo(2);
        assertThat(completed.getSessionsCreated()).isEqualTo(2);

        List<CampSession> sessions = sessionRepository.findBySourceId(source.getId());
        assertThat(sessions).extracting(CampSession::getName)
                .containsExactlyInAnyOrder("Lego Robotics Week", "Nature Explorers");

        Source reloaded = sourceRepository.findById(source.getId()).orElseThrow();
        assertThat(reloaded.getRunningJobId()).isNull();
        assertThat(reloaded.getHealth().getTotalRuns()).isEqualTo(1);
        assertThat(reloaded.getHealth().getSuccessfulRuns()).isEqualTo(1);
        assertThat(reloaded.getDataQualityScore()).isNotNull();
    }

    @Test
    void replaying_the_callback_updates_instead_of_duplicating() {
        Source source = newSource();
        ExtractionResult result = ExtractionResult.success(List.of(ExtractedRecordBuilder.complete().build()));

        jobService.submitExtractionResult(jobService.triggerJob(source.getId(), "it").getId(), result);
        ExtractionJob second =
                jobService.submitExtractionResult(jobService.triggerJob(source.getId(), "it").getId(), result);

        assertThat(second.getSessionsCreated()).isZero();
        assertThat(second.getSessionsUpdated()).isEqualTo(1);
        assertThat(sessionRepository.findBySourceId(source.getId())).hasSize(1);
    }

    @Test
    void structural_callback_without_error_text_flags_regeneration() {
        Source source = newSource();
        ExtractionJob job = jobService.triggerJob(source.getId(), "it");

        ExtractionJob failed = jobService.submitExtractionResult(
                job.getId(), new ExtractionResult(null, null, FailureKind.STRUCTURAL, null));

        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getFailureKind()).isEqualTo(FailureKind.STRUCTURAL);
        Source reloaded = sourceRepository.findById(source.getId()).orElseThrow();
        assertThat(reloaded.getHealth().isNeedsRegeneration()).isTrue();
        assertThat(reloaded.getHealth().getConsecutiveFailures()).isEqualTo(1);
        assertThat(reloaded.getRunningJobId()).isNull();
    }

    @Test
    void late_callback_after_cancel_is_rejected_and_frees_the_source() {
        Source source = newSource();
        ExtractionJob job = jobService.triggerJob(source.getId(), "it");

        ExtractionJob cancelled = jobService.cancelJob(job.getId(), "alice");

        assertThat(cancelled.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(cancelled.getFailureKind()).isEqualTo(FailureKind.CANCELLED);
        assertThatThrownBy(() -> jobService.submitExtractionResult(
                        job.getId(), ExtractionResult.success(List.of())))
                .isInstanceOf(IllegalJobTransitionException.class);
        assertThat(sourceRepository.findById(source.getId()).orElseThrow().getRunningJobId()).isNull();
        assertThat(jobService.triggerJob(source.getId(), "it").getStatus()).isEqualTo(JobStatus.RUNNING);
    }

    private Source newSource() {
        String host = "lifecycle-" + UUID.randomUUID() + ".example.com";
        return sourceService.createSource(NewSource.of("Lifecycle Camps", "https://" + host + "/summer", null, null));
    }
}
