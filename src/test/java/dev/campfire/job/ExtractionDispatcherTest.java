package dev.campfire.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import dev.campfire.source.FailureKind;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ExtractionDispatcherTest {

  @Mock ExtractorClient extractorClient;

  @Mock JobService jobService;

  ExtractionDispatcher dispatcher;

  final JobClaimedEvent event =
      new JobClaimedEvent(
          UUID.randomUUID(),
          UUID.randomUUID(),
          "https://campsunshine.example.com/summer",
          List.of("https://campsunshine.example.com/teens"),
          "Sessions are grouped by week");

  @BeforeEach
  void setUp() {
    ExtractorProperties properties =
        new ExtractorProperties(
            "http://extractor:8090",
            "http://campfire:8080/",
            5000,
            30000,
            2,
            new ExtractorProperties.Retry(3, 1000, 2.0));
    dispatcher = new ExtractionDispatcher(extractorClient, jobService, properties, Runnable::run);
  }

  @Test
  void sends_the_job_with_its_callback_url() {
    given(extractorClient.submit(any())).willReturn(DispatchResult.ok());

    dispatcher.onJobClaimed(event);

    ArgumentCaptor<ExtractionRequest> request = ArgumentCaptor.forClass(ExtractionRequest.class);
    then(extractorClient).should().submit(request.capture());
    assertThat(request.getValue().callbackUrl())
        .isEqualTo("http://campfire:8080/api/jobs/" + event.jobId() + "/result");
    assertThat(request.getValue().additionalUrls()).isEqualTo(event.additionalUrls());
    assertThat(request.getValue().parsingNotes()).isEqualTo("Sessions are grouped by week");
    then(jobService).shouldHaveNoInteractions();
  }

  @Test
  void rejected_dispatch_fails_the_job_as_transient() {
    given(extractorClient.submit(any())).willReturn(DispatchResult.failed("503 Service Unavailable"));

    dispatcher.dispatch(event);

    then(jobService)
        .should()
        .submitExtractionResult(
            event.jobId(),
            ExtractionResult.failure(
                FailureKind.TRANSIENT, "Extractor unavailable: 503 Service Unavailable"));
  }

  @Test
  void unexpected_client_error_fails_the_job_too() {
    given(extractorClient.submit(any())).willThrow(new IllegalStateException("no route"));

    dispatcher.dispatch(event);

    ArgumentCaptor<ExtractionResult> result = ArgumentCaptor.forClass(ExtractionResult.class);
    then(jobService).should().submitExtractionResult(eq(event.jobId()), result.capture());
    assertThat(result.getValue().effectiveFailureKind()).isEqualTo(FailureKind.TRANSIENT);
    assertThat(result.getValue().error()).isEqualTo("Extractor unavailable: no route");
  }

  @Test
  void job_finished_in_the_meantime_is_left_alone() {
    given(extractorClient.submit(any())).willReturn(DispatchResult.failed("timeout"));
    given(jobService.submitExtractionResult(eq(event.jobId()), any()))
        .willThrow(new IllegalJobTransitionException(event.jobId(), JobStatus.FAILED, JobStatus.FAILED));

    dispatcher.dispatch(event);

    then(jobService).should().submitExtractionResult(eq(event.jobId()), any());
  }
}
