package dev.campfire.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * HTTP client of the extraction collaborator. Submission is asynchronous on the collaborator side:
 * a 2xx answer only means the job was accepted, and the records arrive later through the job
 * result callback.
 */
@Service
public class ExtractorClient {

  private static final Logger log = LoggerFactory.getLogger(ExtractorClient.class);

  private final RestClient restClient;

  public ExtractorClient(@Qualifier("extractorRestClient") RestClient restClient) {
    this.restClient = restClient;
  }

  /** Submits a job. Retries on {@link RestClientException} with exponential backoff. */
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${campfire.extractor.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${campfire.extractor.retry.delay-ms}",
              multiplierExpression = "${campfire.extractor.retry.multiplier}"))
  public DispatchResult submit(ExtractionRequest request) {
    restClient.post().uri("/jobs").body(request).retrieve().toBodilessEntity();
    log.debug("Extractor accepted job {} for {}", request.jobId(), request.url());
    return DispatchResult.ok();
  }

  @Recover
  DispatchResult recoverSubmit(RestClientException e, ExtractionRequest request) {
    log.warn("Extractor rejected job {} after retries: {}", request.jobId(), e.getMessage());
    return DispatchResult.failed(e.getMessage());
  }
}
