package dev.campfire.job;

import dev.campfire.error.ConflictException;
import dev.campfire.source.FailureKind;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Hands claimed jobs to the extraction collaborator once the trigger transaction has committed.
 *
 * <p>Dispatch runs on the bounded {@code extractionDispatchExecutor}. A job the collaborator never
 * accepts is failed as {@link FailureKind#TRANSIENT} so that its lease is released.
 */
@Component
public class ExtractionDispatcher {

  private static final Logger log = LoggerFactory.getLogger(ExtractionDispatcher.class);

  private final ExtractorClient extractorClient;
  private final JobService jobService;
  private final ExtractorProperties properties;
  private final Executor executor;

  public ExtractionDispatcher(
      ExtractorClient extractorClient,
      JobService jobService,
      ExtractorProperties properties,
      @Qualifier("extractionDispatchExecutor") Executor executor) {
    this.extractorClient = extractorClient;
    this.jobService = jobService;
    this.properties = properties;
    this.executor = executor;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onJobClaimed(JobClaimedEvent event) {
    executor.execute(() -> dispatch(event));
  }

  void dispatch(JobClaimedEvent event) {
    ExtractionRequest request =
        new ExtractionRequest(
            event.jobId(),
            event.sourceId(),
            event.url(),
            event.additionalUrls(),
            event.parsingNotes(),
            callbackUrl(event));
    DispatchResult result;
    try {
      result = extractorClient.submit(request);
    } catch (RuntimeException e) {
      log.error("Dispatch of job {} failed unexpectedly", event.jobId(), e);
      result = DispatchResult.failed(e.getMessage());
    }
    if (result.accepted()) {
      log.info("Job {} dispatched for {}", event.jobId(), event.url());
      return;
    }
    try {
      jobService.submitExtractionResult(
          event.jobId(),
          ExtractionResult.failure(
              FailureKind.TRANSIENT, "Extractor unavailable: " + result.error()));
    } catch (ConflictException | ObjectOptimisticLockingFailureException e) {
      log.info("Job {} already finished before its dispatch failure was recorded", event.jobId());
    }
  }

  private String callbackUrl(JobClaimedEvent event) {
    String base = properties.callbackBaseUrl();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base + "/api/jobs/" + event.jobId() + "/result";
  }
}
