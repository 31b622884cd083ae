package dev.campfire.job;

import dev.campfire.error.ConflictException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically fails running jobs that outlived their timeout. */
@Component
public class JobTimeoutSweeper {

  private static final Logger log = LoggerFactory.getLogger(JobTimeoutSweeper.class);

  private final JobService jobService;

  public JobTimeoutSweeper(JobService jobService) {
    this.jobService = jobService;
  }

  @Scheduled(
      fixedDelayString = "${campfire.jobs.timeout-sweep-interval}",
      initialDelayString = "${campfire.jobs.timeout-sweep-interval}")
  public void sweep() {
    int timedOut = 0;
    for (UUID jobId : jobService.findTimedOutJobIds()) {
      try {
        jobService.timeOut(jobId);
        timedOut++;
      } catch (ConflictException | ObjectOptimisticLockingFailureException e) {
        // finished concurrently
        log.debug("Job {} finished before it could be timed out", jobId);
      } catch (RuntimeException e) {
        log.error("Timing out job {} failed", jobId, e);
      }
    }
    if (timedOut > 0) {
      log.info("Timeout sweep failed {} job(s)", timedOut);
    }
  }
}
