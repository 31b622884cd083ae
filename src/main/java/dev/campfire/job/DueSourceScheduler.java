package dev.campfire.job;

import dev.campfire.error.ConflictException;
import dev.campfire.error.NotFoundException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers jobs for sources whose next scheduled scrape is due or that were flagged for a rescan.
 * A source that got a job from another trigger in the meantime is skipped.
 */
@Component
public class DueSourceScheduler {

  private static final Logger log = LoggerFactory.getLogger(DueSourceScheduler.class);

  static final String SCHEDULER_ACTOR = "scheduler";

  private final JobService jobService;

  public DueSourceScheduler(JobService jobService) {
    this.jobService = jobService;
  }

  @Scheduled(
      fixedDelayString = "${campfire.jobs.due-source-interval}",
      initialDelayString = "${campfire.jobs.due-source-interval}")
  public void triggerDueSources() {
    int triggered = 0;
    for (UUID sourceId : jobService.findDueSourceIds()) {
      try {
        jobService.triggerJob(sourceId, SCHEDULER_ACTOR);
        triggered++;
      } catch (ConflictException | NotFoundException e) {
        log.debug("Skipping due source {}: {}", sourceId, e.getMessage());
      } catch (RuntimeException e) {
        log.error("Scheduled trigger of source {} failed", sourceId, e);
      }
    }
    if (triggered > 0) {
      log.info("Triggered {} scheduled job(s)", triggered);
    }
  }
}
