package dev.campfire.dedup;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Sweeps the whole catalog on a fixed delay. Organizations go first because merging them moves
 * camps and locations under one organization, which creates new camp and location duplicates.
 */
@Component
public class DedupScheduler {

  private static final Logger log = LoggerFactory.getLogger(DedupScheduler.class);

  static final List<DedupKind> SWEEP_ORDER =
      List.of(DedupKind.ORGANIZATIONS, DedupKind.CAMPS, DedupKind.LOCATIONS);

  private final DeduplicationService deduplicationService;

  public DedupScheduler(DeduplicationService deduplicationService) {
    this.deduplicationService = deduplicationService;
  }

  @Scheduled(
      fixedDelayString = "${campfire.dedup.sweep-interval}",
      initialDelayString = "${campfire.dedup.sweep-interval}")
  public void sweep() {
    for (DedupKind kind : SWEEP_ORDER) {
      try {
        DedupResult result = deduplicationService.runToCompletion(kind);
        if (result.deleted() > 0 || result.failedGroups() > 0) {
          log.info(
              "Dedup sweep {}: {} group(s) merged, {} deleted, {} failed",
              kind,
              result.merged(),
              result.deleted(),
              result.failedGroups());
        }
      } catch (RuntimeException e) {
        log.error("Dedup sweep of {} aborted", kind, e);
      }
    }
  }
}
