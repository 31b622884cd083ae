package dev.campfire.source;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link Source} entities. */
public interface SourceRepository
    extends JpaRepository<Source, UUID>, JpaSpecificationExecutor<Source> {

  Optional<Source> findByUrl(String url);

  List<Source> findByDomain(String domain);

  boolean existsByDomain(String domain);

  /**
   * Takes the per-source lease for a job. Succeeds only when no other job holds it, so of two
   * concurrent claims exactly one updates a row; the other sees the committed lease and gets 0.
   *
   * @return 1 if the lease was taken, 0 if another job holds it or the source does not exist
   */
  @Modifying(flushAutomatically = true)
  @Query(
      "UPDATE Source s SET s.runningJobId = :jobId "
          + "WHERE s.id = :sourceId AND s.runningJobId IS NULL")
  int claimLease(@Param("sourceId") UUID sourceId, @Param("jobId") UUID jobId);

  /**
   * Releases the lease if, and only if, it is held by the given job.
   *
   * @return 1 if released, 0 if the lease was held by another job or already free
   */
  @Modifying(flushAutomatically = true)
  @Query(
      "UPDATE Source s SET s.runningJobId = NULL "
          + "WHERE s.id = :sourceId AND s.runningJobId = :jobId")
  int releaseLease(@Param("sourceId") UUID sourceId, @Param("jobId") UUID jobId);

  /** Frees the lease regardless of holder. Operator cleanup for stuck jobs only. */
  @Modifying(flushAutomatically = true)
  @Query("UPDATE Source s SET s.runningJobId = NULL WHERE s.id = :sourceId")
  int forceReleaseLease(@Param("sourceId") UUID sourceId);

  /**
   * Active sources that are due for a scheduled run or flagged for a rescan, excluding those that
   * need regeneration or are already running.
   */
  @Query(
      """
      SELECT s FROM Source s
      WHERE s.active = true
        AND s.health.needsRegeneration = false
        AND s.runningJobId IS NULL
        AND (s.needsRescan = true
             OR s.nextScheduledScrapeAt IS NULL
             OR s.nextScheduledScrapeAt <= :now)
      ORDER BY s.needsRescan DESC, s.nextScheduledScrapeAt ASC NULLS FIRST
      """)
  List<Source> findDueForExtraction(@Param("now") Instant now, Pageable pageable);

  /** Deletes a source unless a job currently holds its lease. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM Source s WHERE s.id = :sourceId AND s.runningJobId IS NULL")
  int deleteIfIdle(@Param("sourceId") UUID sourceId);

  @Modifying
  @Query("UPDATE Source s SET s.organizationId = :to WHERE s.organizationId = :from")
  int reassignOrganization(@Param("from") UUID from, @Param("to") UUID to);

  long countByOrganizationId(UUID organizationId);
}
