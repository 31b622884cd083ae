package dev.campfire.catalog;

import dev.campfire.validation.SessionStatus;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link CampSession} entities. */
public interface CampSessionRepository extends JpaRepository<CampSession, UUID> {

  List<CampSession> findBySourceIdAndStartDate(UUID sourceId, LocalDate startDate);

  List<CampSession> findBySourceIdAndStartDateIsNull(UUID sourceId);

  List<CampSession> findBySourceId(UUID sourceId);

  long countBySourceIdAndStatus(UUID sourceId, SessionStatus status);

  long countByOrganizationId(UUID organizationId);

  long countByCampId(UUID campId);

  long countByLocationId(UUID locationId);

  /** The subset of the given sources that have at least one session in the given status. */
  @Query(
      "SELECT DISTINCT s.sourceId FROM CampSession s "
          + "WHERE s.sourceId IN :sourceIds AND s.status = :status")
  List<UUID> findSourceIdsWithStatus(
      @Param("sourceIds") Collection<UUID> sourceIds, @Param("status") SessionStatus status);

  @Modifying
  @Query("UPDATE CampSession s SET s.sourceId = NULL WHERE s.sourceId = :sourceId")
  int unlinkSource(@Param("sourceId") UUID sourceId);

  @Modifying
  @Query("DELETE FROM CampSession s WHERE s.sourceId = :sourceId")
  int deleteBySourceIdInBulk(@Param("sourceId") UUID sourceId);

  @Modifying
  @Query("UPDATE CampSession s SET s.organizationId = :to WHERE s.organizationId = :from")
  int reassignOrganization(@Param("from") UUID from, @Param("to") UUID to);

  @Modifying
  @Query("UPDATE CampSession s SET s.campId = :to WHERE s.campId = :from")
  int reassignCamp(@Param("from") UUID from, @Param("to") UUID to);

  @Modifying
  @Query("UPDATE CampSession s SET s.locationId = :to WHERE s.locationId = :from")
  int reassignLocation(@Param("from") UUID from, @Param("to") UUID to);
}
