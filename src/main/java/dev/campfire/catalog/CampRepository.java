package dev.campfire.catalog;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link Camp} entities. */
public interface CampRepository extends JpaRepository<Camp, UUID> {

  List<Camp> findByOrganizationIdAndNormalizedNameOrderByCreatedAtAscIdAsc(
      UUID organizationId, String normalizedName);

  List<Camp> findByOrganizationIdIsNullAndNormalizedNameOrderByCreatedAtAscIdAsc(
      String normalizedName);

  List<Camp> findAllByOrderByCreatedAtAscIdAsc(Pageable pageable);

  @Query(
      """
      SELECT c FROM Camp c
      WHERE c.createdAt > :createdAt OR (c.createdAt = :createdAt AND c.id > :id)
      ORDER BY c.createdAt, c.id
      """)
  List<Camp> findSliceAfter(
      @Param("createdAt") Instant createdAt, @Param("id") UUID id, Pageable pageable);

  long countByOrganizationId(UUID organizationId);

  @Modifying
  @Query("UPDATE Camp c SET c.organizationId = :to WHERE c.organizationId = :from")
  int reassignOrganization(@Param("from") UUID from, @Param("to") UUID to);
}
