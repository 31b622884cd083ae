package dev.campfire.catalog;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link Location} entities. */
public interface LocationRepository extends JpaRepository<Location, UUID> {

  List<Location> findByOrganizationIdAndNormalizedNameOrderByCreatedAtAscIdAsc(
      UUID organizationId, String normalizedName);

  List<Location> findByOrganizationIdIsNullAndNormalizedNameOrderByCreatedAtAscIdAsc(
      String normalizedName);

  List<Location> findAllByOrderByCreatedAtAscIdAsc(Pageable pageable);

  @Query(
      """
      SELECT l FROM Location l
      WHERE l.createdAt > :createdAt OR (l.createdAt = :createdAt AND l.id > :id)
      ORDER BY l.createdAt, l.id
      """)
  List<Location> findSliceAfter(
      @Param("createdAt") Instant createdAt, @Param("id") UUID id, Pageable pageable);

  /**
   * Locations no session points at whose street is missing or a TBD marker, or whose coordinates
   * sit inside the placeholder box.
   */
  @Query(
      """
      SELECT l FROM Location l
      WHERE (l.address.street IS NULL
             OR TRIM(l.address.street) = ''
             OR UPPER(l.address.street) LIKE '%TBD%'
             OR (l.latitude BETWEEN :minLat AND :maxLat
                 AND l.longitude BETWEEN :minLng AND :maxLng))
        AND NOT EXISTS (SELECT 1 FROM CampSession s WHERE s.locationId = l.id)
      ORDER BY l.createdAt, l.id
      """)
  List<Location> findUnreferencedBadLocations(
      @Param("minLat") double minLat,
      @Param("maxLat") double maxLat,
      @Param("minLng") double minLng,
      @Param("maxLng") double maxLng,
      Pageable pageable);

  long countByOrganizationId(UUID organizationId);

  @Modifying
  @Query("UPDATE Location l SET l.organizationId = :to WHERE l.organizationId = :from")
  int reassignOrganization(@Param("from") UUID from, @Param("to") UUID to);
}
