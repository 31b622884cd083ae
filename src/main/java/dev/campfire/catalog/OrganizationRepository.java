package dev.campfire.catalog;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link Organization} entities. */
public interface OrganizationRepository extends JpaRepository<Organization, UUID> {

  List<Organization> findByWebsiteDomainOrderByCreatedAtAscIdAsc(String websiteDomain);

  boolean existsBySlug(String slug);

  List<Organization> findByNormalizedNameAndWebsiteDomainOrderByCreatedAtAscIdAsc(
      String normalizedName, String websiteDomain);

  List<Organization> findByNormalizedNameAndWebsiteDomainIsNullOrderByCreatedAtAscIdAsc(
      String normalizedName);

  List<Organization> findAllByOrderByCreatedAtAscIdAsc(Pageable pageable);

  /** Keyset slice in creation order, strictly after the given position. */
  @Query(
      """
      SELECT o FROM Organization o
      WHERE o.createdAt > :createdAt OR (o.createdAt = :createdAt AND o.id > :id)
      ORDER BY o.createdAt, o.id
      """)
  List<Organization> findSliceAfter(
      @Param("createdAt") Instant createdAt, @Param("id") UUID id, Pageable pageable);
}
