package dev.campfire.discovery;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link DiscoveredSource} entities. */
public interface DiscoveredSourceRepository extends JpaRepository<DiscoveredSource, UUID> {

  Optional<DiscoveredSource> findByUrl(String url);

  List<DiscoveredSource> findByStatusInOrderByCreatedAtDesc(
      Collection<DiscoveryStatus> statuses, Pageable pageable);

  List<DiscoveredSource> findByStatusInAndCityIdOrderByCreatedAtDesc(
      Collection<DiscoveryStatus> statuses, UUID cityId, Pageable pageable);
}
