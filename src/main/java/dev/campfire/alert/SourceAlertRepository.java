package dev.campfire.alert;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SourceAlert} entities. */
public interface SourceAlertRepository extends JpaRepository<SourceAlert, UUID> {

  List<SourceAlert> findByAcknowledgedAtIsNullOrderByCreatedAtDesc(Pageable pageable);

  List<SourceAlert> findBySourceIdOrderByCreatedAtDesc(UUID sourceId, Pageable pageable);
}
