package dev.campfire.job;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link ExtractionJob} entities. */
public interface ExtractionJobRepository extends JpaRepository<ExtractionJob, UUID> {

  List<ExtractionJob> findByStatus(JobStatus status);

  List<ExtractionJob> findBySourceIdAndStatus(UUID sourceId, JobStatus status);

  List<ExtractionJob> findBySourceIdOrderByCreatedAtDesc(UUID sourceId, Pageable pageable);
}
