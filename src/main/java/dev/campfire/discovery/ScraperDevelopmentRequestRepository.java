package dev.campfire.discovery;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScraperDevelopmentRequestRepository
    extends JpaRepository<ScraperDevelopmentRequest, UUID> {

  List<ScraperDevelopmentRequest> findByStatusOrderByCreatedAtAsc(ScraperRequestStatus status);
}
