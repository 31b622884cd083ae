package dev.campfire.alert;

import dev.campfire.error.NotFoundException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records operator alerts. Delivery (email, chat) is an external concern: this service only
 * persists alerts and exposes them for listing and acknowledgement.
 */
@Service
public class AlertService {

  private static final Logger log = LoggerFactory.getLogger(AlertService.class);

  private final SourceAlertRepository alertRepository;
  private final Clock clock;

  public AlertService(SourceAlertRepository alertRepository, Clock clock) {
    this.alertRepository = alertRepository;
    this.clock = clock;
  }

  /** Persists an alert in the caller's transaction. */
  @Transactional
  public SourceAlert raise(
      @Nullable UUID sourceId, AlertType type, AlertSeverity severity, String message) {
    SourceAlert alert = alertRepository.save(new SourceAlert(sourceId, type, severity, message));
    log.info("Alert {} [{}] for source {}: {}", type, severity, sourceId, message);
    return alert;
  }

  @Transactional(readOnly = true)
  public List<SourceAlert> listUnacknowledged(int limit) {
    return alertRepository.findByAcknowledgedAtIsNullOrderByCreatedAtDesc(
        PageRequest.of(0, limit));
  }

  @Transactional(readOnly = true)
  public List<SourceAlert> listForSource(UUID sourceId, int limit) {
    return alertRepository.findBySourceIdOrderByCreatedAtDesc(sourceId, PageRequest.of(0, limit));
  }

  /** Acknowledges an alert. Acknowledging twice keeps the first actor and timestamp. */
  @Transactional
  public SourceAlert acknowledge(UUID alertId, String actor) {
    SourceAlert alert =
        alertRepository
            .findById(alertId)
            .orElseThrow(() -> new NotFoundException("Alert", alertId));
    alert.acknowledge(actor, clock.instant());
    return alert;
  }
}
