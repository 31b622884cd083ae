package dev.campfire.api;

import dev.campfire.alert.AlertSeverity;
import dev.campfire.alert.AlertType;
import dev.campfire.alert.SourceAlert;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

public record AlertView(
    UUID id,
    @Nullable UUID sourceId,
    AlertType type,
    AlertSeverity severity,
    String message,
    Instant createdAt,
    @Nullable Instant acknowledgedAt,
    @Nullable String acknowledgedBy) {

  static AlertView of(SourceAlert alert) {
    return new AlertView(
        alert.getId(),
        alert.getSourceId(),
        alert.getType(),
        alert.getSeverity(),
        alert.getMessage(),
        alert.getCreatedAt(),
        alert.getAcknowledgedAt(),
        alert.getAcknowledgedBy());
  }
}
