package dev.campfire.api;

import dev.campfire.discovery.ScraperDevelopmentRequest;
import dev.campfire.discovery.ScraperRequestStatus;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

public record ScraperRequestView(
    UUID id,
    @Nullable UUID sourceId,
    String sourceName,
    String sourceUrl,
    @Nullable UUID cityId,
    @Nullable String requestedBy,
    @Nullable String notes,
    ScraperRequestStatus status,
    Instant createdAt,
    Instant updatedAt) {

  static ScraperRequestView of(ScraperDevelopmentRequest request) {
    return new ScraperRequestView(
        request.getId(),
        request.getSourceId(),
        request.getSourceName(),
        request.getSourceUrl(),
        request.getCityId(),
        request.getRequestedBy(),
        request.getNotes(),
        request.getStatus(),
        request.getCreatedAt(),
        request.getUpdatedAt());
  }
}
