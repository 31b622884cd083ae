package dev.campfire.api;

import dev.campfire.discovery.DiscoveredSource;
import dev.campfire.discovery.DiscoveryStatus;
import dev.campfire.discovery.SiteAnalysis;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

public record DiscoveryView(
    UUID id,
    String url,
    String domain,
    @Nullable String title,
    @Nullable String snippet,
    @Nullable String discoveryQuery,
    @Nullable UUID cityId,
    DiscoveryStatus status,
    Instant discoveredAt,
    @Nullable SiteAnalysis analysis,
    @Nullable String reviewedBy,
    @Nullable Instant reviewedAt,
    @Nullable String reviewNotes,
    @Nullable UUID sourceId,
    @Nullable UUID duplicateOfSourceId) {

  static DiscoveryView of(DiscoveredSource discovered) {
    return new DiscoveryView(
        discovered.getId(),
        discovered.getUrl(),
        discovered.getDomain(),
        discovered.getTitle(),
        discovered.getSnippet(),
        discovered.getDiscoveryQuery(),
        discovered.getCityId(),
        discovered.getStatus(),
        discovered.getCreatedAt(),
        discovered.getAnalysis(),
        discovered.getReviewedBy(),
        discovered.getReviewedAt(),
        discovered.getReviewNotes(),
        discovered.getSourceId(),
        discovered.getDuplicateOfSourceId());
  }
}
