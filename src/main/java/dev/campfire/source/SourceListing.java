package dev.campfire.source;

import java.util.List;
import java.util.Map;

/**
 * A filtered page of sources together with the size of every filter over the same (city-scoped)
 * source set, so a dashboard can render all filter tabs from one call.
 */
public record SourceListing(List<SourceSummary> sources, Map<SourceFilter, Long> countsByFilter) {

  public SourceListing {
    sources = List.copyOf(sources);
    countsByFilter = Map.copyOf(countsByFilter);
  }
}
