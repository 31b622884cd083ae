package dev.campfire.source;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Input for creating a source by hand or from an approved discovery.
 *
 * @param scrapeFrequencyHours hours between scheduled runs; null for the default of 24
 * @param extractionTimeoutSeconds per-source job timeout override; null for the global default
 */
public record NewSource(
    String name,
    String url,
    @Nullable List<AdditionalUrl> additionalUrls,
    @Nullable UUID organizationId,
    @Nullable UUID cityId,
    @Nullable Integer scrapeFrequencyHours,
    @Nullable String parsingNotes,
    @Nullable Integer extractionTimeoutSeconds) {

  public NewSource {
    additionalUrls =
        additionalUrls == null
            ? List.of()
            : additionalUrls.stream().filter(Objects::nonNull).toList();
  }

  public static NewSource of(
      String name, String url, @Nullable UUID organizationId, @Nullable UUID cityId) {
    return new NewSource(name, url, List.of(), organizationId, cityId, null, null, null);
  }
}
