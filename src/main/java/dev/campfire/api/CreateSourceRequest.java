package dev.campfire.api;

import dev.campfire.source.AdditionalUrl;
import dev.campfire.source.NewSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

public record CreateSourceRequest(
    @NotBlank String name,
    @NotBlank String url,
    @Nullable List<AdditionalUrl> additionalUrls,
    @Nullable UUID organizationId,
    @Nullable UUID cityId,
    @Nullable @Positive Integer scrapeFrequencyHours,
    @Nullable String parsingNotes,
    @Nullable @Positive Integer extractionTimeoutSeconds) {

  NewSource toNewSource() {
    return new NewSource(
        name,
        url,
        additionalUrls,
        organizationId,
        cityId,
        scrapeFrequencyHours,
        parsingNotes,
        extractionTimeoutSeconds);
  }
}
