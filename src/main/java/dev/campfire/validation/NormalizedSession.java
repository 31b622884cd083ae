package dev.campfire.validation;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * The parsed, typed view of an {@link ExtractedRecord}. Fields that could not be resolved are null;
 * raw texts are carried through unchanged.
 */
public record NormalizedSession(
    String name,
    @Nullable DateRange dates,
    @Nullable String dateRaw,
    @Nullable TimeWindow timeWindow,
    @Nullable String timeRaw,
    @Nullable Integer priceInCents,
    @Nullable String priceRaw,
    AgeGradeRange ageGrade,
    @Nullable String ageGradeRaw,
    @Nullable String location,
    @Nullable String registrationUrl,
    List<String> imageUrls) {

  public NormalizedSession {
    imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
  }
}
