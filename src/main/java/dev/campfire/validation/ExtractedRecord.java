package dev.campfire.validation;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One session as emitted by the extraction collaborator, before validation.
 *
 * <p>Every field is optional. Structured fields ({@code startDate}, {@code dropOffHour}, {@code
 * priceInCents}...) win over their raw text counterparts, which are only parsed when the structured
 * value is absent.
 *
 * @param name session title
 * @param startDate ISO-8601 calendar date ({@code 2025-06-10})
 * @param endDate ISO-8601 calendar date
 * @param dateRaw raw date text, e.g. {@code "June 10-14, 2025"}
 * @param timeRaw raw time text, e.g. {@code "9:00 AM - 3:00 PM"}
 * @param priceRaw raw price text, e.g. {@code "$1,250.50"} or {@code "Free"}
 * @param ageGradeRaw raw eligibility text, e.g. {@code "Grades K-5"}
 * @param location free-text venue or address
 * @param campName programme the session belongs to; defaults to the session name
 * @param venue structured venue when the extractor resolved one
 */
public record ExtractedRecord(
    @Nullable String name,
    @Nullable String startDate,
    @Nullable String endDate,
    @Nullable String dateRaw,
    @Nullable Integer dropOffHour,
    @Nullable Integer dropOffMinute,
    @Nullable Integer pickUpHour,
    @Nullable Integer pickUpMinute,
    @Nullable String timeRaw,
    @Nullable Integer priceInCents,
    @Nullable String priceRaw,
    @Nullable Integer minAge,
    @Nullable Integer maxAge,
    @Nullable Integer minGrade,
    @Nullable Integer maxGrade,
    @Nullable String ageGradeRaw,
    @Nullable String location,
    @Nullable String registrationUrl,
    @Nullable List<String> imageUrls,
    @Nullable String campName,
    @Nullable Venue venue) {

  public ExtractedRecord {
    imageUrls =
        imageUrls == null ? List.of() : imageUrls.stream().filter(Objects::nonNull).toList();
  }

  /** Structured venue details resolved by the extractor. Coordinates are optional. */
  public record Venue(
      @Nullable String name,
      @Nullable String street,
      @Nullable String city,
      @Nullable String state,
      @Nullable String zip,
      @Nullable Double latitude,
      @Nullable Double longitude) {}
}
