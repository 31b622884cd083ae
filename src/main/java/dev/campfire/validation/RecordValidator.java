package dev.campfire.validation;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Scores one extracted record against the six required fields and normalizes it.
 *
 * <p>Validation never throws and never touches storage: a record that is entirely unusable still
 * yields a {@link Validation} with a score of 0. Problems that do not make a required field
 * unusable (a range longer than three weeks, a generic venue) are reported in {@link
 * Validation#errors()} without lowering the score.
 */
@Component
public class RecordValidator {

  static final long MAX_SESSION_SPAN_DAYS = 21;

  private static final Set<String> PLACEHOLDERS =
      Set.of("<unknown>", "unknown", "tbd", "n/a", "null", "undefined");

  private static final Set<String> GENERIC_LOCATIONS =
      Set.of("main location", "tbd", "unknown", "n/a", "online", "various");

  private static final Pattern STREET_ADDRESS = Pattern.compile("\\d+\\s+[A-Za-z]");

  public Validation validate(ExtractedRecord record) {
    List<String> missing = new ArrayList<>();
    List<FieldError> errors = new ArrayList<>();

    String name = usable(record.name());
    if (name == null) {
      missing.add(RequiredField.NAME.key());
      if (record.name() != null && !record.name().isBlank()) {
        errors.add(new FieldError("name", "Name is a placeholder", record.name()));
      }
    }

    DateRange dates = resolveDates(record, errors);
    if (dates == null) {
      missing.add(RequiredField.START_DATE.key());
    } else {
      checkSpan(dates, errors);
    }

    TimeWindow window = resolveTimeWindow(record, errors);
    if (window == null) {
      missing.add(RequiredField.TIME_WINDOW.key());
    }

    Integer price = resolvePrice(record, errors);
    if (price == null) {
      missing.add(RequiredField.PRICE.key());
    }

    AgeGradeRange ageGrade = resolveAgeGrade(record, errors);
    if (!ageGrade.isPresent()) {
      missing.add(RequiredField.AGE_OR_GRADE.key());
    }

    String registrationUrl = usable(record.registrationUrl());
    if (registrationUrl == null || !FieldParsers.isHttpUrl(registrationUrl)) {
      missing.add(RequiredField.REGISTRATION_URL.key());
      if (registrationUrl != null) {
        errors.add(
            new FieldError(
                "registrationUrl",
                "Registration URL is not a valid HTTP/HTTPS URL",
                registrationUrl));
      }
      registrationUrl = null;
    }

    checkLocation(record.location(), errors);

    int required = RequiredField.values().length;
    int score = (int) Math.round(100.0 * (required - missing.size()) / required);

    NormalizedSession normalized =
        new NormalizedSession(
            name != null ? name.trim() : "",
            dates,
            record.dateRaw(),
            window,
            record.timeRaw(),
            price,
            record.priceRaw(),
            ageGrade,
            record.ageGradeRaw(),
            record.location(),
            registrationUrl,
            record.imageUrls());

    return new Validation(missing.isEmpty(), score, missing, errors, normalized);
  }

  private @Nullable DateRange resolveDates(ExtractedRecord record, List<FieldError> errors) {
    LocalDate start = isoDate("startDate", record.startDate(), errors);
    LocalDate end = isoDate("endDate", record.endDate(), errors);
    Optional<DateRange> parsed = Optional.empty();
    if (start == null || end == null) {
      parsed = FieldParsers.parseDateRange(record.dateRaw());
    }
    if (start == null) {
      if (parsed.isEmpty()) {
        if (record.dateRaw() != null && !record.dateRaw().isBlank()) {
          errors.add(
              new FieldError(
                  "startDate", "Could not parse start date from raw text", record.dateRaw()));
        }
        return null;
      }
      start = parsed.get().start();
    }
    if (end == null) {
      end = parsed.map(DateRange::end).orElse(start);
    }
    return new DateRange(start, end);
  }

  private @Nullable LocalDate isoDate(
      String field, @Nullable String value, List<FieldError> errors) {
    String usable = usable(value);
    if (usable == null) {
      return null;
    }
    try {
      return LocalDate.parse(usable.trim());
    } catch (DateTimeParseException e) {
      errors.add(new FieldError(field, "Invalid date format (expected YYYY-MM-DD)", value));
      return null;
    }
  }

  private void checkSpan(DateRange dates, List<FieldError> errors) {
    long span = dates.spanDays();
    if (span < 0) {
      errors.add(
          new FieldError(
              "dateRange", "End date is before start date", dates.start() + " to " + dates.end()));
    } else if (span > MAX_SESSION_SPAN_DAYS) {
      errors.add(
          new FieldError(
              "dateRange",
              "Session spans %d days - likely a programme overview, not a single session (max %d)"
                  .formatted(span, MAX_SESSION_SPAN_DAYS),
              dates.start() + " to " + dates.end()));
    }
  }

  private @Nullable TimeWindow resolveTimeWindow(ExtractedRecord record, List<FieldError> errors) {
    if (record.dropOffHour() != null && record.pickUpHour() != null) {
      TimeWindow supplied =
          new TimeWindow(
              record.dropOffHour(),
              record.dropOffMinute() != null ? record.dropOffMinute() : 0,
              record.pickUpHour(),
              record.pickUpMinute() != null ? record.pickUpMinute() : 0);
      if (supplied.hasValidHours()) {
        return supplied;
      }
      errors.add(
          new FieldError(
              "timeWindow",
              "Invalid hour (expected 0-23)",
              record.dropOffHour() + "-" + record.pickUpHour()));
    }
    Optional<TimeWindow> parsed = FieldParsers.parseTimeRange(record.timeRaw());
    if (parsed.isEmpty() && record.timeRaw() != null && !record.timeRaw().isBlank()) {
      errors.add(
          new FieldError("timeWindow", "Could not parse times from raw text", record.timeRaw()));
    }
    return parsed.orElse(null);
  }

  private @Nullable Integer resolvePrice(ExtractedRecord record, List<FieldError> errors) {
    if (record.priceInCents() != null) {
      if (record.priceInCents() >= 0) {
        return record.priceInCents();
      }
      errors.add(
          new FieldError(
              "price", "Price must not be negative", String.valueOf(record.priceInCents())));
    }
    Optional<Integer> parsed = FieldParsers.parsePrice(record.priceRaw());
    if (parsed.isEmpty() && record.priceRaw() != null && !record.priceRaw().isBlank()) {
      errors.add(
          new FieldError("price", "Could not parse price from raw text", record.priceRaw()));
    }
    return parsed.orElse(null);
  }

  private AgeGradeRange resolveAgeGrade(ExtractedRecord record, List<FieldError> errors) {
    AgeGradeRange supplied =
        new AgeGradeRange(record.minAge(), record.maxAge(), record.minGrade(), record.maxGrade());
    if (supplied.isPresent()) {
      return supplied;
    }
    Optional<AgeGradeRange> parsed = FieldParsers.parseAgeGradeRange(record.ageGradeRaw());
    if (parsed.isEmpty() && record.ageGradeRaw() != null && !record.ageGradeRaw().isBlank()) {
      errors.add(
          new FieldError(
              "ageOrGrade", "Could not parse age/grade from raw text", record.ageGradeRaw()));
    }
    return parsed.orElse(supplied);
  }

  private void checkLocation(@Nullable String location, List<FieldError> errors) {
    if (location == null || location.isBlank()) {
      return;
    }
    String trimmed = location.trim();
    boolean generic = GENERIC_LOCATIONS.contains(trimmed.toLowerCase(Locale.ROOT));
    if (generic || (!STREET_ADDRESS.matcher(trimmed).find() && trimmed.length() < 20)) {
      errors.add(
          new FieldError(
              "location",
              "Location appears incomplete or generic - should include a street address",
              location));
    }
    long commas = trimmed.chars().filter(c -> c == ',').count();
    if (commas >= 3 && trimmed.length() > 100) {
      errors.add(
          new FieldError(
              "location",
              "Location appears to list %d venues - should be a single location"
                  .formatted(commas + 1),
              trimmed.substring(0, 100) + "..."));
    }
  }

  private static @Nullable String usable(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    if (PLACEHOLDERS.contains(value.trim().toLowerCase(Locale.ROOT))) {
      return null;
    }
    return value;
  }

}
