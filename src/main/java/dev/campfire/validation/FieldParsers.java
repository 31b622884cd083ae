package dev.campfire.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Best-effort parsers for the free-text fields extractors emit when they cannot fill the structured
 * ones. Every parser returns {@link Optional#empty()} instead of throwing on unrecognized input.
 */
public final class FieldParsers {

  /** "June 10-14, 2025", "Jun 28 - July 2 2025". */
  private static final Pattern MONTH_DAY_RANGE =
      Pattern.compile(
          "([a-z]{3,9})\\.?\\s+(\\d{1,2})\\s*(?:-|–|to)\\s*(?:([a-z]{3,9})\\.?\\s+)?(\\d{1,2}),?\\s*(\\d{4})");

  /** "6/10/2025 - 6/14/2025". */
  private static final Pattern NUMERIC_RANGE =
      Pattern.compile(
          "(\\d{1,2})/(\\d{1,2})/(\\d{4})\\s*(?:-|–|to)\\s*(\\d{1,2})/(\\d{1,2})/(\\d{4})");

  /** "9:00 AM - 3:00 PM", "9am-3pm", "9-3". */
  private static final Pattern TIME_RANGE =
      Pattern.compile(
          "(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm|a\\.m\\.|p\\.m\\.)?\\s*(?:-|–|to)\\s*(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm|a\\.m\\.|p\\.m\\.)?");

  private static final Pattern PRICE =
      Pattern.compile("\\$?\\s*(\\d{1,3}(?:,\\d{3})+|\\d+)(?:\\.(\\d{1,2}))?");

  private static final Pattern FREE = Pattern.compile("\\bfree\\b");

  private static final String GRADE_TOKEN = "(pre-?k|k|\\d{1,2})(?:st|nd|rd|th)?";
  private static final String RANGE_SEPARATOR = "\\s*(?:-|–|to)\\s*";

  /** "Grades K-5", "grade 1 to 3". */
  private static final Pattern GRADE_PREFIXED =
      Pattern.compile("grades?\\s*" + GRADE_TOKEN + RANGE_SEPARATOR + GRADE_TOKEN);

  /** "K-5th grade", "1st-5th grades". */
  private static final Pattern GRADE_SUFFIXED =
      Pattern.compile(GRADE_TOKEN + RANGE_SEPARATOR + GRADE_TOKEN + "\\s*grades?");

  /** "K-5", "Pre-K to 2". */
  private static final Pattern GRADE_FROM_KINDERGARTEN =
      Pattern.compile("\\b(pre-?k|k)" + RANGE_SEPARATOR + GRADE_TOKEN);

  /** "Ages 5-12", "5 to 12 years". */
  private static final Pattern AGE_RANGE =
      Pattern.compile("(?:ages?\\s*)?(\\d{1,2})" + RANGE_SEPARATOR + "(\\d{1,2})");

  /** "Age 5+", "5 and up". */
  private static final Pattern AGE_AND_UP =
      Pattern.compile("(?:ages?\\s*)?(\\d{1,2})\\s*(?:\\+|and\\s*up|and\\s*older)");

  static final int DEFAULT_MAX_AGE = 18;

  /** Below this hour an unmarked pick-up time is read as afternoon ("9-3" means 9:00 to 15:00). */
  static final int AFTERNOON_CUTOFF_HOUR = 6;

  private FieldParsers() {
    // utility class
  }

  /**
   * Parse a date range from raw text.
   *
   * @param text e.g. {@code "June 10-14, 2025"} or {@code "6/10/2025 - 6/14/2025"}
   * @return the range, or empty if no supported pattern matched or the date does not exist
   */
  public static Optional<DateRange> parseDateRange(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String normalized = text.toLowerCase(Locale.ROOT).trim();
    try {
      Matcher named = MONTH_DAY_RANGE.matcher(normalized);
      if (named.find()) {
        Optional<Month> startMonth = month(named.group(1));
        Optional<Month> endMonth =
            named.group(3) != null ? month(named.group(3)) : startMonth;
        if (startMonth.isEmpty() || endMonth.isEmpty()) {
          return Optional.empty();
        }
        int year = Integer.parseInt(named.group(5));
        LocalDate start = LocalDate.of(year, startMonth.get(), Integer.parseInt(named.group(2)));
        LocalDate end = LocalDate.of(year, endMonth.get(), Integer.parseInt(named.group(4)));
        return Optional.of(new DateRange(start, end));
      }

      Matcher numeric = NUMERIC_RANGE.matcher(normalized);
      if (numeric.find()) {
        LocalDate start =
            LocalDate.of(
                Integer.parseInt(numeric.group(3)),
                Integer.parseInt(numeric.group(1)),
                Integer.parseInt(numeric.group(2)));
        LocalDate end =
            LocalDate.of(
                Integer.parseInt(numeric.group(6)),
                Integer.parseInt(numeric.group(4)),
                Integer.parseInt(numeric.group(5)));
        return Optional.of(new DateRange(start, end));
      }
    } catch (DateTimeException e) {
      return Optional.empty();
    }
    return Optional.empty();
  }

  /**
   * Parse a daily time window from raw text. Explicit am/pm markers are honoured; an unmarked
   * pick-up hour below 6 is read as afternoon.
   *
   * @param text e.g. {@code "9:00 AM - 3:00 PM"}
   * @return the window on a 24-hour clock, or empty if nothing matched or the values are out of range
   */
  public static Optional<TimeWindow> parseTimeRange(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    Matcher m = TIME_RANGE.matcher(text.toLowerCase(Locale.ROOT));
    if (!m.find()) {
      return Optional.empty();
    }
    int dropOffMinute = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
    int pickUpMinute = m.group(5) != null ? Integer.parseInt(m.group(5)) : 0;
    int dropOffHour = to24Hour(Integer.parseInt(m.group(1)), m.group(3));
    int pickUpHour = to24Hour(Integer.parseInt(m.group(4)), m.group(6));
    if (m.group(6) == null && pickUpHour < AFTERNOON_CUTOFF_HOUR) {
      pickUpHour += 12;
    }
    TimeWindow window = new TimeWindow(dropOffHour, dropOffMinute, pickUpHour, pickUpMinute);
    if (!window.hasValidHours() || dropOffMinute > 59 || pickUpMinute > 59) {
      return Optional.empty();
    }
    return Optional.of(window);
  }

  /**
   * Parse a price in cents from raw text.
   *
   * @param text e.g. {@code "$1,250.50"} or {@code "Free"}
   * @return the price in cents (0 for free), or empty if no amount was found or it overflows
   */
  public static Optional<Integer> parsePrice(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String normalized = text.toLowerCase(Locale.ROOT);
    if (FREE.matcher(normalized).find()) {
      return Optional.of(0);
    }
    Matcher m = PRICE.matcher(normalized);
    if (!m.find()) {
      return Optional.empty();
    }
    String digits = m.group(1).replace(",", "");
    if (digits.length() > 9) {
      return Optional.empty();
    }
    long dollars = Long.parseLong(digits);
    int cents = 0;
    if (m.group(2) != null) {
      cents = Integer.parseInt(m.group(2));
      if (m.group(2).length() == 1) {
        cents *= 10;
      }
    }
    long total = dollars * 100 + cents;
    if (total > Integer.MAX_VALUE) {
      return Optional.empty();
    }
    return Optional.of((int) total);
  }

  /**
   * Parse an age or grade range from raw text. Grades win when both readings are possible.
   *
   * @param text e.g. {@code "Grades K-5"}, {@code "Ages 5-12"} or {@code "5 and up"}
   * @return the range, or empty if nothing matched
   */
  public static Optional<AgeGradeRange> parseAgeGradeRange(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String normalized = text.toLowerCase(Locale.ROOT).trim();

    for (Pattern pattern : new Pattern[] {GRADE_PREFIXED, GRADE_SUFFIXED, GRADE_FROM_KINDERGARTEN}) {
      Matcher m = pattern.matcher(normalized);
      if (m.find()) {
        return Optional.of(
            new AgeGradeRange(null, null, grade(m.group(1)), grade(m.group(2))));
      }
    }

    Matcher ages = AGE_RANGE.matcher(normalized);
    if (ages.find()) {
      return Optional.of(
          new AgeGradeRange(
              Integer.parseInt(ages.group(1)), Integer.parseInt(ages.group(2)), null, null));
    }

    Matcher andUp = AGE_AND_UP.matcher(normalized);
    if (andUp.find()) {
      return Optional.of(
          new AgeGradeRange(Integer.parseInt(andUp.group(1)), DEFAULT_MAX_AGE, null, null));
    }
    return Optional.empty();
  }

  private static Optional<Month> month(String token) {
    for (Month month : Month.values()) {
      if (month.name().toLowerCase(Locale.ROOT).startsWith(token)) {
        return Optional.of(month);
      }
    }
    return Optional.empty();
  }

  private static int to24Hour(int hour, String period) {
    if (period == null) {
      return hour;
    }
    boolean pm = period.startsWith("p");
    if (pm && hour != 12) {
      return hour + 12;
    }
    if (!pm && hour == 12) {
      return 0;
    }
    return hour;
  }

  private static int grade(String token) {
    if ("k".equals(token)) {
      return 0;
    }
    if (token.startsWith("pre")) {
      return -1;
    }
    return Integer.parseInt(token);
  }

  /** True for absolute http or https URLs with a host. */
  public static boolean isHttpUrl(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return false;
    }
    try {
      URI uri = new URI(value.trim());
      String scheme = uri.getScheme();
      return uri.getHost() != null
          && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
    } catch (URISyntaxException e) {
      return false;
    }
  }
}
