package dev.campfire.validation;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/** Inclusive calendar range of a session. */
public record DateRange(LocalDate start, LocalDate end) {

  /** Days between start and end; negative when the range is inverted. */
  public long spanDays() {
    return ChronoUnit.DAYS.between(start, end);
  }
}
