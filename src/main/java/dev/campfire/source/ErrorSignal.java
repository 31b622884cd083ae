package dev.campfire.source;

import java.util.Locale;
import java.util.regex.Pattern;

/** What the raw text of a transient extraction error reveals about the site. */
public enum ErrorSignal {
  RATE_LIMITED,
  NOT_FOUND,
  OTHER;

  private static final Pattern RATE_LIMIT =
      Pattern.compile("\\b429\\b|rate.?limit|too many requests");

  private static final Pattern NOT_FOUND_PATTERN = Pattern.compile("\\b404\\b|not found");

  public static ErrorSignal of(String error) {
    if (error == null || error.isBlank()) {
      return OTHER;
    }
    String text = error.toLowerCase(Locale.ROOT);
    if (RATE_LIMIT.matcher(text).find()) {
      return RATE_LIMITED;
    }
    if (NOT_FOUND_PATTERN.matcher(text).find()) {
      return NOT_FOUND;
    }
    return OTHER;
  }
}
