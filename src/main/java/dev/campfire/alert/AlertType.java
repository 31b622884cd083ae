package dev.campfire.alert;

/** Kinds of operator alerts raised by the pipeline. */
public enum AlertType {
  SCRAPER_DEGRADED,
  SCRAPER_NEEDS_REGENERATION,
  SCRAPER_DISABLED,
  RATE_LIMITED,
  ZERO_RESULTS,
  NEW_SOURCES_PENDING
}
