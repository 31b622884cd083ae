package dev.campfire.catalog;

/** Whether a merge-on-write upsert inserted a new session or updated a matching one. */
public enum UpsertOutcome {
  CREATED,
  UPDATED
}
