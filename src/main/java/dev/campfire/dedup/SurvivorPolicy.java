package dev.campfire.dedup;

/** Which member of a duplicate group is kept. */
public enum SurvivorPolicy {
  /** The first-created record, by {@code createdAt} then id. */
  FIRST_CREATED,
  /** The record with the most back-references; ties go to the first-created one. */
  MOST_REFERENCED
}
