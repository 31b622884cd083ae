package dev.campfire.job;

/** Counters written on a completed job. */
public record JobStats(int found, int created, int updated, int averageCompleteness) {}
