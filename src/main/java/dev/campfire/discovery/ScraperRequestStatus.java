package dev.campfire.discovery;

public enum ScraperRequestStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  FAILED
}
