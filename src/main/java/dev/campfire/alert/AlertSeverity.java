package dev.campfire.alert;

public enum AlertSeverity {
  INFO,
  WARNING,
  ERROR,
  CRITICAL
}
