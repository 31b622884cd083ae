package dev.campfire.validation;

/** Coarse data quality of a source, from the average completeness of its latest extraction. */
public enum QualityTier {
  HIGH,
  MEDIUM,
  LOW;

  public static QualityTier forScore(int score) {
    if (score >= 80) {
      return HIGH;
    }
    if (score >= 50) {
      return MEDIUM;
    }
    return LOW;
  }
}
