package dev.campfire.validation;

import org.jspecify.annotations.Nullable;

/**
 * Eligibility by age, by school grade, or both. Kindergarten is grade 0 and pre-K is grade -1.
 */
public record AgeGradeRange(
    @Nullable Integer minAge,
    @Nullable Integer maxAge,
    @Nullable Integer minGrade,
    @Nullable Integer maxGrade) {

  /** True when at least one bound of either range is known. */
  public boolean isPresent() {
    return minAge != null || maxAge != null || minGrade != null || maxGrade != null;
  }
}
