package dev.campfire.validation;

import java.util.Collection;

/**
 * Average completeness over a batch of validations and its tier.
 *
 * @param score rounded average completeness, 0 for an empty batch
 * @param tier tier for {@code score}
 */
public record SourceQuality(int score, QualityTier tier) {

  public static SourceQuality of(Collection<Validation> validations) {
    if (validations.isEmpty()) {
      return new SourceQuality(0, QualityTier.LOW);
    }
    double average =
        validations.stream().mapToInt(Validation::completenessScore).average().orElse(0);
    int score = (int) Math.round(average);
    return new SourceQuality(score, QualityTier.forScore(score));
  }
}
