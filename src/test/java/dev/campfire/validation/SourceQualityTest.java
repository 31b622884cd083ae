package dev.campfire.validation;

import static org.assertj.core.api.Assertions.assertThat;

import dev.campfire.fixture.ExtractedRecordBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SourceQualityTest {

  private final RecordValidator validator = new RecordValidator();

  @ParameterizedTest
  @CsvSource({"100, HIGH", "80, HIGH", "79, MEDIUM", "50, MEDIUM", "49, LOW", "0, LOW"})
  void tiers_follow_score_cutoffs(int score, QualityTier tier) {
    assertThat(QualityTier.forScore(score)).isEqualTo(tier);
  }

  @Test
  void averages_completeness_over_the_batch() {
    Validation full = validator.validate(ExtractedRecordBuilder.complete().build());
    Validation partial =
        validator.validate(ExtractedRecordBuilder.complete().withoutAgeOrGrade().build());

    SourceQuality quality = SourceQuality.of(List.of(full, partial));

    assertThat(quality.score()).isEqualTo(92);
    assertThat(quality.tier()).isEqualTo(QualityTier.HIGH);
  }

  @Test
  void empty_batch_is_low() {
    assertThat(SourceQuality.of(List.of())).isEqualTo(new SourceQuality(0, QualityTier.LOW));
  }
}
