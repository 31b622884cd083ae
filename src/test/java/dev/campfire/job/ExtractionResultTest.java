package dev.campfire.job;

import static org.assertj.core.api.Assertions.assertThat;

import dev.campfire.fixture.ExtractedRecordBuilder;
import dev.campfire.source.FailureKind;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ExtractionResultTest {

  @Test
  void null_lists_become_empty() {
    ExtractionResult result = new ExtractionResult(null, null, null, null);

    assertThat(result.records()).isEmpty();
    assertThat(result.logs()).isEmpty();
    assertThat(result.isFailure()).isFalse();
  }

  @Test
  void structural_is_kept() {
    assertThat(ExtractionResult.failure(FailureKind.STRUCTURAL, "layout changed").effectiveFailureKind())
        .isEqualTo(FailureKind.STRUCTURAL);
  }

  @ParameterizedTest
  @EnumSource(value = FailureKind.class, names = "STRUCTURAL", mode = EnumSource.Mode.EXCLUDE)
  void anything_else_is_transient(FailureKind reported) {
    assertThat(ExtractionResult.failure(reported, "boom").effectiveFailureKind())
        .isEqualTo(FailureKind.TRANSIENT);
  }

  @Test
  void missing_kind_is_transient() {
    assertThat(new ExtractionResult(null, "HTTP 503", null, null).effectiveFailureKind())
        .isEqualTo(FailureKind.TRANSIENT);
  }

  @Test
  void failure_kind_alone_marks_a_failure() {
    ExtractionResult result = new ExtractionResult(null, null, FailureKind.STRUCTURAL, null);

    assertThat(result.isFailure()).isTrue();
    assertThat(result.errorMessage())
        .isEqualTo("Extractor reported a STRUCTURAL failure without details");
  }

  @Test
  void blank_error_text_gets_a_generic_message() {
    assertThat(new ExtractionResult(null, "  ", null, null).errorMessage())
        .isEqualTo("Extractor reported a TRANSIENT failure without details");
  }

  @Test
  void null_elements_are_dropped() {
    ExtractionResult result =
        new ExtractionResult(
            Arrays.asList(ExtractedRecordBuilder.complete().build(), null),
            null,
            null,
            Arrays.asList("fetched 1 page", null));

    assertThat(result.records()).hasSize(1);
    assertThat(result.logs()).containsExactly("fetched 1 page");
  }
}
