package dev.campfire.dedup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DedupCursorTest {

  @Test
  void encodes_instant_and_id() {
    UUID id = UUID.fromString("6f1c2b1e-8f7a-4a57-9a55-3d0f1f0b9c11");
    DedupCursor cursor = new DedupCursor(Instant.parse("2025-04-01T08:30:00.123456Z"), id);

    assertThat(cursor.encode()).isEqualTo("2025-04-01T08:30:00.123456Z_" + id);
    assertThat(DedupCursor.decode(cursor.encode())).isEqualTo(cursor);
  }

  @ParameterizedTest
  @ValueSource(strings = {"garbage", "_6f1c2b1e-8f7a-4a57-9a55-3d0f1f0b9c11", "2025-04-01T08:30:00Z_nope"})
  void malformed_cursors_are_rejected(String value) {
    assertThatThrownBy(() -> DedupCursor.decode(value))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Malformed dedup cursor");
  }
}
