package dev.campfire.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class NameNormalizerTest {

    @Test
    void collapses_whitespace_and_lowercases() {
        assertThat(NameNormalizer.normalize("  Camp   Sunshine ")).isEqualTo("camp sunshine");
    }

    @Test
    void null_becomes_empty() {
        assertThat(NameNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void slug_strips_accents_and_punctuation() {
        assertThat(NameNormalizer.slugify("Café Crème & Co.")).isEqualTo("cafe-creme-co");
    }

    @Test
    void slug_falls_back_when_nothing_is_left() {
        assertThat(NameNormalizer.slugify("!!!")).isEqualTo("organization");
    }
}
