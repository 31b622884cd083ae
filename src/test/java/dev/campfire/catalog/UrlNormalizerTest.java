package dev.campfire.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UrlNormalizerTest {

    @Nested
    class Normalize {

        @Test
        void removes_fragment_and_trailing_slash() {
            String result = UrlNormalizer.normalize("https://campsunshine.example.com/summer/#week-2");
            assertThat(result).isEqualTo("https://campsunshine.example.com/summer");
        }

        @Test
        void keeps_root_trailing_slash() {
            assertThat(UrlNormalizer.normalize("https://example.com")).isEqualTo("https://example.com/");
        }

        @Test
        void lowercases_scheme_and_host_but_not_path() {
            String result = UrlNormalizer.normalize("HTTPS://WWW.Example.com/Camps/");
            assertThat(result).isEqualTo("https://www.example.com/Camps");
        }

        @Test
        void drops_tracking_params_and_sorts_the_rest() {
            String result = UrlNormalizer.normalize(
                    "https://example.com/camps?utm_source=news&season=summer&age=8&fbclid=abc");
            assertThat(result).isEqualTo("https://example.com/camps?age=8&season=summer");
        }

        @Test
        void omits_default_ports_only() {
            assertThat(UrlNormalizer.normalize("https://example.com:443/camps"))
                    .isEqualTo("https://example.com/camps");
            assertThat(UrlNormalizer.normalize("http://example.com:8080/camps"))
                    .isEqualTo("http://example.com:8080/camps");
        }

        @Test
        void reads_scheme_less_input_as_https() {
            assertThat(UrlNormalizer.normalize("example.com/camps")).isEqualTo("https://example.com/camps");
        }

        @Test
        void returns_null_for_null() {
            assertThat(UrlNormalizer.normalize(null)).isNull();
        }
    }

    @Nested
    class ExtractDomain {

        @Test
        void strips_www_and_lowercases() {
            assertThat(UrlNormalizer.extractDomain("https://WWW.Example.com/camps")).isEqualTo("example.com");
        }

        @Test
        void keeps_other_subdomains() {
            assertThat(UrlNormalizer.extractDomain("https://camps.ymca.example.org/summer"))
                    .isEqualTo("camps.ymca.example.org");
        }

        @Test
        void returns_null_without_host() {
            assertThat(UrlNormalizer.extractDomain("")).isNull();
            assertThat(UrlNormalizer.extractDomain(null)).isNull();
        }
    }

    @Nested
    class IsHttpUrl {

        @Test
        void accepts_http_and_https() {
            assertThat(UrlNormalizer.isHttpUrl("http://example.com")).isTrue();
            assertThat(UrlNormalizer.isHttpUrl("https://example.com/camps")).isTrue();
        }

        @Test
        void rejects_other_schemes_and_relative_urls() {
            assertThat(UrlNormalizer.isHttpUrl("ftp://example.com")).isFalse();
            assertThat(UrlNormalizer.isHttpUrl("mailto:camp@example.com")).isFalse();
            assertThat(UrlNormalizer.isHttpUrl("/register")).isFalse();
            assertThat(UrlNormalizer.isHttpUrl(" ")).isFalse();
        }
    }
}
