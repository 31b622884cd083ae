package dev.campfire.catalog;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import dev.campfire.validation.FieldParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that canonicalises provider URLs and derives the domain used to detect that two
 * URLs belong to the same provider.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "gclid", "fbclid", "ref"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Canonical form of a URL for uniqueness checks: lower-case scheme and host, no fragment, no
     * tracking parameters, no trailing slash except for the root path. Scheme-less input is
     * read as https.
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the trimmed input unchanged if malformed
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        URI uri = parse(url);
        if (uri == null || uri.getHost() == null) {
            log.warn("URL missing scheme or host, returning unchanged: {}", url);
            return url.trim();
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = filterQueryParams(uri.getRawQuery());

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (query != null) {
            sb.append('?').append(query);
        }
        return sb.toString();
    }

    /**
     * The provider domain of a URL: lower-case host without a leading {@code www.}.
     * {@code https://WWW.Example.com/camps} yields {@code example.com}.
     *
     * @param url the URL, with or without scheme
     * @return the domain, or null when no host can be derived
     */
    public static String extractDomain(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri = parse(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    /** True for absolute http or https URLs with a host. */
    public static boolean isHttpUrl(String url) {
        return FieldParsers.isHttpUrl(url);
    }

    private static URI parse(String url) {
        String candidate = url.trim();
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        try {
            URI uri = new URI(candidate);
            return uri.getScheme() == null ? null : uri;
        } catch (URISyntaxException e) {
            log.warn("Malformed URL: {}", url);
            return null;
        }
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !TRACKING_PARAMS.contains(key.toLowerCase(Locale.ROOT));
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
