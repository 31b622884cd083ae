package dev.campfire.catalog;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/** Canonical forms of names used for grouping keys and slugs. */
public final class NameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private NameNormalizer() {
        // utility class
    }

    /**
     * Lower-cases, trims and collapses inner whitespace.
     * {@code "  Camp   Sunshine "} and {@code "camp sunshine"} normalize to the same key.
     *
     * @param name the display name, may be null
     * @return the normalized key, or an empty string for null input
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return WHITESPACE.matcher(name.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * URL-safe slug: ASCII letters and digits joined by single hyphens.
     *
     * @param name the display name
     * @return the slug, or {@code "organization"} when nothing usable remains
     */
    public static String slugify(String name) {
        String ascii = DIACRITICS.matcher(Normalizer.normalize(normalize(name), Normalizer.Form.NFD))
                .replaceAll("");
        String slug = NON_SLUG.matcher(ascii).replaceAll("-");
        slug = slug.replaceAll("^-+|-+$", "");
        return slug.isEmpty() ? "organization" : slug;
    }
}
