package de.mirkosertic.archivesync.util;

import org.jspecify.annotations.Nullable;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes free text into file system friendly identifiers.
 *
 * <p>A slug is built by:</p>
 * <ul>
 *   <li>removing control, zero-width and replacement characters</li>
 *   <li>folding accented letters to their ASCII base letter</li>
 *   <li>lower-casing</li>
 *   <li>collapsing every run of other characters into a single underscore</li>
 * </ul>
 */
public final class Slugs {

    /**
     * Characters dropped before normalization: NULL, control characters, zero-width
     * characters, byte order mark and the replacement character.
     */
    private static final Pattern INVALID_CHARS = Pattern.compile(
        "[" +
        "\\x00-\\x1F" +               // NULL and control chars
        "\\u200B-\\u200D" +           // Zero-width characters
        "\\uFEFF" +                  // Byte order mark
        "\\uFFFD" +                  // Replacement character
        "]"
    );

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9]+");

    private static final String FALLBACK = "unknown";

    private Slugs() {
        // Utility class, no instances
    }

    /**
     * Builds a slug from the given text.
     *
     * @param text the text to normalize (may be null)
     * @return the slug, never empty; {@code "unknown"} if nothing usable remains
     */
    public static String slugify(final @Nullable String text) {
        if (text == null || text.isEmpty()) {
            return FALLBACK;
        }

        String slug = INVALID_CHARS.matcher(text).replaceAll("");
        slug = Normalizer.normalize(slug, Normalizer.Form.NFKD);
        slug = COMBINING_MARKS.matcher(slug).replaceAll("");
        slug = slug.toLowerCase(Locale.ROOT);
        slug = SEPARATORS.matcher(slug).replaceAll("_");
        slug = trimUnderscores(slug);

        return slug.isEmpty() ? FALLBACK : slug;
    }

    /**
     * Returns the grouping character for a slug: its first character when that is a
     * letter or digit, otherwise an underscore.
     */
    public static char groupOf(final String slug) {
        if (slug.isEmpty()) {
            return '_';
        }
        final char first = slug.charAt(0);
        if ((first >= 'a' && first <= 'z') || (first >= '0' && first <= '9')) {
            return first;
        }
        return '_';
    }

    private static String trimUnderscores(final String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '_') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '_') {
            end--;
        }
        return text.substring(start, end);
    }
}
