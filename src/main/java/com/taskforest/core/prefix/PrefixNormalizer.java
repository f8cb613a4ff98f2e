package com.taskforest.core.prefix;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw instruction text into the canonical, length-bounded key used by
 * {@link PrefixIndex}.
 * <p>
 * Both sides of a match (the prefix a parent declared and the opening
 * instruction of a child) go through this same function, so an exact key
 * match reproduces what one record wrote about the other.
 */
public final class PrefixNormalizer {

    public static final int DEFAULT_MAX_LENGTH = 192;

    /** Any whitespace run, including non-breaking and other Unicode spaces. */
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");

    private PrefixNormalizer() {}

    public static String normalize(String text) {
        return normalize(text, DEFAULT_MAX_LENGTH);
    }

    /**
     * Lowercases, collapses whitespace, trims and truncates to at most
     * {@code maxLength} characters. Never fails; {@code null}, blank input and
     * non-positive lengths all yield the empty string.
     *
     * @param text      raw text, may be {@code null}
     * @param maxLength upper bound on the result length
     * @return the normalized prefix
     */
    public static String normalize(String text, int maxLength) {
        if (text == null || maxLength <= 0) {
            return "";
        }
        String s = text.toLowerCase(Locale.ROOT);
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();
        if (s.length() <= maxLength) {
            return s;
        }
        int end = maxLength;
        // don't leave half of a surrogate pair behind
        if (Character.isHighSurrogate(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end).stripTrailing();
    }
}
