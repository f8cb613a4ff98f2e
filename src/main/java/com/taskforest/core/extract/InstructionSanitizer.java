package com.taskforest.core.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips transcript noise from instruction text before it is normalized.
 * <p>
 * Instructions reach the extractor in several encodings: JSON-escaped strings
 * copied verbatim into prose, HTML-escaped markup, and delegation wrappers
 * such as {@code <new_task>}, {@code <task>} and {@code <message>}. Parent and
 * child sides must be cleaned identically or their keys will never meet.
 */
public final class InstructionSanitizer {

    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(\\d{1,7});");
    private static final Pattern HEX_ENTITY = Pattern.compile("&#[xX]([0-9a-fA-F]{1,6});");
    private static final Pattern TAG = Pattern.compile("<\\s*/?\\s*[a-zA-Z_][\\w\\-]*\\b[^<>]*>");
    private static final Pattern LEADING_CONTENT_KEY = Pattern.compile("^[\"']?content[\"']?\\s*:\\s*[\"']?",
            Pattern.CASE_INSENSITIVE);

    private InstructionSanitizer() {}

    public static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String s = raw;
        if (s.charAt(0) == '\uFEFF') {
            s = s.substring(1);
        }
        s = unescapeLiterals(s);
        s = decodeEntities(s);
        s = LEADING_CONTENT_KEY.matcher(s.strip()).replaceFirst("");
        s = TAG.matcher(s).replaceAll(" ");
        return s.strip();
    }

    /** Literal backslash sequences left behind by double JSON encoding. */
    static String unescapeLiterals(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        return s.replace("\\r\\n", "\n")
                .replace("\\n", "\n")
                .replace("\\t", "\t")
                .replace("\\\"", "\"")
                .replace("\\'", "'")
                .replace("\\\\", "\\");
    }

    static String decodeEntities(String s) {
        if (s.indexOf('&') < 0) {
            return s;
        }
        s = s.replace("&lt;", "<").replace("&LT;", "<")
                .replace("&gt;", ">").replace("&GT;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'")
                .replace("&#39;", "'")
                .replace("&nbsp;", " ");
        s = replaceCodePoints(NUMERIC_ENTITY.matcher(s), 10);
        s = replaceCodePoints(HEX_ENTITY.matcher(s), 16);
        // last, so "&amp;lt;" decodes to "&lt;" and not "<"
        return s.replace("&amp;", "&").replace("&AMP;", "&");
    }

    private static String replaceCodePoints(Matcher matcher, int radix) {
        var sb = new StringBuilder();
        while (matcher.find()) {
            int codePoint = Integer.parseInt(matcher.group(1), radix);
            String replacement = Character.isValidCodePoint(codePoint)
                    ? new String(Character.toChars(codePoint))
                    : matcher.group();
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
