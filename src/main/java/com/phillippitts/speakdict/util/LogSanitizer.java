package com.phillippitts.speakdict.util;

/** Utility for privacy-safe logging of user-supplied dictionary text. */
public final class LogSanitizer {

    /** Default number of characters of a surface or pronunciation shown in INFO logs. */
    public static final int DEFAULT_PREVIEW_CHARS = 8;

    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max code points; returns "" for null.
     * Surrogate pairs are never split.
     */
    public static String truncate(String s, int max) {
        if (s == null || max <= 0) {
            return "";
        }
        int codePoints = s.codePointCount(0, s.length());
        if (codePoints <= max) {
            return s;
        }
        return s.substring(0, s.offsetByCodePoints(0, max));
    }

    /**
     * Preview of a word for log lines: the first {@link #DEFAULT_PREVIEW_CHARS} code points,
     * followed by "…" and the total length when truncated.
     */
    public static String preview(String s) {
        if (s == null) {
            return "";
        }
        String head = truncate(s, DEFAULT_PREVIEW_CHARS);
        if (head.length() == s.length()) {
            return s;
        }
        return head + "…(" + s.codePointCount(0, s.length()) + ")";
    }
}
