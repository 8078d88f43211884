package com.phillippitts.speakdict.service.dictionary.word;

/**
 * Converts printable ASCII (U+0021..U+007E) in a surface form to the matching full-width
 * character (U+FF01..U+FF5E). The base lexicon stores surfaces in full width, and the
 * conversion also keeps ASCII commas out of the comma-separated lexicon source.
 */
final class SurfaceNormalizer {

    private static final char FIRST_ASCII = '!';
    private static final char LAST_ASCII = '~';
    private static final int FULL_WIDTH_OFFSET = 0xFF01 - FIRST_ASCII;

    private SurfaceNormalizer() {
        // Utility class - prevent instantiation
    }

    static String toFullWidth(String surface) {
        StringBuilder sb = new StringBuilder(surface.length());
        for (int i = 0; i < surface.length(); i++) {
            char c = surface.charAt(i);
            if (c >= FIRST_ASCII && c <= LAST_ASCII) {
                sb.append((char) (c + FULL_WIDTH_OFFSET));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
