package com.phillippitts.speakdict.service.dictionary.word;

import java.util.Optional;
import java.util.UUID;

/**
 * Word identifiers are UUIDs kept in canonical lowercase string form.
 */
public final class WordIds {

    private WordIds() {
        // Utility class - prevent instantiation
    }

    /** Fresh random identifier. */
    public static String newId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Canonical form of {@code raw}, or empty when it is not a UUID.
     * Accepts upper-case hex and surrounding whitespace.
     */
    public static Optional<String> canonical(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        // UUID.fromString is lenient about group lengths; require the 36-char layout
        if (trimmed.length() != 36) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(trimmed).toString());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
