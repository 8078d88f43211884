package com.phillippitts.speakdict.exception;

/**
 * Thrown when a word property or record is rejected: unknown part-of-speech combination,
 * accent-associative rule not allowed for it, priority out of range, malformed pronunciation
 * or an accent position beyond the word's mora count.
 *
 * <p>Always recoverable by rejecting the single request.
 */
public class WordValidationException extends SpeakDictException {

    private final String field;
    private final String reason;

    public WordValidationException(String field, String reason) {
        super("Invalid " + field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }
}
