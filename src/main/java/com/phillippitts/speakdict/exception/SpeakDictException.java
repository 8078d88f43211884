package com.phillippitts.speakdict.exception;

/**
 * Base exception for all speakdict application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class SpeakDictException extends RuntimeException {

    public SpeakDictException(String message) {
        super(message);
    }

    public SpeakDictException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakDictException(Throwable cause) {
        super(cause);
    }
}
