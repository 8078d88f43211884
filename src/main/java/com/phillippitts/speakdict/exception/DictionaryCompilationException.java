package com.phillippitts.speakdict.exception;

/**
 * Thrown when the compiled dictionary cannot be regenerated: the compiler exited with an
 * error, timed out, produced no output, or the source could not be staged.
 *
 * <p>The previously active compiled dictionary stays in force when this is raised.
 */
public class DictionaryCompilationException extends SpeakDictException {

    /** Exit code used when no compiler process result is available. */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;

    public DictionaryCompilationException(String message) {
        super(message);
        this.exitCode = NO_EXIT_CODE;
    }

    public DictionaryCompilationException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = NO_EXIT_CODE;
    }

    public DictionaryCompilationException(String message, int exitCode, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
