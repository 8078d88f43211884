package com.phillippitts.speakdict.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link DictionaryCompilationException} carrying compiler diagnostics.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw DictionaryCompilationExceptionBuilder.create("Compiler produced no dictionary")
 *         .metadata("output", tmpCompiledPath)
 *         .build();
 *
 * throw DictionaryCompilationExceptionBuilder.create("Non-zero exit: 1")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("binaryPath", binPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class DictionaryCompilationExceptionBuilder {

    private final String message;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private DictionaryCompilationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static DictionaryCompilationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new DictionaryCompilationExceptionBuilder(message);
    }

    public DictionaryCompilationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public DictionaryCompilationExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public DictionaryCompilationExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key (binaryPath, source, output, stderr, ...)
     * @param value metadata value
     * @return this builder for chaining
     */
    public DictionaryCompilationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed DictionaryCompilationException
     */
    public DictionaryCompilationException build() {
        int code = exitCode != null ? exitCode : DictionaryCompilationException.NO_EXIT_CODE;
        return new DictionaryCompilationException(buildDetailedMessage(), code, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }

        return sb.append(')').toString();
    }
}
