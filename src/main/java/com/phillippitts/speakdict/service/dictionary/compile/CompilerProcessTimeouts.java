package com.phillippitts.speakdict.service.dictionary.compile;

import java.time.Duration;

/**
 * Timeout values for the compiler subprocess and its stream gobblers.
 */
final class CompilerProcessTimeouts {

    /**
     * Time allowed for gobbler threads to flush buffered output after the process exits.
     * mecab-dict-index prints one progress line per input file, well under 100KB.
     */
    static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of gobbler threads during cleanup; they are daemon threads. */
    static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Characters of stderr included in exception messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private CompilerProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
