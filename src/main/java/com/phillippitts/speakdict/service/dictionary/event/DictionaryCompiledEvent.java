package com.phillippitts.speakdict.service.dictionary.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published after a recompiled user dictionary has been swapped in.
 *
 * @param compiledPath the active compiled dictionary
 * @param wordCount number of user words compiled in
 * @param durationMs wall time of the whole recompilation
 * @param at completion time
 */
public record DictionaryCompiledEvent(
        Path compiledPath,
        int wordCount,
        long durationMs,
        Instant at
) {
    public DictionaryCompiledEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
