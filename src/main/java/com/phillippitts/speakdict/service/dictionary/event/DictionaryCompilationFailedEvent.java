package com.phillippitts.speakdict.service.dictionary.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a recompilation fails. The previously active dictionary stays in force
 * unless the failure happened after it was detached.
 *
 * <p>PII note: context carries paths and exit codes only, never word surfaces.
 */
public record DictionaryCompilationFailedEvent(
        String reason,
        Instant at,
        String message,
        Throwable cause,
        Map<String, String> context
) {
    public DictionaryCompilationFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
