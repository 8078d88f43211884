package com.phillippitts.speakdict.service.events;

import com.phillippitts.speakdict.service.dictionary.event.DictionaryCompilationFailedEvent;
import com.phillippitts.speakdict.service.dictionary.event.DictionaryCompiledEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing dictionary events. Throttled to avoid log spam when
 * every edit hits the same broken compiler setup.
 */
@Component
class DictionaryEventsListener {
    private static final Logger LOG = LogManager.getLogger(DictionaryEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCompilationFailed(DictionaryCompilationFailedEvent e) {
        String key = "compile-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("User dictionary compilation failed: reason={}, context={}. "
                    + "Check speakdict.compiler.* and speakdict.dictionary.* properties.",
                    e.reason(), e.context());
        }
    }

    @EventListener
    void onCompiled(DictionaryCompiledEvent e) {
        // A success re-arms the failure warnings.
        lastLog.keySet().removeIf(k -> k.startsWith("compile-"));
        LOG.debug("User dictionary active: words={}, durationMs={}", e.wordCount(), e.durationMs());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
