package com.phillippitts.speakdict.service.dictionary.compile;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ActiveDictionarySlot} holding the active path in an {@link AtomicReference} and
 * forwarding swaps to the analyzer through an {@link AnalyzerDictionaryBinding}.
 *
 * <p>The analyzer is loaded before the reference is published, so a reader that sees a
 * path knows the analyzer has it.
 */
@Component
public class AtomicActiveDictionarySlot implements ActiveDictionarySlot {

    private static final Logger LOG = LogManager.getLogger(AtomicActiveDictionarySlot.class);

    private final AtomicReference<Path> active = new AtomicReference<>();
    private final AnalyzerDictionaryBinding binding;

    public AtomicActiveDictionarySlot(AnalyzerDictionaryBinding binding) {
        this.binding = Objects.requireNonNull(binding, "binding");
    }

    @Override
    public void activate(Path compiledDictionary) {
        Path resolved = Objects.requireNonNull(compiledDictionary, "compiledDictionary")
                .toAbsolutePath().normalize();
        binding.load(resolved);
        active.set(resolved);
        LOG.info("Activated compiled user dictionary {}", resolved);
    }

    @Override
    public void clear() {
        binding.unload();
        Path previous = active.getAndSet(null);
        if (previous != null) {
            LOG.debug("Detached compiled user dictionary {}", previous);
        }
    }

    @Override
    public Optional<Path> current() {
        return Optional.ofNullable(active.get());
    }
}
