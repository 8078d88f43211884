package com.phillippitts.speakdict.service.dictionary.compile;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Process-wide handle to the compiled dictionary the analyzer is using.
 *
 * <p>Single writer (the compilation pipeline, under its lock), many readers. Empty at start,
 * set once per successful recompilation.
 */
public interface ActiveDictionarySlot {

    /** Registers {@code compiledDictionary} as the active dictionary. */
    void activate(Path compiledDictionary);

    /** Detaches the active dictionary, if any. */
    void clear();

    /** The active compiled dictionary, or empty before the first successful compilation. */
    Optional<Path> current();
}
