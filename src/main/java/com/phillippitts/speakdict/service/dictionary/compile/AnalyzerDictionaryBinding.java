package com.phillippitts.speakdict.service.dictionary.compile;

import java.nio.file.Path;

/**
 * Narrow capability over the morphological analyzer's global user-dictionary slot.
 *
 * <p>The host application supplies a binding to its analyzer. The analyzer must tolerate
 * tokenization running concurrently with {@link #load(Path)} and {@link #unload()}.
 */
public interface AnalyzerDictionaryBinding {

    /** Makes the analyzer use the compiled dictionary at {@code compiledDictionary}. */
    void load(Path compiledDictionary);

    /** Detaches any user dictionary from the analyzer. */
    void unload();
}
