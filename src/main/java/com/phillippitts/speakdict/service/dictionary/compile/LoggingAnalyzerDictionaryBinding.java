package com.phillippitts.speakdict.service.dictionary.compile;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Binding used when no analyzer is wired in: records the swaps in the log only.
 * Registered by {@code DictionaryBeansConfig} unless another binding bean exists.
 */
public final class LoggingAnalyzerDictionaryBinding implements AnalyzerDictionaryBinding {

    private static final Logger LOG = LogManager.getLogger(LoggingAnalyzerDictionaryBinding.class);

    @Override
    public void load(Path compiledDictionary) {
        LOG.info("No analyzer bound; compiled user dictionary ready at {}", compiledDictionary);
    }

    @Override
    public void unload() {
        LOG.debug("No analyzer bound; nothing to unload");
    }
}
