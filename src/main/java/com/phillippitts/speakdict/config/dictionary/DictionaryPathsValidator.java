package com.phillippitts.speakdict.config.dictionary;

import com.phillippitts.speakdict.exception.SpeakDictException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Prepares and checks dictionary locations at startup.
 *
 * Validation performed:
 * - Save directories for the JSON store and the compiled dictionary are created (fails startup
 *   if that is impossible)
 * - Base lexicon directory and compiler binary are checked; missing ones only warn, since the
 *   dictionary can still be edited and recompilation degrades to a no-op or a reported failure
 */
@Component
@ConditionalOnProperty(name = "speakdict.validation.enabled", havingValue = "true", matchIfMissing = true)
class DictionaryPathsValidator {

    private static final Logger LOG = LogManager.getLogger(DictionaryPathsValidator.class);

    private final DictionaryProperties dictionary;
    private final CompilerProperties compiler;

    DictionaryPathsValidator(DictionaryProperties dictionary, CompilerProperties compiler) {
        this.dictionary = dictionary;
        this.compiler = compiler;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating user dictionary paths... os={}", System.getProperty("os.name"));

        ensureParentDirectory(dictionary.userDictPath(), "User dictionary");
        ensureParentDirectory(dictionary.compiledDictPath(), "Compiled dictionary");
        checkBaseLexicon();
        checkCompiler();

        LOG.info("Dictionary paths: store='{}', compiled='{}', baseLexicon='{}'",
                dictionary.userDictPath(), dictionary.compiledDictPath(), dictionary.baseLexiconDir());
    }

    // Visible for tests
    void ensureParentDirectory(String pathString, String description) {
        Path parent = Paths.get(pathString).toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new SpeakDictException(description + " directory cannot be created: " + parent, e);
        }
    }

    // Visible for tests
    boolean checkBaseLexicon() {
        Path dir = Paths.get(dictionary.baseLexiconDir());
        if (!Files.isDirectory(dir)) {
            LOG.warn("Base lexicon directory not found: {}. Recompilation will be skipped until it is installed.",
                    dir.toAbsolutePath());
            return false;
        }
        return true;
    }

    // Visible for tests
    boolean checkCompiler() {
        Path binary = Paths.get(compiler.binaryPath());
        if (!Files.isRegularFile(binary)) {
            LOG.warn("Dictionary compiler not found: {} (configured as: {})",
                    binary.toAbsolutePath(), compiler.binaryPath());
            return false;
        }
        if (!Files.isExecutable(binary)) {
            LOG.warn("Dictionary compiler not executable: {} (try: chmod +x '{}')", binary, binary);
            return false;
        }
        return true;
    }
}
