package com.phillippitts.speakdict.config.dictionary;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * File locations and behaviour switches for the user dictionary.
 * Binds to properties prefixed with "speakdict.dictionary".
 *
 * <p>Example application.properties:
 * <pre>
 * speakdict.dictionary.base-lexicon-dir=resources/dictionaries
 * speakdict.dictionary.base-lexicon-pattern=*.csv.zst
 * speakdict.dictionary.user-dict-path=data/user_dict.json
 * speakdict.dictionary.compiled-dict-path=data/user.dic
 * speakdict.dictionary.test-harness=false
 * speakdict.dictionary.compile-on-startup=true
 * </pre>
 *
 * @param baseLexiconDir directory holding the bundled, read-only base lexicon files
 * @param baseLexiconPattern glob selecting base lexicon files inside {@code baseLexiconDir}
 * @param userDictPath JSON file holding the user entries
 * @param compiledDictPath binary dictionary consumed by the analyzer
 * @param testHarness true when running under an automated test harness: only the small
 *                    uncompressed {@code 01_default.csv} lexicon is used, and recompilation is
 *                    skipped altogether on Windows
 * @param compileOnStartup whether to compile the dictionary once when the application starts
 */
@ConfigurationProperties(prefix = "speakdict.dictionary")
@Validated
public record DictionaryProperties(
        @NotBlank(message = "Base lexicon directory must not be blank")
        @DefaultValue("resources/dictionaries")
        String baseLexiconDir,

        @NotBlank(message = "Base lexicon pattern must not be blank")
        @DefaultValue("*.csv.zst")
        String baseLexiconPattern,

        @NotBlank(message = "User dictionary path must not be blank")
        @DefaultValue("data/user_dict.json")
        String userDictPath,

        @NotBlank(message = "Compiled dictionary path must not be blank")
        @DefaultValue("data/user.dic")
        String compiledDictPath,

        @DefaultValue("false")
        boolean testHarness,

        @DefaultValue("true")
        boolean compileOnStartup
) {
}
