package com.phillippitts.speakdict.service.dictionary.word;

/**
 * User-facing word categories. Each maps to exactly one row of {@link PartOfSpeechTable}.
 */
public enum WordType {
    PROPER_NOUN,
    COMMON_NOUN,
    VERB,
    ADJECTIVE,
    SUFFIX
}
