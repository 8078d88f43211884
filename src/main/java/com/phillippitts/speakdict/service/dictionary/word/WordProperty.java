package com.phillippitts.speakdict.service.dictionary.word;

/**
 * Externally supplied description of a user dictionary word.
 *
 * @param surface written form (converted to full-width when stored)
 * @param pronunciation katakana pronunciation
 * @param accentType mora index of the pitch-accent fall (0 = flat)
 * @param wordType word category; {@code null} means {@link WordType#PROPER_NOUN}
 * @param priority user-facing weight in [0, 10]; higher makes the analyzer prefer the word
 */
public record WordProperty(
        String surface,
        String pronunciation,
        int accentType,
        WordType wordType,
        int priority
) {

    /** Priority given to words when the caller does not choose one. */
    public static final int DEFAULT_PRIORITY = 5;

    public WordProperty {
        if (wordType == null) {
            wordType = WordType.PROPER_NOUN;
        }
    }

    /** Proper noun with the default priority. */
    public static WordProperty of(String surface, String pronunciation, int accentType) {
        return new WordProperty(surface, pronunciation, accentType, WordType.PROPER_NOUN, DEFAULT_PRIORITY);
    }
}
