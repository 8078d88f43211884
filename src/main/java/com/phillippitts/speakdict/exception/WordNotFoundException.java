package com.phillippitts.speakdict.exception;

/**
 * Thrown when an update or delete references a word id that is not in the user dictionary.
 */
public class WordNotFoundException extends SpeakDictException {

    private final String wordId;

    public WordNotFoundException(String wordId) {
        super("No user dictionary word with id: " + wordId);
        this.wordId = wordId;
    }

    public String getWordId() {
        return wordId;
    }
}
