package com.phillippitts.speakdict.exception;

/**
 * Thrown when the user dictionary file exists but cannot be parsed into word records.
 * Fatal to the operation that read it; the file is never repaired automatically.
 */
public class CorruptStoreException extends SpeakDictException {

    private final String storePath;

    public CorruptStoreException(String storePath, String reason) {
        super("User dictionary at " + storePath + " is corrupt: " + reason);
        this.storePath = storePath;
    }

    public CorruptStoreException(String storePath, String reason, Throwable cause) {
        super("User dictionary at " + storePath + " is corrupt: " + reason, cause);
        this.storePath = storePath;
    }

    public String getStorePath() {
        return storePath;
    }
}
