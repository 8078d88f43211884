package com.phillippitts.speakdict.service.dictionary.store;

import com.phillippitts.speakdict.service.dictionary.word.UserDictWord;

import java.util.Map;
import java.util.function.Function;

/**
 * Durable record of user dictionary words, keyed by canonical word id.
 *
 * <p>Implementations guard every read and write with one store lock. The lock is not
 * re-entrant for callers: a mutation passed to {@link #update(Function)} must not call back
 * into the store.
 */
public interface UserDictStore {

    /**
     * Reads the whole dictionary.
     *
     * @return snapshot of id to word; empty when nothing has been stored yet
     * @throws com.phillippitts.speakdict.exception.CorruptStoreException if the stored data
     *         cannot be parsed
     */
    Map<String, UserDictWord> readAll();

    /**
     * Replaces the stored dictionary with {@code words}.
     */
    void writeAll(Map<String, UserDictWord> words);

    /**
     * Read-modify-write in a single critical section.
     *
     * <p>The mutation receives a mutable copy of the current dictionary. Its changes are
     * written back only when it returns normally; an exception leaves the store untouched
     * and propagates to the caller.
     *
     * @param mutation edits the dictionary in place and returns a result for the caller
     * @param <T> result type
     * @return the mutation's result
     */
    <T> T update(Function<Map<String, UserDictWord>, T> mutation);

    /** Human-readable location of the store, for logs and health details. */
    String location();
}
