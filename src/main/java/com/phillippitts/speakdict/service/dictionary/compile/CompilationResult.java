package com.phillippitts.speakdict.service.dictionary.compile;

/**
 * Outcome of a recompilation that did not throw.
 */
public enum CompilationResult {
    /** A new compiled dictionary was produced and activated. */
    COMPILED,
    /** Nothing done: test harness on a platform where reloading the analyzer fails. */
    SKIPPED_TEST_HARNESS,
    /** Nothing done: no base lexicon file was found; the active dictionary is unchanged. */
    SKIPPED_NO_BASE_LEXICON
}
