package com.phillippitts.speakdict.service.dictionary.word;

import java.util.Objects;

/**
 * A stored user dictionary entry, keyed by its UUID in the user dictionary.
 *
 * <p>Construction only checks for nulls. The part-of-speech / accent-rule invariant and the
 * pronunciation rules are enforced by {@link WordCodec#validate(UserDictWord)}, which every
 * path into the store goes through.
 */
public record UserDictWord(
        String surface,
        int priority,
        int contextId,
        String partOfSpeech,
        String partOfSpeechDetail1,
        String partOfSpeechDetail2,
        String partOfSpeechDetail3,
        String inflectionalType,
        String inflectionalForm,
        String stem,
        String yomi,
        String pronunciation,
        int accentType,
        int moraCount,
        String accentAssociativeRule
) {

    public UserDictWord {
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(partOfSpeech, "partOfSpeech");
        Objects.requireNonNull(partOfSpeechDetail1, "partOfSpeechDetail1");
        Objects.requireNonNull(partOfSpeechDetail2, "partOfSpeechDetail2");
        Objects.requireNonNull(partOfSpeechDetail3, "partOfSpeechDetail3");
        Objects.requireNonNull(inflectionalType, "inflectionalType");
        Objects.requireNonNull(inflectionalForm, "inflectionalForm");
        Objects.requireNonNull(stem, "stem");
        Objects.requireNonNull(yomi, "yomi");
        Objects.requireNonNull(pronunciation, "pronunciation");
        Objects.requireNonNull(accentAssociativeRule, "accentAssociativeRule");
    }
}
