package com.phillippitts.speakdict.service.dictionary.word;

/**
 * On-disk projection of {@link UserDictWord}.
 *
 * <p>Holds the analyzer cost rather than the priority. {@code contextId} and
 * {@code moraCount} are nullable because older dictionary files do not carry them.
 */
public record SaveFormatUserDictWord(
        String surface,
        int cost,
        Integer contextId,
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
        Integer moraCount,
        String accentAssociativeRule
) {
}
