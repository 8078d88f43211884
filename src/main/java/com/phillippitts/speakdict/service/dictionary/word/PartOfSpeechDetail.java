package com.phillippitts.speakdict.service.dictionary.word;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One row of the part-of-speech reference table.
 *
 * @param partOfSpeech part-of-speech code (e.g. 名詞)
 * @param partOfSpeechDetail1 first detail sub-code
 * @param partOfSpeechDetail2 second detail sub-code
 * @param partOfSpeechDetail3 third detail sub-code
 * @param contextId analyzer context id (left and right id of the lexicon line)
 * @param costCandidates costs indexed by {@code MAX_PRIORITY - priority}; strictly increasing
 * @param accentAssociativeRules accent-associative rules allowed for this row
 */
public record PartOfSpeechDetail(
        String partOfSpeech,
        String partOfSpeechDetail1,
        String partOfSpeechDetail2,
        String partOfSpeechDetail3,
        int contextId,
        List<Integer> costCandidates,
        Set<String> accentAssociativeRules
) {

    public PartOfSpeechDetail {
        Objects.requireNonNull(partOfSpeech, "partOfSpeech");
        Objects.requireNonNull(partOfSpeechDetail1, "partOfSpeechDetail1");
        Objects.requireNonNull(partOfSpeechDetail2, "partOfSpeechDetail2");
        Objects.requireNonNull(partOfSpeechDetail3, "partOfSpeechDetail3");
        costCandidates = List.copyOf(costCandidates);
        accentAssociativeRules = Set.copyOf(accentAssociativeRules);
        if (costCandidates.size() != WordCodec.MAX_PRIORITY - WordCodec.MIN_PRIORITY + 1) {
            throw new IllegalArgumentException("Expected one cost candidate per priority, got "
                    + costCandidates.size());
        }
    }

    /** True when the four part-of-speech codes equal this row's codes. */
    public boolean matches(String pos, String detail1, String detail2, String detail3) {
        return partOfSpeech.equals(pos)
                && partOfSpeechDetail1.equals(detail1)
                && partOfSpeechDetail2.equals(detail2)
                && partOfSpeechDetail3.equals(detail3);
    }
}
