package com.phillippitts.speakdict.service.dictionary.compile;

import com.phillippitts.speakdict.service.dictionary.word.UserDictWord;
import com.phillippitts.speakdict.service.dictionary.word.WordCodec;

/**
 * Formats user words as lines of the compiler's comma-separated lexicon source:
 * <pre>
 * surface,left_id,right_id,cost,pos,pos1,pos2,pos3,infl_type,infl_form,stem,yomi,pron,accent/mora,rule
 * </pre>
 * Left and right id are both the word's context id.
 */
final class LexiconCsvFormatter {

    private LexiconCsvFormatter() {
        // Utility class - prevent instantiation
    }

    static String format(UserDictWord w) {
        return String.join(",",
                w.surface(),
                String.valueOf(w.contextId()),
                String.valueOf(w.contextId()),
                String.valueOf(WordCodec.costFromPriority(w.contextId(), w.priority())),
                w.partOfSpeech(),
                w.partOfSpeechDetail1(),
                w.partOfSpeechDetail2(),
                w.partOfSpeechDetail3(),
                w.inflectionalType(),
                w.inflectionalForm(),
                w.stem(),
                w.yomi(),
                w.pronunciation(),
                w.accentType() + "/" + w.moraCount(),
                w.accentAssociativeRule());
    }
}
