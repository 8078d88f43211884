package com.phillippitts.speakdict.service.dictionary.word;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts morae in a katakana pronunciation.
 *
 * <p>Digraphs such as キャ, ティ or ヴォ count as one mora; every other katakana letter and the
 * long-vowel mark ー count as one each. Alternatives are tried in order, so digraph rules take
 * precedence over the single-kana rule.
 */
public final class MoraCounter {

    private static final String RULE_OTHERS =
            "[イ][ェ]|[ヴ][ャュョ]|[トド][ゥ]|[テデ][ィャュョ]|[デ][ェ]|[クグ][ヮ]";
    private static final String RULE_LINE_I = "[キシチニヒミリギジビピ][ェャュョ]";
    private static final String RULE_LINE_U = "[ツフヴ][ァ]|[ウスツフヴズ][ィ]|[ウツフヴ][ェォ]";
    private static final String RULE_ONE_MORA = "[ァ-ヴー]";

    private static final Pattern MORA = Pattern.compile(
            "(?:" + RULE_OTHERS + "|" + RULE_LINE_I + "|" + RULE_LINE_U + "|" + RULE_ONE_MORA + ")");

    private MoraCounter() {
        // Utility class - prevent instantiation
    }

    /**
     * @param pronunciation katakana text (characters outside the katakana block are ignored)
     * @return number of morae, 0 for null or empty input
     */
    public static int count(String pronunciation) {
        if (pronunciation == null || pronunciation.isEmpty()) {
            return 0;
        }
        Matcher m = MORA.matcher(pronunciation);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
