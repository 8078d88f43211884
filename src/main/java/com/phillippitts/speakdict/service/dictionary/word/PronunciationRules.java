package com.phillippitts.speakdict.service.dictionary.word;

import com.phillippitts.speakdict.exception.WordValidationException;

import java.util.regex.Pattern;

/**
 * Checks that a pronunciation is well-formed katakana.
 *
 * <p>Rejected:
 * <ul>
 *   <li>anything outside {@code [ァ-ヴー]}</li>
 *   <li>a small kana directly followed by another small kana other than ッ (キャャ), and ッッ</li>
 *   <li>ヮ anywhere except at the start or after ク/グ</li>
 * </ul>
 * A small kana followed by ッ is allowed, as in キャット.
 */
final class PronunciationRules {

    private static final Pattern KATAKANA = Pattern.compile("[ァ-ヴー]+");
    private static final String SMALL_KANA = "ァィゥェォャュョヮ";
    private static final char SOKUON = 'ッ';
    private static final char SMALL_WA = 'ヮ';

    private PronunciationRules() {
        // Utility class - prevent instantiation
    }

    static void validate(String pronunciation) {
        if (pronunciation == null || !KATAKANA.matcher(pronunciation).matches()) {
            throw new WordValidationException("pronunciation", "must consist of katakana only");
        }
        int last = pronunciation.length() - 1;
        for (int i = 0; i <= last; i++) {
            char c = pronunciation.charAt(i);
            if (isSmall(c) && i < last) {
                char next = pronunciation.charAt(i + 1);
                if (SMALL_KANA.indexOf(next) >= 0 || (c == SOKUON && next == SOKUON)) {
                    throw new WordValidationException("pronunciation", "consecutive small kana");
                }
            }
            if (c == SMALL_WA && i != 0) {
                char prev = pronunciation.charAt(i - 1);
                if (prev != 'ク' && prev != 'グ') {
                    throw new WordValidationException("pronunciation", "ヮ may only follow ク or グ");
                }
            }
        }
    }

    private static boolean isSmall(char c) {
        return c == SOKUON || SMALL_KANA.indexOf(c) >= 0;
    }
}
