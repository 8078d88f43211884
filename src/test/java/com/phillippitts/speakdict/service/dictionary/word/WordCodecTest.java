package com.phillippitts.speakdict.service.dictionary.word;

import com.phillippitts.speakdict.exception.WordValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordCodecTest {

    private static final int PROPER_NOUN_ID = 1348;
    private static final int COMMON_NOUN_ID = 1345;

    @Test
    void toRecordBuildsProperNounWithTableCost() {
        UserDictWord word = WordCodec.toRecord(new WordProperty("テスト", "テスト", 1, WordType.PROPER_NOUN, 5));

        assertThat(word.surface()).isEqualTo("テスト");
        assertThat(word.contextId()).isEqualTo(PROPER_NOUN_ID);
        assertThat(word.partOfSpeech()).isEqualTo("名詞");
        assertThat(word.partOfSpeechDetail1()).isEqualTo("固有名詞");
        assertThat(word.yomi()).isEqualTo("テスト");
        assertThat(word.pronunciation()).isEqualTo("テスト");
        assertThat(word.moraCount()).isEqualTo(3);
        assertThat(word.accentAssociativeRule()).isEqualTo("*");
        assertThat(word.inflectionalType()).isEqualTo("*");
        assertThat(WordCodec.costFromPriority(word.contextId(), word.priority())).isEqualTo(8609);
    }

    @Test
    void commonNounPriorityFiveCost() {
        UserDictWord word = WordCodec.toRecord(new WordProperty("テスト", "テスト", 0, WordType.COMMON_NOUN, 5));

        assertThat(word.contextId()).isEqualTo(COMMON_NOUN_ID);
        assertThat(WordCodec.toSaveFormat(word).cost()).isEqualTo(5746);
    }

    @Test
    void toRecordConvertsAsciiSurfaceToFullWidth() {
        UserDictWord word = WordCodec.toRecord(WordProperty.of("AI", "エーアイ", 0));

        assertThat(word.surface()).isEqualTo("\uFF21\uFF29");
    }

    @Test
    void nullWordTypeMeansProperNoun() {
        WordProperty property = new WordProperty("テスト", "テスト", 1, null, 5);

        assertThat(WordCodec.toRecord(property).contextId()).isEqualTo(PROPER_NOUN_ID);
    }

    @Test
    void blankSurfaceIsRejected() {
        assertThatThrownBy(() -> WordCodec.toRecord(WordProperty.of("  ", "テスト", 1)))
                .isInstanceOf(WordValidationException.class)
                .hasMessage("Invalid surface: must not be blank");
    }

    @Test
    void accentBeyondMoraCountIsRejected() {
        assertThatThrownBy(() -> WordCodec.toRecord(WordProperty.of("テスト", "テスト", 4)))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("accent_type"));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 11, 100})
    void outOfRangePriorityIsRejected(int priority) {
        assertThatThrownBy(() -> WordCodec.costFromPriority(PROPER_NOUN_ID, priority))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("priority"));
        assertThatThrownBy(() -> WordCodec.toRecord(new WordProperty("テスト", "テスト", 1, WordType.VERB, priority)))
                .isInstanceOf(WordValidationException.class);
    }

    @Test
    void unknownContextIdIsRejected() {
        assertThatThrownBy(() -> WordCodec.costFromPriority(1, 5))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("context_id"));
    }

    @ParameterizedTest
    @EnumSource(WordType.class)
    void costNeverIncreasesWithPriority(WordType type) {
        int contextId = PartOfSpeechTable.forType(type).contextId();
        for (int p = WordCodec.MIN_PRIORITY; p < WordCodec.MAX_PRIORITY; p++) {
            assertThat(WordCodec.costFromPriority(contextId, p + 1))
                    .as("priority %d -> %d", p, p + 1)
                    .isLessThanOrEqualTo(WordCodec.costFromPriority(contextId, p));
        }
    }

    @ParameterizedTest
    @EnumSource(WordType.class)
    void priorityFromCostInvertsCostFromPriority(WordType type) {
        int contextId = PartOfSpeechTable.forType(type).contextId();
        for (int p = WordCodec.MIN_PRIORITY; p <= WordCodec.MAX_PRIORITY; p++) {
            assertThat(WordCodec.priorityFromCost(contextId, WordCodec.costFromPriority(contextId, p))).isEqualTo(p);
        }
    }

    @Test
    void priorityFromCostPicksNearestCandidate() {
        // 8609 is priority 5, 8734 priority 4
        assertThat(WordCodec.priorityFromCost(PROPER_NOUN_ID, 8650)).isEqualTo(5);
        assertThat(WordCodec.priorityFromCost(PROPER_NOUN_ID, 8700)).isEqualTo(4);
        assertThat(WordCodec.priorityFromCost(PROPER_NOUN_ID, Integer.MAX_VALUE)).isEqualTo(0);
        assertThat(WordCodec.priorityFromCost(PROPER_NOUN_ID, Integer.MIN_VALUE)).isEqualTo(10);
    }

    @Test
    void priorityFromCostTieGoesToHigherPriority() {
        // halfway between 5746 (priority 5) and 6554 (priority 4)
        assertThat(WordCodec.priorityFromCost(COMMON_NOUN_ID, 6150)).isEqualTo(5);
    }

    @ParameterizedTest
    @EnumSource(WordType.class)
    void saveFormatRoundTripKeepsAllFields(WordType type) {
        UserDictWord word = WordCodec.toRecord(new WordProperty("ＳＡＶＥ", "セーブ", 2, type, 7));

        UserDictWord reloaded = WordCodec.fromSaveFormat(WordCodec.toSaveFormat(word));

        assertThat(reloaded).isEqualTo(word);
    }

    @Test
    void legacySaveFormatDefaultsContextIdAndMoraCount() {
        SaveFormatUserDictWord legacy = new SaveFormatUserDictWord(
                "テスト", 8609, null, "名詞", "固有名詞", "一般", "*",
                "*", "*", "*", "テスト", "テスト", 1, null, "*");

        UserDictWord word = WordCodec.fromSaveFormat(legacy);

        assertThat(word.contextId()).isEqualTo(PROPER_NOUN_ID);
        assertThat(word.moraCount()).isEqualTo(3);
        assertThat(word.priority()).isEqualTo(5);
    }

    @Test
    void storedMoraCountMustMatchPronunciation() {
        SaveFormatUserDictWord saved = new SaveFormatUserDictWord(
                "テスト", 8609, PROPER_NOUN_ID, "名詞", "固有名詞", "一般", "*",
                "*", "*", "*", "テスト", "テスト", 1, 4, "*");

        assertThatThrownBy(() -> WordCodec.fromSaveFormat(saved))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("mora_count"));
    }

    @Test
    void validateRejectsRuleNotAllowedForPartOfSpeech() {
        UserDictWord verb = WordCodec.toRecord(new WordProperty("ハシル", "ハシル", 2, WordType.VERB, 5));
        UserDictWord withNounRule = new UserDictWord(verb.surface(), verb.priority(), verb.contextId(),
                verb.partOfSpeech(), verb.partOfSpeechDetail1(), verb.partOfSpeechDetail2(),
                verb.partOfSpeechDetail3(), verb.inflectionalType(), verb.inflectionalForm(), verb.stem(),
                verb.yomi(), verb.pronunciation(), verb.accentType(), verb.moraCount(), "C1");

        assertThatThrownBy(() -> WordCodec.validate(withNounRule))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("accent_associative_rule"));
    }

    @Test
    void validateRejectsContextIdOfAnotherRow() {
        UserDictWord noun = WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1));
        UserDictWord mismatched = new UserDictWord(noun.surface(), noun.priority(), COMMON_NOUN_ID,
                noun.partOfSpeech(), noun.partOfSpeechDetail1(), noun.partOfSpeechDetail2(),
                noun.partOfSpeechDetail3(), noun.inflectionalType(), noun.inflectionalForm(), noun.stem(),
                noun.yomi(), noun.pronunciation(), noun.accentType(), noun.moraCount(), "*");

        assertThatThrownBy(() -> WordCodec.validate(mismatched))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("context_id"));
    }

    @Test
    void validateRejectsUnknownPartOfSpeech() {
        UserDictWord noun = WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1));
        UserDictWord unknown = new UserDictWord(noun.surface(), noun.priority(), noun.contextId(),
                "助詞", "格助詞", "一般", "*", "*", "*", "*",
                noun.yomi(), noun.pronunciation(), noun.accentType(), noun.moraCount(), "*");

        assertThatThrownBy(() -> WordCodec.validate(unknown))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("part_of_speech"));
    }

    @Test
    void controlCharacterInSurfaceIsRejected() {
        assertThatThrownBy(() -> WordCodec.toRecord(WordProperty.of("a\nb", "テスト", 1)))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("surface"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a,b", "a\nINJECTED", "a\rb", "a\tb", "a\u2028b"})
    void validateRejectsSeparatorsInSurface(String surface) {
        UserDictWord noun = WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1));
        UserDictWord tampered = new UserDictWord(surface, noun.priority(), noun.contextId(),
                noun.partOfSpeech(), noun.partOfSpeechDetail1(), noun.partOfSpeechDetail2(),
                noun.partOfSpeechDetail3(), noun.inflectionalType(), noun.inflectionalForm(), noun.stem(),
                noun.yomi(), noun.pronunciation(), noun.accentType(), noun.moraCount(), "*");

        assertThatThrownBy(() -> WordCodec.validate(tampered))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("surface"));
    }

    @Test
    void validateRejectsSeparatorsInOtherTextColumns() {
        UserDictWord n = WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1));

        assertThatThrownBy(() -> WordCodec.validate(new UserDictWord(n.surface(), n.priority(), n.contextId(),
                n.partOfSpeech(), n.partOfSpeechDetail1(), n.partOfSpeechDetail2(), n.partOfSpeechDetail3(),
                "*,x", n.inflectionalForm(), n.stem(), n.yomi(), n.pronunciation(), n.accentType(),
                n.moraCount(), "*")))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("inflectional_type"));
        assertThatThrownBy(() -> WordCodec.validate(new UserDictWord(n.surface(), n.priority(), n.contextId(),
                n.partOfSpeech(), n.partOfSpeechDetail1(), n.partOfSpeechDetail2(), n.partOfSpeechDetail3(),
                n.inflectionalType(), n.inflectionalForm(), "*\n", n.yomi(), n.pronunciation(), n.accentType(),
                n.moraCount(), "*")))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("stem"));
        assertThatThrownBy(() -> WordCodec.validate(new UserDictWord(n.surface(), n.priority(), n.contextId(),
                n.partOfSpeech(), n.partOfSpeechDetail1(), n.partOfSpeechDetail2(), n.partOfSpeechDetail3(),
                n.inflectionalType(), n.inflectionalForm(), n.stem(), "テ,スト", n.pronunciation(), n.accentType(),
                n.moraCount(), "*")))
                .isInstanceOfSatisfying(WordValidationException.class,
                        e -> assertThat(e.getField()).isEqualTo("yomi"));
    }
}
