package com.phillippitts.speakdict.service.dictionary.word;

import com.phillippitts.speakdict.exception.WordValidationException;

import java.util.List;
import java.util.Objects;

/**
 * Conversions between {@link WordProperty}, {@link UserDictWord} and
 * {@link SaveFormatUserDictWord}, plus the priority/cost mapping used by the compiler.
 *
 * <p>Priority is a user-facing weight in [{@value #MIN_PRIORITY}, {@value #MAX_PRIORITY}].
 * The analyzer prefers low-cost entries, so cost never increases as priority increases.
 * Each part-of-speech row supplies one cost per priority.
 *
 * <p>Round trip: {@code fromSaveFormat(toSaveFormat(toRecord(p)))} equals {@code toRecord(p)}.
 * The mora count is recomputed on load and must agree with any stored value.
 */
public final class WordCodec {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;

    /** Filler for inflection, stem and accent-rule columns of user words. */
    static final String UNSPECIFIED = "*";

    /** Files written before context ids were stored only held proper nouns. */
    static final int LEGACY_CONTEXT_ID = PartOfSpeechTable.forType(WordType.PROPER_NOUN).contextId();

    private WordCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds a storable record from an external word property.
     *
     * @param property word to convert
     * @return validated record
     * @throws WordValidationException if any field is invalid
     */
    public static UserDictWord toRecord(WordProperty property) {
        Objects.requireNonNull(property, "property");
        if (property.surface() == null || property.surface().isBlank()) {
            throw new WordValidationException("surface", "must not be blank");
        }
        PronunciationRules.validate(property.pronunciation());
        checkPriority(property.priority());

        PartOfSpeechDetail pos = PartOfSpeechTable.forType(property.wordType());
        int moraCount = MoraCounter.count(property.pronunciation());

        UserDictWord word = new UserDictWord(
                SurfaceNormalizer.toFullWidth(property.surface()),
                property.priority(),
                pos.contextId(),
                pos.partOfSpeech(),
                pos.partOfSpeechDetail1(),
                pos.partOfSpeechDetail2(),
                pos.partOfSpeechDetail3(),
                UNSPECIFIED,
                UNSPECIFIED,
                UNSPECIFIED,
                property.pronunciation(),
                property.pronunciation(),
                property.accentType(),
                moraCount,
                UNSPECIFIED);
        validate(word);
        return word;
    }

    /**
     * Checks every invariant of a stored word.
     *
     * <p>The part-of-speech quadruple must match a table row, that row must own the word's
     * context id, and the accent-associative rule must be one the row allows. Priority,
     * pronunciation, mora count and accent position are checked as well. Free-text columns
     * must not contain commas or control characters, since each word becomes one line of the
     * comma-separated compiler source.
     *
     * @param word record to check
     * @throws WordValidationException on the first violation found
     */
    public static void validate(UserDictWord word) {
        Objects.requireNonNull(word, "word");
        if (word.surface() == null || word.surface().isBlank()) {
            throw new WordValidationException("surface", "must not be blank");
        }
        checkLexiconText("surface", word.surface());
        checkLexiconText("inflectional_type", word.inflectionalType());
        checkLexiconText("inflectional_form", word.inflectionalForm());
        checkLexiconText("stem", word.stem());
        checkLexiconText("yomi", word.yomi());
        PartOfSpeechDetail pos = PartOfSpeechTable.findByPartOfSpeech(
                        word.partOfSpeech(), word.partOfSpeechDetail1(),
                        word.partOfSpeechDetail2(), word.partOfSpeechDetail3())
                .orElseThrow(() -> new WordValidationException("part_of_speech",
                        "unsupported combination " + word.partOfSpeech() + ","
                                + word.partOfSpeechDetail1() + "," + word.partOfSpeechDetail2() + ","
                                + word.partOfSpeechDetail3()));
        if (pos.contextId() != word.contextId()) {
            throw new WordValidationException("context_id",
                    word.contextId() + " does not belong to part of speech " + pos.partOfSpeech()
                            + "," + pos.partOfSpeechDetail1());
        }
        if (!pos.accentAssociativeRules().contains(word.accentAssociativeRule())) {
            throw new WordValidationException("accent_associative_rule",
                    "'" + word.accentAssociativeRule() + "' is not allowed for this part of speech");
        }
        checkPriority(word.priority());
        PronunciationRules.validate(word.pronunciation());

        int moraCount = MoraCounter.count(word.pronunciation());
        if (word.moraCount() != moraCount) {
            throw new WordValidationException("mora_count",
                    "expected " + moraCount + " for the pronunciation, got " + word.moraCount());
        }
        checkAccentType(word.accentType(), moraCount);
    }

    /**
     * Maps a priority to the analyzer cost for a part-of-speech context.
     *
     * @param contextId context id of a table row
     * @param priority value in [{@value #MIN_PRIORITY}, {@value #MAX_PRIORITY}]
     * @return cost; lower for higher priority
     * @throws WordValidationException for an unknown context id or out-of-range priority
     */
    public static int costFromPriority(int contextId, int priority) {
        checkPriority(priority);
        return candidatesFor(contextId).get(MAX_PRIORITY - priority);
    }

    /**
     * Inverse of {@link #costFromPriority(int, int)}: the priority whose cost candidate is
     * nearest to {@code cost}. On a tie the higher priority wins.
     */
    public static int priorityFromCost(int contextId, int cost) {
        List<Integer> candidates = candidatesFor(contextId);
        int bestIndex = 0;
        long bestDistance = Long.MAX_VALUE;
        for (int i = 0; i < candidates.size(); i++) {
            long distance = Math.abs((long) candidates.get(i) - cost);
            if (distance < bestDistance) {
                bestDistance = distance;
                bestIndex = i;
            }
        }
        return MAX_PRIORITY - bestIndex;
    }

    public static SaveFormatUserDictWord toSaveFormat(UserDictWord word) {
        Objects.requireNonNull(word, "word");
        return new SaveFormatUserDictWord(
                word.surface(),
                costFromPriority(word.contextId(), word.priority()),
                word.contextId(),
                word.partOfSpeech(),
                word.partOfSpeechDetail1(),
                word.partOfSpeechDetail2(),
                word.partOfSpeechDetail3(),
                word.inflectionalType(),
                word.inflectionalForm(),
                word.stem(),
                word.yomi(),
                word.pronunciation(),
                word.accentType(),
                word.moraCount(),
                word.accentAssociativeRule());
    }

    /**
     * Rebuilds a record from its stored form, recomputing priority and mora count.
     *
     * @throws WordValidationException if the stored word violates any invariant, including a
     *         stored mora count that disagrees with the pronunciation
     */
    public static UserDictWord fromSaveFormat(SaveFormatUserDictWord saved) {
        Objects.requireNonNull(saved, "saved");
        int contextId = saved.contextId() != null ? saved.contextId() : LEGACY_CONTEXT_ID;
        int moraCount = MoraCounter.count(saved.pronunciation());
        if (saved.moraCount() != null && saved.moraCount() != moraCount) {
            throw new WordValidationException("mora_count",
                    "stored " + saved.moraCount() + " but pronunciation has " + moraCount);
        }
        UserDictWord word = new UserDictWord(
                saved.surface(),
                priorityFromCost(contextId, saved.cost()),
                contextId,
                saved.partOfSpeech(),
                saved.partOfSpeechDetail1(),
                saved.partOfSpeechDetail2(),
                saved.partOfSpeechDetail3(),
                saved.inflectionalType(),
                saved.inflectionalForm(),
                saved.stem(),
                saved.yomi(),
                saved.pronunciation(),
                saved.accentType(),
                moraCount,
                saved.accentAssociativeRule());
        validate(word);
        return word;
    }

    private static List<Integer> candidatesFor(int contextId) {
        return PartOfSpeechTable.findByContextId(contextId)
                .orElseThrow(() -> new WordValidationException("context_id",
                        "unknown context id " + contextId))
                .costCandidates();
    }

    private static void checkPriority(int priority) {
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new WordValidationException("priority",
                    priority + " is outside [" + MIN_PRIORITY + ", " + MAX_PRIORITY + "]");
        }
    }

    private static void checkLexiconText(String field, String value) {
        if (value == null) {
            throw new WordValidationException(field, "must not be null");
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ',' || Character.isISOControl(c) || c == '\u2028' || c == '\u2029') {
                throw new WordValidationException(field,
                        String.format("contains forbidden character U+%04X at index %d", (int) c, i));
            }
        }
    }

    private static void checkAccentType(int accentType, int moraCount) {
        if (accentType < 0 || accentType > moraCount) {
            throw new WordValidationException("accent_type",
                    accentType + " is outside [0, " + moraCount + "]");
        }
    }
}
