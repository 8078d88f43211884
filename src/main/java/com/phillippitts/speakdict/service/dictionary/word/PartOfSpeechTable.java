package com.phillippitts.speakdict.service.dictionary.word;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static part-of-speech reference table for user dictionary words.
 *
 * <p>Built once at class initialization and never mutated. Lookups by word type, by the
 * (part-of-speech, detail-1, detail-2, detail-3) quadruple and by context id are all
 * constant-time map reads.
 */
public final class PartOfSpeechTable {

    private static final Set<String> NOUN_RULES = Set.of("*", "C1", "C2", "C3", "C4", "C5");
    private static final Set<String> DEFAULT_RULES = Set.of("*");

    private static final Map<WordType, PartOfSpeechDetail> BY_TYPE;
    private static final Map<PosKey, PartOfSpeechDetail> BY_POS;
    private static final Map<Integer, PartOfSpeechDetail> BY_CONTEXT_ID;

    static {
        Map<WordType, PartOfSpeechDetail> byType = new EnumMap<>(WordType.class);
        byType.put(WordType.PROPER_NOUN, new PartOfSpeechDetail(
                "名詞", "固有名詞", "一般", "*", 1348,
                List.of(-988, 3488, 4768, 6048, 7328, 8609, 8734, 8859, 8984, 9110, 14176),
                NOUN_RULES));
        byType.put(WordType.COMMON_NOUN, new PartOfSpeechDetail(
                "名詞", "一般", "*", "*", 1345,
                List.of(-4445, 49, 1473, 2897, 4321, 5746, 6554, 7362, 8170, 8979, 15001),
                NOUN_RULES));
        byType.put(WordType.VERB, new PartOfSpeechDetail(
                "動詞", "自立", "*", "*", 642,
                List.of(3100, 6160, 6360, 6561, 6761, 6962, 7414, 7866, 8318, 8771, 13433),
                DEFAULT_RULES));
        byType.put(WordType.ADJECTIVE, new PartOfSpeechDetail(
                "形容詞", "自立", "*", "*", 20,
                List.of(1527, 3266, 3561, 3857, 4153, 4449, 5149, 5849, 6549, 7250, 10001),
                DEFAULT_RULES));
        byType.put(WordType.SUFFIX, new PartOfSpeechDetail(
                "名詞", "接尾", "一般", "*", 1358,
                List.of(4399, 5373, 6041, 6710, 7378, 8047, 9440, 10834, 12228, 13622, 15847),
                NOUN_RULES));

        Map<PosKey, PartOfSpeechDetail> byPos = new HashMap<>();
        Map<Integer, PartOfSpeechDetail> byContextId = new HashMap<>();
        for (PartOfSpeechDetail detail : byType.values()) {
            byPos.put(PosKey.of(detail), detail);
            byContextId.put(detail.contextId(), detail);
        }

        BY_TYPE = Collections.unmodifiableMap(byType);
        BY_POS = Map.copyOf(byPos);
        BY_CONTEXT_ID = Map.copyOf(byContextId);
    }

    private PartOfSpeechTable() {
        // Utility class - prevent instantiation
    }

    /** Row for a user-facing word type; every type has one. */
    public static PartOfSpeechDetail forType(WordType type) {
        return BY_TYPE.get(Objects.requireNonNull(type, "type"));
    }

    /** Row whose four part-of-speech codes equal the given ones. */
    public static Optional<PartOfSpeechDetail> findByPartOfSpeech(String pos, String detail1,
                                                                  String detail2, String detail3) {
        return Optional.ofNullable(BY_POS.get(new PosKey(pos, detail1, detail2, detail3)));
    }

    public static Optional<PartOfSpeechDetail> findByContextId(int contextId) {
        return Optional.ofNullable(BY_CONTEXT_ID.get(contextId));
    }

    public static Collection<PartOfSpeechDetail> all() {
        return BY_TYPE.values();
    }

    private record PosKey(String pos, String detail1, String detail2, String detail3) {
        static PosKey of(PartOfSpeechDetail d) {
            return new PosKey(d.partOfSpeech(), d.partOfSpeechDetail1(),
                    d.partOfSpeechDetail2(), d.partOfSpeechDetail3());
        }
    }
}
