package com.phillippitts.speakdict.service.dictionary.store;

import com.phillippitts.speakdict.config.dictionary.DictionaryProperties;
import com.phillippitts.speakdict.exception.CorruptStoreException;
import com.phillippitts.speakdict.exception.SpeakDictException;
import com.phillippitts.speakdict.exception.WordValidationException;
import com.phillippitts.speakdict.service.dictionary.word.SaveFormatUserDictWord;
import com.phillippitts.speakdict.service.dictionary.word.UserDictWord;
import com.phillippitts.speakdict.service.dictionary.word.WordCodec;
import com.phillippitts.speakdict.service.dictionary.word.WordIds;
import com.phillippitts.speakdict.util.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONStringer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * {@link UserDictStore} backed by a single UTF-8 JSON file:
 * <pre>
 * {"&lt;uuid&gt;": {"surface": "...", "cost": 8609, "context_id": 1348, ...}, ...}
 * </pre>
 *
 * <p>Every operation re-reads the file, so the latest committed state is always used. Writes
 * go to a sibling temp file that is then renamed over the store file, so a crash mid-write
 * leaves the previous content intact. Keys are written in sorted order for stable diffs.
 *
 * <p><b>Thread Safety:</b> all file access happens under {@link #lock}. The lock is never
 * held while acquiring the compilation lock.
 */
@Component
public class JsonUserDictStore implements UserDictStore {

    private static final Logger LOG = LogManager.getLogger(JsonUserDictStore.class);

    static final String SURFACE = "surface";
    static final String COST = "cost";
    static final String CONTEXT_ID = "context_id";
    static final String PART_OF_SPEECH = "part_of_speech";
    static final String PART_OF_SPEECH_DETAIL_1 = "part_of_speech_detail_1";
    static final String PART_OF_SPEECH_DETAIL_2 = "part_of_speech_detail_2";
    static final String PART_OF_SPEECH_DETAIL_3 = "part_of_speech_detail_3";
    static final String INFLECTIONAL_TYPE = "inflectional_type";
    static final String INFLECTIONAL_FORM = "inflectional_form";
    static final String STEM = "stem";
    static final String YOMI = "yomi";
    static final String PRONUNCIATION = "pronunciation";
    static final String ACCENT_TYPE = "accent_type";
    static final String MORA_COUNT = "mora_count";
    static final String ACCENT_ASSOCIATIVE_RULE = "accent_associative_rule";

    private static final Set<String> KNOWN_FIELDS = Set.of(
            SURFACE, COST, CONTEXT_ID, PART_OF_SPEECH, PART_OF_SPEECH_DETAIL_1,
            PART_OF_SPEECH_DETAIL_2, PART_OF_SPEECH_DETAIL_3, INFLECTIONAL_TYPE,
            INFLECTIONAL_FORM, STEM, YOMI, PRONUNCIATION, ACCENT_TYPE, MORA_COUNT,
            ACCENT_ASSOCIATIVE_RULE);

    private final Path storePath;
    private final ReentrantLock lock = new ReentrantLock();

    @Autowired
    public JsonUserDictStore(DictionaryProperties properties) {
        this(Path.of(properties.userDictPath()));
    }

    JsonUserDictStore(Path storePath) {
        this.storePath = Objects.requireNonNull(storePath, "storePath").toAbsolutePath().normalize();
    }

    @Override
    public Map<String, UserDictWord> readAll() {
        acquire();
        try {
            return Collections.unmodifiableMap(readUnlocked());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void writeAll(Map<String, UserDictWord> words) {
        Objects.requireNonNull(words, "words");
        acquire();
        try {
            writeUnlocked(words);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public <T> T update(Function<Map<String, UserDictWord>, T> mutation) {
        Objects.requireNonNull(mutation, "mutation");
        acquire();
        try {
            Map<String, UserDictWord> words = readUnlocked();
            T result = mutation.apply(words);
            writeUnlocked(words);
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String location() {
        return storePath.toString();
    }

    Path path() {
        return storePath;
    }

    private void acquire() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("User dictionary store lock must not be acquired recursively");
        }
        lock.lock();
    }

    private Map<String, UserDictWord> readUnlocked() {
        if (!Files.isRegularFile(storePath)) {
            return new LinkedHashMap<>();
        }
        String json;
        try {
            json = Files.readString(storePath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorruptStoreException(storePath.toString(), "unreadable: " + e.getMessage(), e);
        }

        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            throw new CorruptStoreException(storePath.toString(), "malformed JSON: " + e.getMessage(), e);
        }

        Map<String, UserDictWord> words = new LinkedHashMap<>();
        for (String key : new TreeSet<>(root.keySet())) {
            String id = WordIds.canonical(key).orElseThrow(() ->
                    new CorruptStoreException(storePath.toString(), "word id is not a UUID: " + key));
            if (words.containsKey(id)) {
                throw new CorruptStoreException(storePath.toString(), "duplicate word id " + id);
            }
            JSONObject entry = root.optJSONObject(key);
            if (entry == null) {
                throw new CorruptStoreException(storePath.toString(), "word " + id + " is not an object");
            }
            words.put(id, decodeWord(id, entry));
        }
        LOG.debug("Read {} user dictionary words from {}", words.size(), storePath);
        return words;
    }

    private UserDictWord decodeWord(String id, JSONObject entry) {
        for (String field : entry.keySet()) {
            if (!KNOWN_FIELDS.contains(field)) {
                LOG.warn("Ignoring unknown field '{}' of user dictionary word {} in {}", field, id, storePath);
            }
        }
        try {
            SaveFormatUserDictWord saved = new SaveFormatUserDictWord(
                    entry.getString(SURFACE),
                    requireInt(entry, COST),
                    optionalInt(entry, CONTEXT_ID),
                    entry.getString(PART_OF_SPEECH),
                    entry.getString(PART_OF_SPEECH_DETAIL_1),
                    entry.getString(PART_OF_SPEECH_DETAIL_2),
                    entry.getString(PART_OF_SPEECH_DETAIL_3),
                    entry.getString(INFLECTIONAL_TYPE),
                    entry.getString(INFLECTIONAL_FORM),
                    entry.getString(STEM),
                    entry.getString(YOMI),
                    entry.getString(PRONUNCIATION),
                    requireInt(entry, ACCENT_TYPE),
                    optionalInt(entry, MORA_COUNT),
                    entry.getString(ACCENT_ASSOCIATIVE_RULE));
            return WordCodec.fromSaveFormat(saved);
        } catch (JSONException | WordValidationException e) {
            throw new CorruptStoreException(storePath.toString(),
                    "word " + id + ": " + e.getMessage(), e);
        }
    }

    private static Integer optionalInt(JSONObject entry, String key) {
        if (!entry.has(key) || entry.isNull(key)) {
            return null;
        }
        return requireInt(entry, key);
    }

    // getInt() coerces strings and truncates fractions; stored numbers must be plain ints
    private static int requireInt(JSONObject entry, String key) {
        Object value = entry.get(key);
        if (!(value instanceof Integer)) {
            throw new JSONException("JSONObject[\"" + key + "\"] is not an integer: " + value);
        }
        return (Integer) value;
    }

    private void writeUnlocked(Map<String, UserDictWord> words) {
        String json = encode(words);
        Path tmp = storePath.resolveSibling(storePath.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            Path parent = storePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            AtomicFiles.replace(tmp, storePath);
            LOG.debug("Wrote {} user dictionary words to {}", words.size(), storePath);
        } catch (IOException e) {
            throw new SpeakDictException("Failed to write user dictionary to " + storePath, e);
        } finally {
            AtomicFiles.deleteQuietly(tmp);
        }
    }

    private static String encode(Map<String, UserDictWord> words) {
        JSONStringer json = new JSONStringer();
        json.object();
        for (Map.Entry<String, UserDictWord> e : new TreeMap<>(words).entrySet()) {
            SaveFormatUserDictWord w = WordCodec.toSaveFormat(e.getValue());
            json.key(e.getKey()).object()
                    .key(SURFACE).value(w.surface())
                    .key(COST).value(w.cost())
                    .key(CONTEXT_ID).value(w.contextId())
                    .key(PART_OF_SPEECH).value(w.partOfSpeech())
                    .key(PART_OF_SPEECH_DETAIL_1).value(w.partOfSpeechDetail1())
                    .key(PART_OF_SPEECH_DETAIL_2).value(w.partOfSpeechDetail2())
                    .key(PART_OF_SPEECH_DETAIL_3).value(w.partOfSpeechDetail3())
                    .key(INFLECTIONAL_TYPE).value(w.inflectionalType())
                    .key(INFLECTIONAL_FORM).value(w.inflectionalForm())
                    .key(STEM).value(w.stem())
                    .key(YOMI).value(w.yomi())
                    .key(PRONUNCIATION).value(w.pronunciation())
                    .key(ACCENT_TYPE).value(w.accentType())
                    .key(MORA_COUNT).value(w.moraCount())
                    .key(ACCENT_ASSOCIATIVE_RULE).value(w.accentAssociativeRule())
                    .endObject();
        }
        json.endObject();
        return json.toString();
    }
}
