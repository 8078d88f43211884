package com.phillippitts.speakdict.service.dictionary;

import com.phillippitts.speakdict.config.dictionary.DictionaryProperties;
import com.phillippitts.speakdict.exception.DictionaryCompilationException;
import com.phillippitts.speakdict.exception.WordNotFoundException;
import com.phillippitts.speakdict.exception.WordValidationException;
import com.phillippitts.speakdict.service.dictionary.compile.UserDictCompilationPipeline;
import com.phillippitts.speakdict.service.dictionary.store.UserDictStore;
import com.phillippitts.speakdict.service.dictionary.word.UserDictWord;
import com.phillippitts.speakdict.service.dictionary.word.WordCodec;
import com.phillippitts.speakdict.service.dictionary.word.WordIds;
import com.phillippitts.speakdict.service.dictionary.word.WordProperty;
import com.phillippitts.speakdict.service.metrics.DictionaryMetrics;
import com.phillippitts.speakdict.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Entry point for editing the user dictionary.
 *
 * <p>Every mutation is validated before any lock is taken, then applied as one
 * read-modify-write under the store lock, and finally followed by one recompilation under the
 * compilation lock. The two locks are never held together: between the write and the end of
 * the recompilation a reader may see the new words with the previous compiled dictionary.
 *
 * <p>A recompilation failure propagates to the caller after the words were saved; the
 * previously compiled dictionary stays active and the next successful mutation catches up.
 *
 * <p>Thread-safe. Operations run synchronously on the calling thread.
 */
@Component
public class UserDictionaryManager {

    private static final Logger LOG = LogManager.getLogger(UserDictionaryManager.class);

    private static final String OP_KEY = "dictOp";
    private static final String WORD_KEY = "wordId";

    private final UserDictStore store;
    private final UserDictCompilationPipeline pipeline;
    private final DictionaryMetrics metrics;
    private final boolean compileOnStartup;

    @Autowired
    public UserDictionaryManager(UserDictStore store,
                                 UserDictCompilationPipeline pipeline,
                                 DictionaryMetrics metrics,
                                 DictionaryProperties properties) {
        this(store, pipeline, metrics, properties.compileOnStartup());
    }

    UserDictionaryManager(UserDictStore store,
                          UserDictCompilationPipeline pipeline,
                          DictionaryMetrics metrics,
                          boolean compileOnStartup) {
        this.store = Objects.requireNonNull(store, "store");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.compileOnStartup = compileOnStartup;
    }

    /**
     * Brings the compiled dictionary in line with the store once at startup.
     *
     * <p>A failing compiler must not prevent startup: the failure is logged and reported by
     * the health indicator, and the dictionary remains editable.
     */
    @PostConstruct
    void initialize() {
        if (!compileOnStartup) {
            LOG.info("Startup compilation disabled; user dictionary not compiled");
            return;
        }
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(OP_KEY, "initialize")) {
            pipeline.recompile();
        } catch (DictionaryCompilationException e) {
            LOG.warn("Initial user dictionary compilation failed: {}", e.getMessage());
        }
    }

    /**
     * @return snapshot of all words keyed by id, in id order
     */
    public Map<String, UserDictWord> listWords() {
        return Collections.unmodifiableMap(new TreeMap<>(store.readAll()));
    }

    /**
     * Adds a word under a fresh id and recompiles.
     *
     * @return the new word id
     * @throws WordValidationException if the property is invalid; nothing is written
     */
    public String addWord(WordProperty property) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(OP_KEY, "add")) {
            UserDictWord word = WordCodec.toRecord(property);
            String id = store.update(words -> {
                String fresh = WordIds.newId();
                while (words.containsKey(fresh)) {
                    fresh = WordIds.newId();
                }
                words.put(fresh, word);
                return fresh;
            });
            ctc.put(WORD_KEY, id);
            metrics.incrementMutation("add");
            LOG.info("Added user dictionary word: surface={}, pronunciation={}",
                    LogSanitizer.preview(word.surface()), LogSanitizer.preview(word.pronunciation()));
            pipeline.recompile();
            return id;
        }
    }

    /**
     * Replaces the word stored under {@code wordId}, keeping the id.
     *
     * @throws WordNotFoundException if no word has that id
     * @throws WordValidationException if the property is invalid
     */
    public void updateWord(String wordId, WordProperty property) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(OP_KEY, "update")
                .put(WORD_KEY, String.valueOf(wordId))) {
            UserDictWord word = WordCodec.toRecord(property);
            String id = existingId(wordId);
            store.update(words -> {
                if (!words.containsKey(id)) {
                    throw new WordNotFoundException(wordId);
                }
                words.put(id, word);
                return null;
            });
            metrics.incrementMutation("update");
            LOG.info("Updated user dictionary word: surface={}", LogSanitizer.preview(word.surface()));
            pipeline.recompile();
        }
    }

    /**
     * Removes the word stored under {@code wordId}.
     *
     * @throws WordNotFoundException if no word has that id
     */
    public void deleteWord(String wordId) {
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(OP_KEY, "delete")
                .put(WORD_KEY, String.valueOf(wordId))) {
            String id = existingId(wordId);
            store.update(words -> {
                if (words.remove(id) == null) {
                    throw new WordNotFoundException(wordId);
                }
                return null;
            });
            metrics.incrementMutation("delete");
            LOG.info("Deleted user dictionary word");
            pipeline.recompile();
        }
    }

    /**
     * Merges already-built records into the dictionary.
     *
     * <p>All-or-nothing: every id and record is validated before the store is touched.
     *
     * @param incoming words keyed by id
     * @param override on id collision, true keeps the incoming word and false the stored one
     * @throws WordValidationException on the first invalid id or record; nothing is written
     */
    public void importWords(Map<String, UserDictWord> incoming, boolean override) {
        Objects.requireNonNull(incoming, "incoming");
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(OP_KEY, "import")) {
            Map<String, UserDictWord> validated = new LinkedHashMap<>();
            for (Map.Entry<String, UserDictWord> e : incoming.entrySet()) {
                String id = canonicalImportId(e.getKey());
                UserDictWord word = e.getValue();
                if (word == null) {
                    throw new WordValidationException("word", "missing record for id " + id);
                }
                WordCodec.validate(word);
                validated.put(id, word);
            }
            merge(validated, override);
        }
    }

    /**
     * Like {@link #importWords(Map, boolean)} for words given as external properties.
     */
    public void importProperties(Map<String, WordProperty> incoming, boolean override) {
        Objects.requireNonNull(incoming, "incoming");
        try (CloseableThreadContext.Instance ctc = CloseableThreadContext.put(OP_KEY, "import")) {
            Map<String, UserDictWord> validated = new LinkedHashMap<>();
            for (Map.Entry<String, WordProperty> e : incoming.entrySet()) {
                String id = canonicalImportId(e.getKey());
                if (e.getValue() == null) {
                    throw new WordValidationException("word", "missing property for id " + id);
                }
                validated.put(id, WordCodec.toRecord(e.getValue()));
            }
            merge(validated, override);
        }
    }

    private void merge(Map<String, UserDictWord> validated, boolean override) {
        int added = store.update(words -> {
            int before = words.size();
            if (override) {
                words.putAll(validated);
            } else {
                validated.forEach(words::putIfAbsent);
            }
            return words.size() - before;
        });
        metrics.incrementMutation("import");
        LOG.info("Imported user dictionary words: incoming={}, new={}, override={}",
                validated.size(), added, override);
        pipeline.recompile();
    }

    private static String existingId(String wordId) {
        return WordIds.canonical(wordId).orElseThrow(() -> new WordNotFoundException(wordId));
    }

    private static String canonicalImportId(String rawId) {
        return WordIds.canonical(rawId)
                .orElseThrow(() -> new WordValidationException("id", "not a UUID: " + rawId));
    }
}
