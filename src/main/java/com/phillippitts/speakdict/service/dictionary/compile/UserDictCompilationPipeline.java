package com.phillippitts.speakdict.service.dictionary.compile;

import com.phillippitts.speakdict.config.dictionary.DictionaryProperties;
import com.phillippitts.speakdict.exception.CorruptStoreException;
import com.phillippitts.speakdict.exception.DictionaryCompilationException;
import com.phillippitts.speakdict.service.dictionary.event.DictionaryCompilationFailedEvent;
import com.phillippitts.speakdict.service.dictionary.event.DictionaryCompiledEvent;
import com.phillippitts.speakdict.service.dictionary.store.UserDictStore;
import com.phillippitts.speakdict.service.dictionary.word.UserDictWord;
import com.phillippitts.speakdict.service.metrics.DictionaryMetrics;
import com.phillippitts.speakdict.util.AtomicFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Regenerates the compiled user dictionary from the base lexicon plus the stored user words
 * and swaps it into the analyzer.
 *
 * <p>Recompilations are serialized by a compilation lock. The store lock is taken briefly
 * inside it to snapshot the words (compile → store); callers must never hold the store lock
 * while calling {@link #recompile()}.
 *
 * <p>The new dictionary is built next to the compiled path under unique temporary names and
 * renamed over it, so a failed compilation leaves the previous dictionary untouched. If the
 * swap itself fails after the analyzer was detached, the previously active dictionary is
 * re-attached when its file is still in place. Both temporary files are removed on every
 * exit path.
 */
@Component
public class UserDictCompilationPipeline {

    private static final Logger LOG = LogManager.getLogger(UserDictCompilationPipeline.class);

    static final String CSV_TMP_INFIX = ".dict_csv-";
    static final String COMPILED_TMP_INFIX = ".dict_compiled-";
    static final String TMP_SUFFIX = ".tmp";

    private final UserDictStore store;
    private final BaseLexiconLoader lexiconLoader;
    private final DictionaryCompiler compiler;
    private final ActiveDictionarySlot slot;
    private final ApplicationEventPublisher publisher;
    private final DictionaryMetrics metrics;
    private final Path compiledPath;
    private final boolean testHarness;
    private final String osName;

    private final ReentrantLock compileLock = new ReentrantLock();
    private volatile CompilationState state = CompilationState.IDLE;
    private volatile Instant lastSuccessAt;
    private volatile String lastFailure;

    @Autowired
    public UserDictCompilationPipeline(UserDictStore store,
                                       BaseLexiconLoader lexiconLoader,
                                       DictionaryCompiler compiler,
                                       ActiveDictionarySlot slot,
                                       DictionaryProperties properties,
                                       ApplicationEventPublisher publisher,
                                       DictionaryMetrics metrics) {
        this(store, lexiconLoader, compiler, slot, Path.of(properties.compiledDictPath()),
                properties.testHarness(), System.getProperty("os.name", ""), publisher, metrics);
    }

    UserDictCompilationPipeline(UserDictStore store,
                                BaseLexiconLoader lexiconLoader,
                                DictionaryCompiler compiler,
                                ActiveDictionarySlot slot,
                                Path compiledPath,
                                boolean testHarness,
                                String osName,
                                ApplicationEventPublisher publisher,
                                DictionaryMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.lexiconLoader = Objects.requireNonNull(lexiconLoader, "lexiconLoader");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.slot = Objects.requireNonNull(slot, "slot");
        this.compiledPath = Objects.requireNonNull(compiledPath, "compiledPath").toAbsolutePath().normalize();
        this.testHarness = testHarness;
        this.osName = osName == null ? "" : osName;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Rebuilds the compiled dictionary and activates it.
     *
     * @return what was done; skips are not errors
     * @throws DictionaryCompilationException if staging, compiling or swapping fails
     * @throws CorruptStoreException if the stored words cannot be read
     * @throws IllegalStateException if called re-entrantly from the compiling thread
     */
    public CompilationResult recompile() {
        if (compileLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("recompile() must not be called while compiling");
        }
        compileLock.lock();
        try {
            return recompileLocked();
        } finally {
            compileLock.unlock();
        }
    }

    private CompilationResult recompileLocked() {
        if (testHarness && osName.startsWith("Windows")) {
            LOG.debug("Skipping user dictionary compilation under test harness on {}", osName);
            return CompilationResult.SKIPPED_TEST_HARNESS;
        }

        long start = System.nanoTime();
        String id = UUID.randomUUID().toString();
        Path csvTmp = AtomicFiles.siblingWithSuffix(compiledPath, CSV_TMP_INFIX + id + TMP_SUFFIX);
        Path compiledTmp = AtomicFiles.siblingWithSuffix(compiledPath, COMPILED_TMP_INFIX + id + TMP_SUFFIX);
        Optional<Path> detached = Optional.empty();
        try {
            state = CompilationState.STAGING_SOURCE;
            Optional<String> baseLexicon = lexiconLoader.load();
            if (baseLexicon.isEmpty()) {
                LOG.warn("No base lexicon found in {}; user dictionary not compiled",
                        lexiconLoader.directory());
                return CompilationResult.SKIPPED_NO_BASE_LEXICON;
            }

            Map<String, UserDictWord> words = new TreeMap<>(store.readAll());
            StringBuilder source = new StringBuilder(baseLexicon.get());
            for (UserDictWord word : words.values()) {
                source.append(LexiconCsvFormatter.format(word)).append('\n');
            }
            Path parent = compiledPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(csvTmp, source, StandardCharsets.UTF_8);

            state = CompilationState.COMPILING;
            compiler.compile(csvTmp, compiledTmp);
            if (!Files.exists(compiledTmp)) {
                throw new DictionaryCompilationException("Compiler produced no dictionary at " + compiledTmp);
            }

            state = CompilationState.SWAPPING;
            detached = slot.current();
            slot.clear();
            AtomicFiles.replace(compiledTmp, compiledPath);
            if (Files.exists(compiledPath)) {
                slot.activate(compiledPath);
            }

            long elapsedNanos = System.nanoTime() - start;
            long durationMs = TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
            lastSuccessAt = Instant.now();
            lastFailure = null;
            metrics.recordCompileLatency(elapsedNanos);
            metrics.incrementCompileSuccess();
            publisher.publishEvent(new DictionaryCompiledEvent(compiledPath, words.size(), durationMs, lastSuccessAt));
            LOG.info("Compiled user dictionary: words={}, durationMs={}, path={}",
                    words.size(), durationMs, compiledPath);
            return CompilationResult.COMPILED;
        } catch (IOException e) {
            DictionaryCompilationException wrapped =
                    new DictionaryCompilationException("I/O failure while compiling user dictionary: " + e.getMessage(), e);
            fail("io", wrapped, start, detached);
            throw wrapped;
        } catch (DictionaryCompilationException e) {
            fail("compiler", e, start, detached);
            throw e;
        } catch (CorruptStoreException e) {
            fail("store", e, start, detached);
            throw e;
        } catch (RuntimeException e) {
            fail("error", e, start, detached);
            throw e;
        } finally {
            AtomicFiles.deleteQuietly(csvTmp);
            AtomicFiles.deleteQuietly(compiledTmp);
            state = CompilationState.IDLE;
        }
    }

    private void fail(String reason, RuntimeException e, long start, Optional<Path> detached) {
        state = CompilationState.FAILED;
        detached.ifPresent(this::reattach);
        lastFailure = e.getMessage();
        metrics.recordCompileLatency(System.nanoTime() - start);
        metrics.incrementCompileFailure(reason);
        LOG.error("Failed to update dictionary (reason={})", reason, e);
        Map<String, String> context = new TreeMap<>();
        context.put("compiledPath", compiledPath.toString());
        if (e instanceof DictionaryCompilationException dce
                && dce.getExitCode() != DictionaryCompilationException.NO_EXIT_CODE) {
            context.put("exitCode", String.valueOf(dce.getExitCode()));
        }
        publisher.publishEvent(new DictionaryCompilationFailedEvent(reason, Instant.now(), e.getMessage(), e, context));
    }

    private void reattach(Path previous) {
        if (slot.current().isPresent()) {
            return;
        }
        if (!Files.isRegularFile(previous)) {
            LOG.warn("Previously active user dictionary {} is gone; analyzer left without one", previous);
            return;
        }
        try {
            slot.activate(previous);
            LOG.info("Re-attached previously active user dictionary {}", previous);
        } catch (RuntimeException e) {
            LOG.error("Failed to re-attach previously active user dictionary {}", previous, e);
        }
    }

    /** Current phase; {@link CompilationState#IDLE} between recompilations. */
    public CompilationState state() {
        return state;
    }

    public Optional<Instant> lastSuccessAt() {
        return Optional.ofNullable(lastSuccessAt);
    }

    /** Message of the most recent failure, cleared by the next successful compilation. */
    public Optional<String> lastFailure() {
        return Optional.ofNullable(lastFailure);
    }

    public Path compiledPath() {
        return compiledPath;
    }
}
