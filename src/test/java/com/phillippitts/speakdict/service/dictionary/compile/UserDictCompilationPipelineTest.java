package com.phillippitts.speakdict.service.dictionary.compile;

import com.phillippitts.speakdict.config.dictionary.DictionaryProperties;
import com.phillippitts.speakdict.exception.CorruptStoreException;
import com.phillippitts.speakdict.exception.DictionaryCompilationException;
import com.phillippitts.speakdict.service.dictionary.event.DictionaryCompilationFailedEvent;
import com.phillippitts.speakdict.service.dictionary.event.DictionaryCompiledEvent;
import com.phillippitts.speakdict.service.dictionary.store.JsonUserDictStore;
import com.phillippitts.speakdict.service.dictionary.store.UserDictStore;
import com.phillippitts.speakdict.service.dictionary.word.WordCodec;
import com.phillippitts.speakdict.service.dictionary.word.WordProperty;
import com.phillippitts.speakdict.service.metrics.DictionaryMetrics;
import com.phillippitts.speakdict.testutil.EventCapturingPublisher;
import com.phillippitts.speakdict.testutil.RecordingAnalyzerBinding;
import com.phillippitts.speakdict.testutil.RecordingDictionaryCompiler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static com.phillippitts.speakdict.service.dictionary.compile.BaseLexiconLoaderTest.writeZstd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserDictCompilationPipelineTest {

    private static final String WORD_ID = "5f0e8a1c-3b2d-4e6f-8a9b-0c1d2e3f4a5b";
    private static final String BASE_LINE = "東京,1348,1348,3000,名詞,固有名詞,地域,一般,*,*,東京,トウキョウ,トーキョー,0/4,C1";

    @TempDir
    Path tmp;

    private Path lexiconDir;
    private Path compiledDir;
    private Path compiledPath;
    private UserDictStore store;
    private RecordingDictionaryCompiler compiler;
    private RecordingAnalyzerBinding binding;
    private AtomicActiveDictionarySlot slot;
    private EventCapturingPublisher publisher;
    private MeterRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        lexiconDir = Files.createDirectories(tmp.resolve("dictionaries"));
        compiledDir = Files.createDirectories(tmp.resolve("compiled"));
        compiledPath = compiledDir.resolve("user.dic");
        store = new JsonUserDictStore(new DictionaryProperties(
                lexiconDir.toString(), "*.csv.zst", tmp.resolve("store/user_dict.json").toString(),
                compiledPath.toString(), false, false));
        compiler = new RecordingDictionaryCompiler();
        binding = new RecordingAnalyzerBinding();
        slot = new AtomicActiveDictionarySlot(binding);
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
    }

    private UserDictCompilationPipeline pipeline(boolean testHarness, String osName) {
        return new UserDictCompilationPipeline(store,
                new BaseLexiconLoader(lexiconDir, "*.csv.zst", testHarness),
                compiler, slot, compiledPath, testHarness, osName, publisher, new DictionaryMetrics(registry));
    }

    private UserDictCompilationPipeline pipeline() {
        return pipeline(false, "Linux");
    }

    @Test
    void compilesBaseLexiconFollowedByUserWords() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        store.writeAll(Map.of(WORD_ID, WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1))));

        CompilationResult result = pipeline().recompile();

        assertThat(result).isEqualTo(CompilationResult.COMPILED);
        assertThat(compiler.lastSource()).isEqualTo(BASE_LINE + "\n"
                + "テスト,1348,1348,8609,名詞,固有名詞,一般,*,*,*,*,テスト,テスト,1/3,*\n");
        assertThat(Files.readString(compiledPath, StandardCharsets.UTF_8)).startsWith("compiled\n");
        assertThat(slot.current()).contains(compiledPath.toAbsolutePath().normalize());
    }

    @Test
    void swapDetachesBeforeAttaching() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);

        pipeline().recompile();

        assertThat(binding.calls()).containsExactly("unload", "load:" + compiledPath.toAbsolutePath().normalize());
    }

    @Test
    void stagesUnderUniqueTemporaryNamesAndCleansUp() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        UserDictCompilationPipeline pipeline = pipeline();

        pipeline.recompile();
        pipeline.recompile();

        assertThat(compiler.sourcePaths()).hasSize(2);
        for (Path source : compiler.sourcePaths()) {
            assertThat(source.getParent()).isEqualTo(compiledDir.toAbsolutePath().normalize());
            assertThat(source.getFileName().toString()).matches("user\\.dict_csv-[0-9a-f-]{36}\\.tmp");
        }
        assertThat(compiler.sourcePaths().get(0)).isNotEqualTo(compiler.sourcePaths().get(1));
        assertThat(listDir(compiledDir)).containsExactly("user.dic");
    }

    @Test
    void publishesEventAndRecordsMetricsOnSuccess() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        store.writeAll(Map.of(WORD_ID, WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1))));
        UserDictCompilationPipeline pipeline = pipeline();

        pipeline.recompile();

        List<DictionaryCompiledEvent> events = publisher.eventsOfType(DictionaryCompiledEvent.class);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).wordCount()).isEqualTo(1);
        assertThat(events.get(0).compiledPath()).isEqualTo(compiledPath.toAbsolutePath().normalize());
        assertThat(registry.find("speakdict.compile.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("speakdict.compile.latency").timer().count()).isEqualTo(1);
        assertThat(pipeline.lastSuccessAt()).isPresent();
        assertThat(pipeline.lastFailure()).isEmpty();
        assertThat(pipeline.state()).isEqualTo(CompilationState.IDLE);
    }

    @Test
    void compilerFailureKeepsPreviouslyActiveDictionary() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        UserDictCompilationPipeline pipeline = pipeline();
        pipeline.recompile();
        String before = Files.readString(compiledPath, StandardCharsets.UTF_8);
        store.writeAll(Map.of(WORD_ID, WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1))));
        compiler.setMode(RecordingDictionaryCompiler.Mode.FAIL);

        assertThatThrownBy(pipeline::recompile)
                .isInstanceOf(DictionaryCompilationException.class)
                .hasMessageContaining("Non-zero exit");

        assertThat(Files.readString(compiledPath, StandardCharsets.UTF_8)).isEqualTo(before);
        assertThat(slot.current()).contains(compiledPath.toAbsolutePath().normalize());
        assertThat(listDir(compiledDir)).containsExactly("user.dic");
        assertThat(pipeline.lastFailure()).isPresent();
        assertThat(pipeline.state()).isEqualTo(CompilationState.IDLE);

        List<DictionaryCompilationFailedEvent> failures =
                publisher.eventsOfType(DictionaryCompilationFailedEvent.class);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).reason()).isEqualTo("compiler");
        assertThat(failures.get(0).context()).containsEntry("exitCode", "1");
        assertThat(registry.find("speakdict.compile.failure").tag("reason", "compiler").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void failedRenameReattachesPreviouslyActiveDictionary() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        AtomicBoolean emitDirectory = new AtomicBoolean();
        // a non-empty directory cannot be renamed over the compiled file
        DictionaryCompiler directoryEmitting = (src, out) -> {
            if (!emitDirectory.get()) {
                compiler.compile(src, out);
                return;
            }
            try {
                Files.createDirectories(out.resolve("blocker"));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
        UserDictCompilationPipeline pipeline = new UserDictCompilationPipeline(store,
                new BaseLexiconLoader(lexiconDir, "*.csv.zst", false), directoryEmitting, slot, compiledPath,
                false, "Linux", publisher, new DictionaryMetrics(registry));
        pipeline.recompile();
        String before = Files.readString(compiledPath, StandardCharsets.UTF_8);
        Path active = compiledPath.toAbsolutePath().normalize();
        emitDirectory.set(true);

        assertThatThrownBy(pipeline::recompile)
                .isInstanceOf(DictionaryCompilationException.class)
                .hasMessageContaining("I/O failure");

        assertThat(Files.readString(compiledPath, StandardCharsets.UTF_8)).isEqualTo(before);
        assertThat(slot.current()).contains(active);
        assertThat(binding.calls()).containsExactly("unload", "load:" + active, "unload", "load:" + active);
        assertThat(publisher.eventsOfType(DictionaryCompilationFailedEvent.class))
                .extracting(DictionaryCompilationFailedEvent::reason)
                .containsExactly("io");
        assertThat(pipeline.state()).isEqualTo(CompilationState.IDLE);
    }

    @Test
    void successAfterFailureClearsLastFailure() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        UserDictCompilationPipeline pipeline = pipeline();
        compiler.setMode(RecordingDictionaryCompiler.Mode.FAIL);
        assertThatThrownBy(pipeline::recompile).isInstanceOf(DictionaryCompilationException.class);

        compiler.setMode(RecordingDictionaryCompiler.Mode.COPY);
        pipeline.recompile();

        assertThat(pipeline.lastFailure()).isEmpty();
    }

    @Test
    void missingCompilerOutputIsACompilationError() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        compiler.setMode(RecordingDictionaryCompiler.Mode.NO_OUTPUT);

        assertThatThrownBy(() -> pipeline().recompile())
                .isInstanceOf(DictionaryCompilationException.class)
                .hasMessageContaining("produced no dictionary");

        assertThat(Files.exists(compiledPath)).isFalse();
        assertThat(slot.current()).isEmpty();
        assertThat(listDir(compiledDir)).isEmpty();
    }

    @Test
    void missingBaseLexiconIsANoOp() throws IOException {
        store.writeAll(Map.of(WORD_ID, WordCodec.toRecord(WordProperty.of("テスト", "テスト", 1))));

        CompilationResult result = pipeline().recompile();

        assertThat(result).isEqualTo(CompilationResult.SKIPPED_NO_BASE_LEXICON);
        assertThat(compiler.compileCount()).isZero();
        assertThat(Files.exists(compiledPath)).isFalse();
        assertThat(binding.calls()).isEmpty();
        assertThat(publisher.eventsOfType(DictionaryCompilationFailedEvent.class)).isEmpty();
    }

    @Test
    void corruptStoreFailsWithoutTouchingArtifact() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        Path storeFile = tmp.resolve("store/user_dict.json");
        Files.createDirectories(storeFile.getParent());
        Files.writeString(storeFile, "[]]", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> pipeline().recompile()).isInstanceOf(CorruptStoreException.class);

        assertThat(compiler.compileCount()).isZero();
        assertThat(publisher.eventsOfType(DictionaryCompilationFailedEvent.class))
                .extracting(DictionaryCompilationFailedEvent::reason)
                .containsExactly("store");
    }

    @Test
    void testHarnessOnWindowsSkipsCompilation() throws IOException {
        Files.writeString(lexiconDir.resolve("01_default.csv"), BASE_LINE, StandardCharsets.UTF_8);

        CompilationResult result = pipeline(true, "Windows 11").recompile();

        assertThat(result).isEqualTo(CompilationResult.SKIPPED_TEST_HARNESS);
        assertThat(compiler.compileCount()).isZero();
    }

    @Test
    void testHarnessElsewhereUsesLightweightLexicon() throws IOException {
        Files.writeString(lexiconDir.resolve("01_default.csv"), BASE_LINE, StandardCharsets.UTF_8);
        writeZstd(lexiconDir.resolve("02_big.csv.zst"), "big,1\n");

        CompilationResult result = pipeline(true, "Linux").recompile();

        assertThat(result).isEqualTo(CompilationResult.COMPILED);
        assertThat(compiler.lastSource()).isEqualTo(BASE_LINE + "\n");
    }

    @Test
    void recompileFromInsideCompilationIsRejected() throws IOException {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        AtomicReference<UserDictCompilationPipeline> self = new AtomicReference<>();
        DictionaryCompiler reentrant = (src, out) -> self.get().recompile();
        UserDictCompilationPipeline pipeline = new UserDictCompilationPipeline(store,
                new BaseLexiconLoader(lexiconDir, "*.csv.zst", false), reentrant, slot, compiledPath,
                false, "Linux", publisher, new DictionaryMetrics(registry));
        self.set(pipeline);

        assertThatThrownBy(pipeline::recompile)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must not be called while compiling");
        assertThat(listDir(compiledDir)).isEmpty();
    }

    @Test
    void concurrentRecompilationsAreSerialized() throws Exception {
        writeZstd(lexiconDir.resolve("01_base.csv.zst"), BASE_LINE);
        UserDictCompilationPipeline pipeline = pipeline();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<CompilationResult>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(pipeline::recompile);
            }
            for (Future<CompilationResult> f : pool.invokeAll(tasks)) {
                assertThat(f.get(10, TimeUnit.SECONDS)).isEqualTo(CompilationResult.COMPILED);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(compiler.compileCount()).isEqualTo(16);
        assertThat(compiler.maxConcurrentCompiles()).isEqualTo(1);
        assertThat(listDir(compiledDir)).containsExactly("user.dic");
    }

    private static List<String> listDir(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }
}
