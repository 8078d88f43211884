package com.phillippitts.speakdict.service.dictionary.compile;

import com.github.luben.zstd.ZstdInputStream;
import com.phillippitts.speakdict.config.dictionary.DictionaryProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the bundled base lexicon: every file in the lexicon directory matching the
 * configured glob, in lexicographic file-name order, fully decompressed.
 *
 * <p>In lightweight mode only {@value #LIGHTWEIGHT_LEXICON} is read; loading the complete
 * lexicon for every recompilation makes test suites far too slow. Like every other lexicon
 * file it is decompressed when it starts with a zstd frame, and read as plain UTF-8 otherwise.
 */
@Component
public class BaseLexiconLoader {

    private static final Logger LOG = LogManager.getLogger(BaseLexiconLoader.class);

    static final String LIGHTWEIGHT_LEXICON = "01_default.csv";
    private static final String ZSTD_EXTENSION = ".zst";
    /** Little-endian frame magic 0xFD2FB528. */
    private static final byte[] ZSTD_MAGIC = {0x28, (byte) 0xB5, 0x2F, (byte) 0xFD};

    private final Path lexiconDir;
    private final String pattern;
    private final boolean lightweight;

    @Autowired
    public BaseLexiconLoader(DictionaryProperties properties) {
        this(Path.of(properties.baseLexiconDir()), properties.baseLexiconPattern(), properties.testHarness());
    }

    BaseLexiconLoader(Path lexiconDir, String pattern, boolean lightweight) {
        this.lexiconDir = Objects.requireNonNull(lexiconDir, "lexiconDir");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.lightweight = lightweight;
    }

    /**
     * Lists the lexicon files that {@link #load()} would read, in read order.
     *
     * @throws IOException if the directory cannot be listed
     */
    public List<Path> discover() throws IOException {
        if (lightweight) {
            Path lexicon = lexiconDir.resolve(LIGHTWEIGHT_LEXICON);
            LOG.info("Using only {} as base lexicon (test harness)", lexicon);
            return Files.isRegularFile(lexicon) ? List.of(lexicon) : List.of();
        }
        if (!Files.isDirectory(lexiconDir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(lexiconDir, pattern)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    /**
     * Concatenates all base lexicon files, each terminated by a newline.
     *
     * @return lexicon source text, or empty when no lexicon file was found
     * @throws IOException if a file cannot be read or decompressed
     */
    public Optional<String> load() throws IOException {
        List<Path> files = discover();
        if (files.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder sb = new StringBuilder();
        for (Path file : files) {
            String content = read(file);
            sb.append(content);
            if (!content.endsWith("\n")) {
                sb.append('\n');
            }
            LOG.debug("Loaded base lexicon {} ({} chars)", file.getFileName(), content.length());
        }
        return Optional.of(sb.toString());
    }

    public Path directory() {
        return lexiconDir;
    }

    private static String read(Path file) throws IOException {
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(file))) {
            raw.mark(ZSTD_MAGIC.length);
            byte[] head = raw.readNBytes(ZSTD_MAGIC.length);
            raw.reset();
            if (!Arrays.equals(head, ZSTD_MAGIC) && !file.getFileName().toString().endsWith(ZSTD_EXTENSION)) {
                return new String(raw.readAllBytes(), StandardCharsets.UTF_8);
            }
            try (InputStream in = new ZstdInputStream(raw)) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
    }
}
