package com.phillippitts.speakdict.service.dictionary.compile;

import com.phillippitts.speakdict.config.dictionary.CompilerProperties;
import com.phillippitts.speakdict.exception.DictionaryCompilationException;
import com.phillippitts.speakdict.exception.DictionaryCompilationExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external mecab-dict-index binary to compile a user dictionary.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Build a deterministic command line from {@link CompilerProperties}</li>
 *   <li>Start the process via {@link ProcessFactory}</li>
 *   <li>Drain stdout and stderr concurrently so the child never blocks on a full pipe</li>
 *   <li>Enforce the configured timeout and terminate runaway processes</li>
 *   <li>Report failures as {@link DictionaryCompilationException} with exit code, duration
 *       and a stderr snippet</li>
 * </ul>
 *
 * <p>Each call owns its process; the pipeline serializes calls under its compilation lock.
 */
@Component
public final class MecabDictIndexCompiler implements DictionaryCompiler {

    private static final Logger LOG = LogManager.getLogger(MecabDictIndexCompiler.class);

    private static final String CHARSET = "utf-8";

    private final ProcessFactory processFactory;
    private final CompilerProperties cfg;

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    @Autowired
    public MecabDictIndexCompiler(CompilerProperties cfg) {
        this(new DefaultProcessFactory(), cfg);
    }

    MecabDictIndexCompiler(ProcessFactory processFactory, CompilerProperties cfg) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    /**
     * Compiles {@code sourceCsv} into {@code outputDic}.
     *
     * <p>CLI contract:
     * <pre>
     * ${binary} -d ${systemDicDir} -u ${output} -f utf-8 -t utf-8 ${source}
     * </pre>
     *
     * @throws DictionaryCompilationException on timeout, non-zero exit, or I/O error
     */
    @Override
    public void compile(Path sourceCsv, Path outputDic) {
        Objects.requireNonNull(sourceCsv, "sourceCsv");
        Objects.requireNonNull(outputDic, "outputDic");

        List<String> command = buildCommand(sourceCsv, outputDic);
        long startTime = System.nanoTime();
        ProcessExecution exec = null;
        try {
            exec = startProcessWithGobblers(command, outputDic.toAbsolutePath().getParent());
            waitForProcessCompletion(exec, startTime);
            checkExitCode(exec, startTime);
            LOG.debug("mecab-dict-index finished in {} ms: {}", elapsedMillis(startTime), exec.stdout());
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw compilerError("I/O failure: " + e.getMessage(), -1, exec == null ? null : exec.stderr(),
                    startTime, e);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    List<String> buildCommand(Path sourceCsv, Path outputDic) {
        List<String> cmd = new ArrayList<>();
        cmd.add(resolvePath(cfg.binaryPath()).toString());
        cmd.add("-d");
        cmd.add(resolvePath(cfg.systemDicDir()).toString());
        cmd.add("-u");
        cmd.add(outputDic.toAbsolutePath().toString());
        cmd.add("-f");
        cmd.add(CHARSET);
        cmd.add("-t");
        cmd.add(CHARSET);
        cmd.add(sourceCsv.toAbsolutePath().toString());
        return cmd;
    }

    /**
     * Resolves a configured path against the current working directory so the command works
     * regardless of the child's working directory.
     */
    private static Path resolvePath(String pathString) {
        Path path = Path.of(pathString);
        if (path.isAbsolute()) {
            return path;
        }
        return Path.of(".").toAbsolutePath().normalize().resolve(path).normalize();
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, Path workingDir) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, workingDir);

        // Start gobblers before waiting to avoid deadlock
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "dict-index-out");
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "dict-index-err");

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForProcessCompletion(ProcessExecution exec, long startTime) throws InterruptedException {
        boolean finished = exec.process().waitFor(cfg.timeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw compilerError("Timeout after " + cfg.timeoutSeconds() + "s", -1, exec.stderr(), startTime, null);
        }
        joinQuietly(exec.outGobbler(), CompilerProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), CompilerProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private void checkExitCode(ProcessExecution exec, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw compilerError("Non-zero exit: " + exitCode, exitCode, exec.stderr(), startTime, null);
        }
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name) {
        Thread thread = new Thread(new StreamGobbler(inputStream, sink, name, cfg.maxOutputBytes()), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Appends whole code points of {@code line} to {@code sink} while their UTF-8 encoding
     * fits in {@code budget} bytes.
     *
     * @return UTF-8 bytes appended
     */
    static int appendUtf8Capped(StringBuilder sink, String line, int budget) {
        int used = 0;
        int i = 0;
        while (i < line.length()) {
            int cp = line.codePointAt(i);
            int size = cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            if (used + size > budget) {
                break;
            }
            sink.appendCodePoint(cp);
            used += size;
            i += Character.charCount(cp);
        }
        return used;
    }

    /**
     * Reads lines into a StringBuilder until the UTF-8 byte cap is reached, then keeps
     * draining without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;
        private int capturedBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (capturedBytes >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (sink.length() > 0) {
                            sink.append('\n');
                            capturedBytes++;
                        }
                        capturedBytes += appendUtf8Capped(sink, line, maxBytes - capturedBytes);
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(CompilerProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(CompilerProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Compiler process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying compiler process");
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), CompilerProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), CompilerProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private DictionaryCompilationException compilerError(String msg, int exitCode, StringBuilder stderr,
                                                         long startNano, Throwable cause) {
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = stderr.substring(0,
                        Math.min(CompilerProcessTimeouts.ERROR_SNIPPET_MAX_CHARS, stderr.length()));
            }
        }
        return DictionaryCompilationExceptionBuilder.create(msg)
                .exitCode(exitCode)
                .durationMs(elapsedMillis(startNano))
                .metadata("binaryPath", cfg.binaryPath())
                .metadata("systemDicDir", cfg.systemDicDir())
                .metadata("stderr", stderrSnippet)
                .cause(cause)
                .build();
    }

    private static long elapsedMillis(long startNano) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNano);
    }
}
