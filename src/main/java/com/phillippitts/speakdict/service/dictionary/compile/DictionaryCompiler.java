package com.phillippitts.speakdict.service.dictionary.compile;

import java.nio.file.Path;

/**
 * Compiles a lexicon source file into the binary dictionary format read by the analyzer.
 *
 * <p>Blocking and potentially slow. Implementations must either produce {@code outputDic}
 * or throw.
 */
public interface DictionaryCompiler {

    /**
     * @param sourceCsv UTF-8 lexicon source, one comma-separated entry per line
     * @param outputDic where the compiled dictionary is written
     * @throws com.phillippitts.speakdict.exception.DictionaryCompilationException if the
     *         compiler fails
     */
    void compile(Path sourceCsv, Path outputDic);
}
