/**
 * Compilation of the user dictionary into the analyzer's binary format.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.speakdict.service.dictionary.compile.UserDictCompilationPipeline} -
 *       stages the lexicon source, compiles it and swaps the result in under a compilation lock</li>
 *   <li>{@link com.phillippitts.speakdict.service.dictionary.compile.MecabDictIndexCompiler} -
 *       process lifecycle for the external {@code mecab-dict-index} binary (spawn, drain, timeout,
 *       cleanup)</li>
 *   <li>{@link com.phillippitts.speakdict.service.dictionary.compile.ProcessFactory} - abstraction
 *       for creating OS processes (enables hermetic testing)</li>
 *   <li>{@link com.phillippitts.speakdict.service.dictionary.compile.BaseLexiconLoader} - reads the
 *       zstd-compressed base lexicon in file-name order</li>
 *   <li>{@link com.phillippitts.speakdict.service.dictionary.compile.ActiveDictionarySlot} - the
 *       analyzer's single global user dictionary slot</li>
 * </ul>
 *
 * <p>Compilation Flow:
 * <ol>
 *   <li>Load the base lexicon; nothing to do when none is installed</li>
 *   <li>Append one line per stored user word</li>
 *   <li>Write the source to {@code <stem>.dict_csv-<uuid>.tmp}</li>
 *   <li>Compile to {@code <stem>.dict_compiled-<uuid>.tmp}</li>
 *   <li>Detach the active dictionary, rename the new one over the compiled path, attach it</li>
 *   <li>Delete both temporary files</li>
 * </ol>
 *
 * <p>Configuration (application.properties):
 * <pre>
 * speakdict.compiler.binary-path=tools/open_jtalk/bin/mecab-dict-index
 * speakdict.compiler.system-dic-dir=tools/open_jtalk/dic
 * speakdict.compiler.timeout-seconds=60
 * </pre>
 *
 * @see com.phillippitts.speakdict.config.dictionary.CompilerProperties
 * @since 1.0
 */
package com.phillippitts.speakdict.service.dictionary.compile;
