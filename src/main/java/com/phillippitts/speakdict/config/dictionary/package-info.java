/**
 * Configuration for the user dictionary and its compiler.
 *
 * <p>Configuration Records:
 * <ul>
 *   <li>{@link com.phillippitts.speakdict.config.dictionary.DictionaryProperties} - Binds to
 *       {@code speakdict.dictionary.*} (lexicon, store and compiled dictionary locations)</li>
 *   <li>{@link com.phillippitts.speakdict.config.dictionary.CompilerProperties} - Binds to
 *       {@code speakdict.compiler.*} (binary path, system dictionary, timeout)</li>
 * </ul>
 *
 * <p>Both records are immutable, validated with Jakarta Bean Validation and carry defaults
 * through {@code @DefaultValue}.
 *
 * @see org.springframework.boot.context.properties.ConfigurationProperties
 * @since 1.0
 */
package com.phillippitts.speakdict.config.dictionary;
