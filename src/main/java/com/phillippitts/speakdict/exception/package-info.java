/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speakdict.exception.SpeakDictException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.speakdict.exception.WordValidationException} - Thrown when a
 *       word property or record violates the part-of-speech table or pronunciation rules</li>
 *   <li>{@link com.phillippitts.speakdict.exception.WordNotFoundException} - Thrown when an
 *       operation references an unknown word id</li>
 *   <li>{@link com.phillippitts.speakdict.exception.CorruptStoreException} - Thrown when the
 *       user dictionary file cannot be parsed</li>
 *   <li>{@link com.phillippitts.speakdict.exception.DictionaryCompilationException} - Thrown
 *       when the compiled dictionary cannot be regenerated</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining. Nothing in this code base
 * retries automatically; callers decide.
 *
 * @since 1.0
 */
package com.phillippitts.speakdict.exception;
