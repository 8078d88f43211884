/**
 * User dictionary word model and the pure conversions around it: input properties to
 * records, priority to cost and back, and the legacy save format.
 *
 * <p>Everything here is stateless and thread-safe.
 *
 * @see com.phillippitts.speakdict.service.dictionary.word.WordCodec
 * @since 1.0
 */
package com.phillippitts.speakdict.service.dictionary.word;
