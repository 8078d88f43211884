/**
 * Persistence of user dictionary words.
 */
package com.phillippitts.speakdict.service.dictionary.store;
