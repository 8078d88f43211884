package com.phillippitts.speakdict.service.dictionary.compile;

/**
 * Phase of the compilation pipeline.
 *
 * <pre>
 * IDLE → STAGING_SOURCE → COMPILING → SWAPPING → IDLE
 *   any phase → FAILED → IDLE
 * </pre>
 */
public enum CompilationState {
    IDLE,
    STAGING_SOURCE,
    COMPILING,
    SWAPPING,
    FAILED
}
