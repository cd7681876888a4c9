package com.fintech.scanner.domain;

/**
 * Phase of the minute cycle, keyed off the wall-clock second within the minute.
 */
public enum CyclePhase {

    /** Second 0: clear per-minute state. */
    RESET,

    /** Seconds 1-58: sample prices and recompute scores. */
    ACCUMULATE,

    /** Second 59: rank and publish. */
    FINALIZE;

    public static final int FINALIZE_SECOND = 59;

    /**
     * Maps a second-of-minute (0-59) to its phase.
     *
     * @throws IllegalArgumentException if second is outside 0-59
     */
    public static CyclePhase forSecond(int second) {
        if (second < 0 || second > FINALIZE_SECOND) {
            throw new IllegalArgumentException("Second of minute must be 0-59, got " + second);
        }
        if (second == 0) {
            return RESET;
        }
        return second == FINALIZE_SECOND ? FINALIZE : ACCUMULATE;
    }
}
