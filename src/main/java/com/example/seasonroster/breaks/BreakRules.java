package com.example.seasonroster.breaks;

import com.example.seasonroster.common.TimeWindow;

/**
 * Centralized break-time heuristics so every pass counts paid hours the same way.
 */
public final class BreakRules {

    private static final int SIX_HOURS = 6 * 60;
    private static final int EIGHT_HOURS = 8 * 60;

    private BreakRules() {
    }

    /**
     * Returns the unpaid break duration owed for the given shift window.
     */
    public static int recommendMinutes(TimeWindow window) {
        long duration = window.minutes();
        if (duration >= EIGHT_HOURS) {
            return 60;
        }
        if (duration >= SIX_HOURS) {
            return 45;
        }
        return 0;
    }

    public static long paidMinutes(TimeWindow window) {
        return Math.max(0, window.minutes() - recommendMinutes(window));
    }

    /**
     * Paid hours of a shift, rounded to two decimals.
     */
    public static double paidHours(TimeWindow window) {
        return Math.round(paidMinutes(window) / 60.0 * 100.0) / 100.0;
    }
}
