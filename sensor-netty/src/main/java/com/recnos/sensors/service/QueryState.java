package com.recnos.sensors.service;

import java.util.Locale;

/**
 * Lifecycle of a single cross-location query. COMPLETE and TIMED_OUT are terminal.
 */
public enum QueryState {
    COLLECTING,
    COMPLETE,
    TIMED_OUT;

    /**
     * Metric label for this state.
     */
    public String outcome() {
        return name().toLowerCase(Locale.ROOT);
    }
}
