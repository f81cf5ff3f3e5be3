package com.phillippitts.modeestimator.service;

/**
 * Estimate operations exposed by {@link ModeEstimationService}.
 */
public enum ModeOperation {
    /** Earliest value guaranteed to be a mode. */
    FIRST("first"),
    /** Complete set of modes. */
    ALL("all"),
    /** The mode, only when unique. */
    SINGLE("single");

    private final String tag;

    ModeOperation(String tag) {
        this.tag = tag;
    }

    /** Lower-case name used in metrics tags, log lines and responses. */
    public String tag() {
        return tag;
    }
}
