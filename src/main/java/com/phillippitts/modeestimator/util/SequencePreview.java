package com.phillippitts.modeestimator.util;

import java.util.List;

/** Utility for bounded, log-safe previews of input sequences. */
public final class SequencePreview {

    /** Rendering of a missing entry. */
    public static final String MISSING = "NA";

    private SequencePreview() {}

    /**
     * Render at most max values, missing entries as {@value #MISSING}; returns "" for null.
     * Longer sequences end with "..." and their size, e.g. {@code [1, NA, ...] (size=30)}.
     */
    public static String of(List<?> values, int max) {
        if (values == null) {
            return "";
        }
        int shown = Math.max(0, Math.min(max, values.size()));
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < shown; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Object v = values.get(i);
            sb.append(v == null ? MISSING : v);
        }
        if (shown < values.size()) {
            sb.append(shown > 0 ? ", ..." : "...");
            sb.append("] (size=").append(values.size()).append(')');
        } else {
            sb.append(']');
        }
        return sb.toString();
    }
}
