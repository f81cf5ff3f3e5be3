package com.phillippitts.modeestimator.exception;

/**
 * Thrown when an input sequence exceeds the configured maximum length
 * (security guard against memory exhaustion on the HTTP surface).
 */
public class SequenceTooLargeException extends ModeEstimatorException {

    private final int size;
    private final int maxSize;

    public SequenceTooLargeException(int size, int maxSize) {
        super("Sequence too large: " + size + " values. Max: " + maxSize);
        this.size = size;
        this.maxSize = maxSize;
    }

    public int getSize() {
        return size;
    }

    public int getMaxSize() {
        return maxSize;
    }
}
