package com.phillippitts.modeestimator.exception;

/**
 * Base exception for all mode estimator application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 *
 * <p>An undetermined mode is never reported through this hierarchy; it is a normal
 * {@link com.phillippitts.modeestimator.domain.ModeResult} value.
 */
public class ModeEstimatorException extends RuntimeException {

    public ModeEstimatorException(String message) {
        super(message);
    }

    public ModeEstimatorException(String message, Throwable cause) {
        super(message, cause);
    }

    public ModeEstimatorException(Throwable cause) {
        super(cause);
    }
}
