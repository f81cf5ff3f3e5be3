package com.phillippitts.modeestimator.exception;

/**
 * Thrown when a caller breaks the estimator's contract: a missing sequence, missing
 * options, or a flag combination that does not apply to the requested operation.
 * This is a programming error and is never raised for data-level ambiguity.
 */
public class ContractViolationException extends ModeEstimatorException {

    private final String argument;

    public ContractViolationException(String argument, String reason) {
        super("Contract violation on '" + argument + "': " + reason);
        this.argument = argument;
    }

    public ContractViolationException(String argument, String reason, Throwable cause) {
        super("Contract violation on '" + argument + "': " + reason, cause);
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }
}
