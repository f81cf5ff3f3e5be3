package com.phillippitts.modeestimator.exception;

/**
 * Thrown when a sequence mixes element types that cannot be compared by equality,
 * e.g. {@code Integer} and {@code String} values in the same input.
 */
public class IncomparableElementsException extends ContractViolationException {

    private final Class<?> expectedType;
    private final Class<?> actualType;
    private final int position;

    public IncomparableElementsException(Class<?> expectedType, Class<?> actualType, int position) {
        super("sequence", "element at position " + position + " has type " + actualType.getName()
                + ", which is not comparable with " + expectedType.getName());
        this.expectedType = expectedType;
        this.actualType = actualType;
        this.position = position;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }

    public int getPosition() {
        return position;
    }
}
