package com.phillippitts.modeestimator.domain;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a mode estimate: a single known value, a set of known values, or unknown.
 *
 * <p>{@link Unknown} is a legitimate, expected result. It means the true mode(s) cannot be
 * determined from the observed data because missing entries could change the answer, or
 * because there is no known data at all. Callers are expected to branch on
 * {@link #isDetermined()} rather than treat it as an error.
 *
 * <p>Variants:
 * <ul>
 *   <li>{@link Known} - exactly one value, returned by {@code modeFirst} and {@code modeSingle}</li>
 *   <li>{@link Modes} - one or more values in first-appearance order, returned by {@code modeAll}</li>
 *   <li>{@link Unknown} - undetermined</li>
 * </ul>
 *
 * @param <T> element type
 */
public interface ModeResult<T> {

    /**
     * Returns whether the estimate committed to at least one known value.
     */
    boolean isDetermined();

    /**
     * Returns the determined values in first-appearance order, or an empty list for {@link Unknown}.
     */
    List<T> values();

    /**
     * Returns the value if exactly one value was determined.
     *
     * @return the sole value, or empty when unknown or when several modes were found
     */
    default Optional<T> single() {
        List<T> values = values();
        return values.size() == 1 ? Optional.of(values.get(0)) : Optional.empty();
    }

    static <T> ModeResult<T> known(T value) {
        return new Known<>(value);
    }

    static <T> ModeResult<T> modes(List<? extends T> values) {
        return new Modes<>(List.copyOf(values));
    }

    static <T> ModeResult<T> unknown() {
        return new Unknown<>();
    }

    /**
     * A single value guaranteed to be a mode.
     *
     * @param value the mode (never null)
     */
    record Known<T>(T value) implements ModeResult<T> {
        public Known {
            Objects.requireNonNull(value, "Known mode must not be null");
        }

        @Override
        public boolean isDetermined() {
            return true;
        }

        @Override
        public List<T> values() {
            return List.of(value);
        }
    }

    /**
     * The complete set of values tied for maximum frequency.
     *
     * @param values modes in first-appearance order (never empty)
     */
    record Modes<T>(List<T> values) implements ModeResult<T> {
        public Modes {
            values = List.copyOf(values);
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Modes must contain at least one value");
            }
        }

        @Override
        public boolean isDetermined() {
            return true;
        }
    }

    /**
     * The true mode(s) cannot be determined from the observed data.
     */
    record Unknown<T>() implements ModeResult<T> {
        @Override
        public boolean isDetermined() {
            return false;
        }

        @Override
        public List<T> values() {
            return List.of();
        }
    }
}
