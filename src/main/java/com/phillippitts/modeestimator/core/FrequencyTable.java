package com.phillippitts.modeestimator.core;

import com.phillippitts.modeestimator.exception.ContractViolationException;
import com.phillippitts.modeestimator.exception.IncomparableElementsException;

import java.io.Serializable;
import java.lang.constant.Constable;
import java.lang.constant.ConstantDesc;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Distinct-value counts of a sequence, in order of first appearance.
 *
 * <p>A {@code null} slot is the missing marker: a value exists there but is not known.
 * Missing slots never increase any value's count and are tracked as {@link #missingCount()}.
 * The table always satisfies {@code missingCount() + sum(counts) == length()}.
 *
 * <p>Every "value with maximum count" query breaks ties by first appearance, i.e. the
 * lowest index in {@link #values()} wins.
 *
 * <p>Instances are immutable and built fresh per estimate.
 *
 * @param <T> element type
 */
public final class FrequencyTable<T> {

    /** Supertypes shared by unrelated classes; sharing only these does not make elements comparable. */
    private static final Set<Class<?>> UNINFORMATIVE_SUPERTYPES = Set.of(
            Object.class, Record.class, Enum.class, Serializable.class, Comparable.class,
            Cloneable.class, Constable.class, ConstantDesc.class);

    private final List<T> values;
    private final int[] counts;
    private final int[] firstPositions;
    private final Map<T, Integer> indexByValue;
    private final int missingCount;
    private final int length;

    private FrequencyTable(List<T> values, int[] counts, int[] firstPositions,
                           Map<T, Integer> indexByValue, int missingCount, int length) {
        this.values = Collections.unmodifiableList(values);
        this.counts = counts;
        this.firstPositions = firstPositions;
        this.indexByValue = indexByValue;
        this.missingCount = missingCount;
        this.length = length;
    }

    /**
     * Builds the table in a single scan of the sequence.
     *
     * @param sequence values, with {@code null} marking missing entries
     * @return frequency table of the known values
     * @throws ContractViolationException if the sequence itself is null
     * @throws IncomparableElementsException if known elements have mutually incomparable types
     */
    public static <T> FrequencyTable<T> build(List<? extends T> sequence) {
        if (sequence == null) {
            throw new ContractViolationException("sequence", "must not be null");
        }
        List<T> values = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        List<Integer> firstPositions = new ArrayList<>();
        Map<T, Integer> indexByValue = new HashMap<>();
        ElementTypeGuard typeGuard = new ElementTypeGuard();
        int missing = 0;
        int position = 0;
        for (T value : sequence) {
            if (value == null) {
                missing++;
            } else {
                typeGuard.check(value, position);
                Integer index = indexByValue.get(value);
                if (index == null) {
                    indexByValue.put(value, values.size());
                    values.add(value);
                    counts.add(1);
                    firstPositions.add(position);
                } else {
                    counts.set(index, counts.get(index) + 1);
                }
            }
            position++;
        }
        return new FrequencyTable<>(values, toArray(counts), toArray(firstPositions),
                indexByValue, missing, position);
    }

    /** Distinct known values in order of first appearance ({@code ux}). */
    public List<T> values() {
        return values;
    }

    public int distinctCount() {
        return values.size();
    }

    public int countAt(int index) {
        return counts[index];
    }

    /**
     * Returns the index of the value in {@link #values()}, or -1 if it never appears.
     */
    public int indexOf(T value) {
        Integer index = indexByValue.get(value);
        return index == null ? -1 : index;
    }

    /**
     * Returns the number of positions equal to the value, or 0 if it never appears.
     */
    public int countOf(T value) {
        Integer index = indexByValue.get(value);
        return index == null ? 0 : counts[index];
    }

    /**
     * Returns the earliest position of the value in the sequence, or -1 if it never appears.
     */
    public int firstPositionOf(T value) {
        Integer index = indexByValue.get(value);
        return index == null ? -1 : firstPositions[index];
    }

    public int missingCount() {
        return missingCount;
    }

    /** Length of the scanned sequence, missing slots included. */
    public int length() {
        return length;
    }

    public boolean hasMissing() {
        return missingCount > 0;
    }

    /** True when the sequence holds no known value (empty or all missing). */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Index of the first value with the maximum count, or -1 for an empty table.
     */
    public int indexOfMax() {
        return indexOfMaxExcluding(-1);
    }

    /**
     * Index of the first value with the maximum count, skipping one index.
     *
     * @param excluded index to skip, or -1 to skip nothing
     * @return index of the best remaining value, or -1 if none remains
     */
    public int indexOfMaxExcluding(int excluded) {
        int best = -1;
        for (int i = 0; i < counts.length; i++) {
            if (i != excluded && (best < 0 || counts[i] > counts[best])) {
                best = i;
            }
        }
        return best;
    }

    /** Largest count in the table, 0 for an empty table. */
    public int maxCount() {
        int best = indexOfMax();
        return best < 0 ? 0 : counts[best];
    }

    /**
     * Returns all values achieving the maximum count, in first-appearance order.
     */
    public List<T> modes() {
        int max = maxCount();
        List<T> modes = new ArrayList<>();
        for (int i = 0; i < counts.length; i++) {
            if (counts[i] == max) {
                modes.add(values.get(i));
            }
        }
        return modes;
    }

    /**
     * Tracks the supertypes common to every known element seen so far. Elements are comparable
     * while at least one informative supertype (a class or interface other than
     * {@link #UNINFORMATIVE_SUPERTYPES}) remains shared, e.g. {@code List} for {@code List.of(1)}
     * and an {@code ArrayList}, or the sealed interface of sibling records.
     */
    private static final class ElementTypeGuard {

        private final Set<Class<?>> seenTypes = new HashSet<>();
        private Class<?> firstType;
        private Set<Class<?>> sharedSupertypes;

        void check(Object value, int position) {
            Class<?> type = value instanceof Enum<?> e ? e.getDeclaringClass() : value.getClass();
            if (!seenTypes.add(type)) {
                return;
            }
            Set<Class<?>> supertypes = informativeSupertypes(type);
            if (firstType == null) {
                firstType = type;
                sharedSupertypes = supertypes;
                return;
            }
            sharedSupertypes.retainAll(supertypes);
            if (sharedSupertypes.isEmpty()) {
                throw new IncomparableElementsException(firstType, type, position);
            }
        }

        private static Set<Class<?>> informativeSupertypes(Class<?> type) {
            Set<Class<?>> result = new LinkedHashSet<>();
            Deque<Class<?>> pending = new ArrayDeque<>();
            pending.add(type);
            while (!pending.isEmpty()) {
                Class<?> current = pending.poll();
                if (!result.add(current)) {
                    continue;
                }
                if (current.getSuperclass() != null) {
                    pending.add(current.getSuperclass());
                }
                pending.addAll(List.of(current.getInterfaces()));
            }
            result.removeAll(UNINFORMATIVE_SUPERTYPES);
            return result;
        }
    }

    private static int[] toArray(List<Integer> list) {
        int[] result = new int[list.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = list.get(i);
        }
        return result;
    }
}
