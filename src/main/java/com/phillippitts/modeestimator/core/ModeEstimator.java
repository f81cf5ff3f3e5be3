package com.phillippitts.modeestimator.core;

import com.phillippitts.modeestimator.domain.ModeResult;
import com.phillippitts.modeestimator.exception.ContractViolationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ambiguity-aware statistical mode estimator.
 *
 * <p>Every operation takes a sequence where {@code null} marks a missing entry, i.e. a value
 * that exists but is not known. Instead of silently ignoring missing entries, the estimator
 * commits to an answer only when no resolution of the missing entries could contradict it,
 * and otherwise returns {@link ModeResult#unknown()}.
 *
 * <p><b>Operations:</b>
 * <ul>
 *   <li>{@link #modeFirst(List, boolean, boolean)} - earliest value guaranteed to be a mode</li>
 *   <li>{@link #modeAll(List, boolean)} - complete set of modes</li>
 *   <li>{@link #modeSingle(List, boolean)} - the mode, only when it is unique</li>
 * </ul>
 *
 * <p>Empty and all-missing sequences always yield unknown. A null sequence or mutually
 * incomparable element types raise a {@link ContractViolationException}.
 *
 * <p><b>Thread Safety:</b> stateless; one instance may be shared by any number of threads.
 */
public final class ModeEstimator {

    private static final Logger LOG = LogManager.getLogger(ModeEstimator.class);

    /**
     * Same as {@code modeFirst(sequence, false, true)}.
     */
    public <T> ModeResult<T> modeFirst(List<? extends T> sequence) {
        return modeFirst(sequence, false, true);
    }

    /**
     * Returns the first-appearing value that is guaranteed to be a mode.
     *
     * <p>With {@code firstKnown} the value only needs to be the first value <em>known</em> to be
     * a mode; a value appearing earlier might end up tied with it once missing entries are
     * resolved. Without it, ties that could reorder the first mode make the result unknown.
     *
     * @param sequence values, {@code null} marking missing entries
     * @param removeMissing drop missing entries before estimating
     * @param firstKnown accept the first value known to be a mode
     * @return {@link ModeResult.Known} or {@link ModeResult.Unknown}
     */
    public <T> ModeResult<T> modeFirst(List<? extends T> sequence, boolean removeMissing, boolean firstKnown) {
        List<? extends T> prepared = prepare(sequence, removeMissing);
        FrequencyTable<T> table = FrequencyTable.build(prepared);
        if (table.isEmpty()) {
            return ModeResult.unknown();
        }

        int best = table.indexOfMax();
        T mode1 = table.values().get(best);
        if (!table.hasMissing()) {
            return ModeResult.known(mode1);
        }

        int countMode1 = table.countAt(best);
        int second = table.indexOfMaxExcluding(best);
        int secondMaxKnown = second < 0 ? 0 : table.countAt(second);
        int countMode2NA = secondMaxKnown + table.missingCount();
        if (firstKnown) {
            countMode2NA--;
        }
        if (countMode1 > countMode2NA) {
            return ModeResult.known(mode1);
        }

        // Without a competitor nothing but a missing slot can precede mode1
        boolean mode1AppearsFirst = second < 0
                ? table.firstPositionOf(mode1) == 0
                : table.firstPositionOf(mode1) < table.firstPositionOf(table.values().get(second));
        boolean mode1IsHalfOrMore = 2 * countMode1 >= table.length();
        if (mode1IsHalfOrMore && (mode1AppearsFirst || firstKnown)) {
            return ModeResult.known(mode1);
        }

        if (!AmbiguityResolver.decideUnderMissing(table, mode1, true).isDetermined()) {
            LOG.debug("modeFirst undetermined: count={}, competitor+missing={}, length={}",
                    countMode1, secondMaxKnown + table.missingCount(), table.length());
            return ModeResult.unknown();
        }
        if (table.distinctCount() == 1 && mode1IsHalfOrMore) {
            return ModeResult.known(mode1);
        }
        return ModeResult.unknown();
    }

    /**
     * Same as {@code modeAll(sequence, false)}.
     */
    public <T> ModeResult<T> modeAll(List<? extends T> sequence) {
        return modeAll(sequence, false);
    }

    /**
     * Returns every value tied for maximum frequency.
     *
     * <p>A unique mode is kept only if it strictly beats the worst case. Several tied modes are
     * kept only when nothing is missing, since one missing entry could break the tie.
     *
     * @param sequence values, {@code null} marking missing entries
     * @param removeMissing drop missing entries before estimating
     * @return {@link ModeResult.Modes} in first-appearance order, or {@link ModeResult.Unknown}
     */
    public <T> ModeResult<T> modeAll(List<? extends T> sequence, boolean removeMissing) {
        List<? extends T> prepared = prepare(sequence, removeMissing);
        FrequencyTable<T> table = FrequencyTable.build(prepared);
        if (table.isEmpty()) {
            return ModeResult.unknown();
        }

        List<T> modes = table.modes();
        if (modes.size() == 1) {
            ModeResult<T> decided = AmbiguityResolver.decideUnderMissing(table, modes.get(0), false);
            return decided.isDetermined() ? ModeResult.modes(decided.values()) : decided;
        }
        if (table.hasMissing()) {
            LOG.debug("modeAll undetermined: {} tied modes with {} missing", modes.size(), table.missingCount());
            return ModeResult.unknown();
        }
        return ModeResult.modes(modes);
    }

    /**
     * Same as {@code modeSingle(sequence, false)}.
     */
    public <T> ModeResult<T> modeSingle(List<? extends T> sequence) {
        return modeSingle(sequence, false);
    }

    /**
     * Returns the mode only if there is exactly one and missing entries cannot tie it.
     *
     * @param sequence values, {@code null} marking missing entries
     * @param removeMissing drop missing entries before estimating
     * @return {@link ModeResult.Known} or {@link ModeResult.Unknown}
     */
    public <T> ModeResult<T> modeSingle(List<? extends T> sequence, boolean removeMissing) {
        List<? extends T> prepared = prepare(sequence, removeMissing);
        Optional<T> candidate = this.<T>modeAll(prepared, false).single();
        if (candidate.isEmpty()) {
            return ModeResult.unknown();
        }
        return AmbiguityResolver.decideUnderMissing(FrequencyTable.<T>build(prepared), candidate.get(), false);
    }

    private static <T> List<? extends T> prepare(List<? extends T> sequence, boolean removeMissing) {
        if (sequence == null) {
            throw new ContractViolationException("sequence", "must not be null");
        }
        if (!removeMissing) {
            return sequence;
        }
        List<T> known = new ArrayList<>(sequence.size());
        for (T value : sequence) {
            if (value != null) {
                known.add(value);
            }
        }
        return known;
    }
}
