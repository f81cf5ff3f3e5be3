package com.phillippitts.modeestimator.core;

import com.phillippitts.modeestimator.domain.ModeResult;
import com.phillippitts.modeestimator.exception.ContractViolationException;

/**
 * Decides whether a leading candidate survives the worst-case resolution of missing values.
 *
 * <p>The worst case assumes every missing entry secretly equals the strongest competitor
 * of the candidate. With {@code allowTie} the candidate only has to match that competitor
 * (it is still <em>a</em> mode); without it the candidate must strictly exceed it.
 *
 * <p>When the table holds a single distinct value there is no competitor to add the
 * missing entries to. The candidate then survives only if missing entries are fewer
 * than half of the sequence.
 */
public final class AmbiguityResolver {

    private AmbiguityResolver() {}

    /**
     * Returns the candidate if missing values cannot overturn it, otherwise unknown.
     *
     * @param table frequency table of the sequence under estimation
     * @param mode1 previously identified leading candidate (must appear in the table)
     * @param allowTie whether matching the worst-case competitor is enough
     * @return {@link ModeResult.Known} holding {@code mode1}, or {@link ModeResult.Unknown}
     * @throws ContractViolationException if the table is null or {@code mode1} is not one of its values
     */
    public static <T> ModeResult<T> decideUnderMissing(FrequencyTable<T> table, T mode1, boolean allowTie) {
        if (table == null) {
            throw new ContractViolationException("table", "must not be null");
        }
        if (table.indexOf(mode1) < 0) {
            throw new ContractViolationException("mode1", "must be a known value of the table");
        }
        if (table.distinctCount() == 1) {
            return 2 * table.missingCount() < table.length()
                    ? ModeResult.known(mode1)
                    : ModeResult.unknown();
        }

        T mode2 = strongestCompetitor(table, mode1);
        int countMode1 = table.countOf(mode1);
        int countMode2NA = table.countOf(mode2) + table.missingCount();

        boolean frequentEnough = allowTie ? countMode1 >= countMode2NA : countMode1 > countMode2NA;
        return frequentEnough ? ModeResult.known(mode1) : ModeResult.unknown();
    }

    /**
     * Value with the maximum count other than {@code mode1}, first appearance breaking ties.
     *
     * @return the competitor, or null if the table has no other value
     */
    static <T> T strongestCompetitor(FrequencyTable<T> table, T mode1) {
        int index = table.indexOfMaxExcluding(table.indexOf(mode1));
        return index < 0 ? null : table.values().get(index);
    }
}
