package com.phillippitts.modeestimator.core;

import com.phillippitts.modeestimator.domain.ModeResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the estimator against brute force over every sequence of up to six entries drawn
 * from {1, 2, 3, missing}, and every completion of the missing entries with {1, ..., 5}.
 */
class ModeEstimatorInvariantsTest {

    private static final int MAX_LENGTH = 6;
    private static final List<Integer> KNOWN = List.of(1, 2, 3);
    private static final List<Integer> FILL = List.of(1, 2, 3, 4, 5);

    private static final List<List<Integer>> SEQUENCES = new ArrayList<>();

    private final ModeEstimator estimator = new ModeEstimator();

    @BeforeAll
    static void enumerateSequences() {
        List<Integer> alphabet = new ArrayList<>(KNOWN);
        alphabet.add(null);
        for (int n = 0; n <= MAX_LENGTH; n++) {
            enumerate(alphabet, n, new ArrayList<>(), SEQUENCES);
        }
    }

    @Test
    void completeDataAgreesWithNaiveFrequency() {
        for (List<Integer> s : SEQUENCES) {
            if (s.contains(null) || s.isEmpty()) {
                continue;
            }
            List<Integer> naive = naiveModes(s);

            assertThat(estimator.modeFirst(s, false, false).values()).as("modeFirst %s", s)
                    .containsExactly(naive.get(0));
            assertThat(estimator.modeFirst(s, false, true).values()).as("modeFirst %s", s)
                    .containsExactly(naive.get(0));
            assertThat(estimator.modeAll(s).values()).as("modeAll %s", s).isEqualTo(naive);
            if (naive.size() == 1) {
                assertThat(estimator.modeSingle(s).values()).as("modeSingle %s", s).isEqualTo(naive);
            } else {
                assertThat(estimator.modeSingle(s).isDetermined()).as("modeSingle %s", s).isFalse();
            }
        }
    }

    @Test
    void modeFirstIsAModeOfEveryCompletion() {
        for (List<Integer> s : SEQUENCES) {
            for (boolean firstKnown : new boolean[] {true, false}) {
                ModeResult<Integer> result = estimator.modeFirst(s, false, firstKnown);
                if (!result.isDetermined()) {
                    continue;
                }
                Integer v = result.single().orElseThrow();
                for (List<Integer> completion : completions(s)) {
                    assertThat(naiveModes(completion)).as("modeFirst %s -> %s, completion %s", s, v, completion)
                            .contains(v);
                }
            }
        }
    }

    @Test
    void modeAllMatchesModesOfEveryCompletion() {
        for (List<Integer> s : SEQUENCES) {
            ModeResult<Integer> result = estimator.modeAll(s);
            if (!result.isDetermined()) {
                continue;
            }
            for (List<Integer> completion : completions(s)) {
                assertThat(naiveModes(completion)).as("modeAll %s, completion %s", s, completion)
                        .isEqualTo(result.values());
            }
        }
    }

    @Test
    void modeSingleIsTheUniqueModeOfEveryCompletion() {
        for (List<Integer> s : SEQUENCES) {
            ModeResult<Integer> result = estimator.modeSingle(s);
            if (!result.isDetermined()) {
                continue;
            }
            assertThat(result).isInstanceOf(ModeResult.Known.class);
            for (List<Integer> completion : completions(s)) {
                assertThat(naiveModes(completion)).as("modeSingle %s, completion %s", s, completion)
                        .isEqualTo(result.values());
            }
        }
    }

    @Test
    void uniqueModeImpliesAgreementAcrossOperations() {
        for (List<Integer> s : SEQUENCES) {
            ModeResult<Integer> single = estimator.modeSingle(s);
            if (single.isDetermined()) {
                assertThat(estimator.modeAll(s).values()).as("modeAll %s", s).isEqualTo(single.values());
                assertThat(estimator.modeFirst(s)).as("modeFirst %s", s).isEqualTo(single);
            }
        }
    }

    @Test
    void removingMissingMatchesEstimatingTheFilteredSequence() {
        for (List<Integer> s : SEQUENCES) {
            List<Integer> filtered = new ArrayList<>(s);
            filtered.removeIf(v -> v == null);

            assertThat(estimator.modeFirst(s, true, true)).isEqualTo(estimator.modeFirst(filtered));
            assertThat(estimator.modeAll(s, true)).isEqualTo(estimator.modeAll(filtered));
            assertThat(estimator.modeSingle(s, true)).isEqualTo(estimator.modeSingle(filtered));
        }
    }

    @Test
    void noKnownValueMeansUnknown() {
        for (List<Integer> s : SEQUENCES) {
            if (s.stream().allMatch(v -> v == null)) {
                assertThat(estimator.modeFirst(s).isDetermined()).isFalse();
                assertThat(estimator.modeAll(s).isDetermined()).isFalse();
                assertThat(estimator.modeSingle(s).isDetermined()).isFalse();
            }
        }
    }

    private static void enumerate(List<Integer> alphabet, int remaining, List<Integer> prefix,
                                  List<List<Integer>> out) {
        if (remaining == 0) {
            out.add(new ArrayList<>(prefix));
            return;
        }
        for (Integer v : alphabet) {
            prefix.add(v);
            enumerate(alphabet, remaining - 1, prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }

    private static List<List<Integer>> completions(List<Integer> s) {
        List<List<Integer>> out = new ArrayList<>();
        complete(s, 0, new ArrayList<>(), out);
        return out;
    }

    private static void complete(List<Integer> s, int i, List<Integer> prefix, List<List<Integer>> out) {
        if (i == s.size()) {
            out.add(new ArrayList<>(prefix));
            return;
        }
        List<Integer> choices = s.get(i) == null ? FILL : List.of(s.get(i));
        for (Integer v : choices) {
            prefix.add(v);
            complete(s, i + 1, prefix, out);
            prefix.remove(prefix.size() - 1);
        }
    }

    /** Max-frequency values of a complete sequence, in first-appearance order. */
    private static List<Integer> naiveModes(List<Integer> s) {
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (Integer v : s) {
            counts.merge(v, 1, Integer::sum);
        }
        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<Integer> modes = new ArrayList<>();
        counts.forEach((v, c) -> {
            if (c == max) {
                modes.add(v);
            }
        });
        return modes;
    }
}
