package com.phillippitts.modeestimator.core;

import com.phillippitts.modeestimator.exception.ContractViolationException;
import com.phillippitts.modeestimator.exception.IncomparableElementsException;
import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrequencyTableTest {

    private enum Suit {
        HEARTS {
            @Override
            public String toString() {
                return "♥";
            }
        },
        SPADES
    }

    private sealed interface Shape permits Circle, Square {}

    private record Circle(int radius) implements Shape {}

    private record Square(int side) implements Shape {}

    private record Apple() {}

    private record Pear() {}

    @Test
    void countsDistinctValuesInFirstAppearanceOrder() {
        FrequencyTable<String> table = FrequencyTable.build(Arrays.asList("b", "a", "b", null, "c", "b"));

        assertThat(table.values()).containsExactly("b", "a", "c");
        assertThat(table.countOf("b")).isEqualTo(3);
        assertThat(table.countOf("a")).isEqualTo(1);
        assertThat(table.countOf("c")).isEqualTo(1);
        assertThat(table.countOf("z")).isZero();
        assertThat(table.missingCount()).isEqualTo(1);
        assertThat(table.length()).isEqualTo(6);
        assertThat(table.hasMissing()).isTrue();
    }

    @Test
    void missingPlusCountsEqualsLength() {
        FrequencyTable<Integer> table = FrequencyTable.build(Arrays.asList(null, 1, 2, null, 2, 2, null));

        int sum = 0;
        for (int i = 0; i < table.distinctCount(); i++) {
            sum += table.countAt(i);
        }
        assertThat(table.missingCount() + sum).isEqualTo(table.length());
    }

    @Test
    void tracksFirstPositionOfEachValue() {
        FrequencyTable<Integer> table = FrequencyTable.build(Arrays.asList(null, 7, 8, 7, null, 9));

        assertThat(table.firstPositionOf(7)).isEqualTo(1);
        assertThat(table.firstPositionOf(8)).isEqualTo(2);
        assertThat(table.firstPositionOf(9)).isEqualTo(5);
        assertThat(table.firstPositionOf(42)).isEqualTo(-1);
        assertThat(table.indexOf(9)).isEqualTo(2);
        assertThat(table.indexOf(42)).isEqualTo(-1);
    }

    @Test
    void maximumBreaksTiesByFirstAppearance() {
        FrequencyTable<String> table = FrequencyTable.build(List.of("y", "x", "x", "y", "z"));

        assertThat(table.indexOfMax()).isZero();
        assertThat(table.maxCount()).isEqualTo(2);
        assertThat(table.indexOfMaxExcluding(0)).isEqualTo(1);
        assertThat(table.modes()).containsExactly("y", "x");
    }

    @Test
    void excludingTheOnlyValueLeavesNoCompetitor() {
        FrequencyTable<Integer> table = FrequencyTable.build(Arrays.asList(5, null, 5));

        assertThat(table.indexOfMaxExcluding(0)).isEqualTo(-1);
    }

    @Test
    void emptyAndAllMissingSequencesHaveNoKnownValues() {
        FrequencyTable<Integer> empty = FrequencyTable.build(List.of());
        FrequencyTable<Integer> allMissing = FrequencyTable.build(Arrays.asList(null, null));

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.indexOfMax()).isEqualTo(-1);
        assertThat(empty.maxCount()).isZero();
        assertThat(empty.modes()).isEmpty();
        assertThat(empty.length()).isZero();

        assertThat(allMissing.isEmpty()).isTrue();
        assertThat(allMissing.missingCount()).isEqualTo(2);
        assertThat(allMissing.modes()).isEmpty();
    }

    @Test
    void rejectsNullSequence() {
        assertThatThrownBy(() -> FrequencyTable.build(null))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("sequence");
    }

    @Test
    void rejectsMixedElementTypes() {
        List<Object> mixed = Arrays.asList(1, null, "1");

        assertThatThrownBy(() -> FrequencyTable.build(mixed))
                .isInstanceOfSatisfying(IncomparableElementsException.class, iee -> {
                    assertThat(iee.getPosition()).isEqualTo(2);
                    assertThat(iee.getExpectedType()).isEqualTo(Integer.class);
                    assertThat(iee.getActualType()).isEqualTo(String.class);
                });
    }

    @Test
    void acceptsSubtypesAndEnumConstantBodies() {
        List<Date> dates = List.of(new Date(0), new Timestamp(1000));
        List<Suit> suits = List.of(Suit.HEARTS, Suit.SPADES, Suit.HEARTS);

        assertThatCode(() -> FrequencyTable.build(dates)).doesNotThrowAnyException();
        assertThat(FrequencyTable.build(suits).countOf(Suit.HEARTS)).isEqualTo(2);
    }

    @Test
    void acceptsSiblingRecordsOfSealedInterface() {
        List<Shape> shapes = List.of(new Circle(1), new Square(2), new Circle(1));

        FrequencyTable<Shape> table = FrequencyTable.build(shapes);

        assertThat(table.values()).containsExactly(new Circle(1), new Square(2));
        assertThat(table.countOf(new Circle(1))).isEqualTo(2);
    }

    @Test
    void acceptsListsBuiltDifferently() {
        List<List<Integer>> lists = Arrays.asList(
                List.of(1), new ArrayList<>(List.of(1)), List.of(1, 2, 3), null);

        FrequencyTable<List<Integer>> table = FrequencyTable.build(lists);

        assertThat(table.countOf(List.of(1))).isEqualTo(2);
        assertThat(table.countOf(List.of(1, 2, 3))).isEqualTo(1);
        assertThat(table.missingCount()).isEqualTo(1);
    }

    @Test
    void acceptsNumbersOfDifferentBoxedTypes() {
        List<Number> numbers = List.of(1, 1L, 1.5);

        FrequencyTable<Number> table = FrequencyTable.build(numbers);

        assertThat(table.distinctCount()).isEqualTo(3);
    }

    @Test
    void rejectsTypesSharingOnlyUniversalSupertypes() {
        List<Record> records = List.of(new Apple(), new Pear());

        assertThatThrownBy(() -> FrequencyTable.build(records))
                .isInstanceOfSatisfying(IncomparableElementsException.class, iee -> {
                    assertThat(iee.getPosition()).isEqualTo(1);
                    assertThat(iee.getExpectedType()).isEqualTo(Apple.class);
                    assertThat(iee.getActualType()).isEqualTo(Pear.class);
                });
    }

    @Test
    void valuesViewIsUnmodifiable() {
        FrequencyTable<Integer> table = FrequencyTable.build(List.of(1, 2));

        assertThatThrownBy(() -> table.values().add(3))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
