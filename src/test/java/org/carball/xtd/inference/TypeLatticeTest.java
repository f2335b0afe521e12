package org.carball.xtd.inference;

import org.carball.xtd.model.schema.DataType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TypeLatticeTest {

    private static final List<String> SAMPLES = List.of(
            "", "0", "1", "True", "False", "42", "007", "3.14", "-5", "1e10",
            "true", "hello", "1.", "2012-01-01", "a much longer piece of text with spaces");

    @Test
    void shouldClassifyBooleanLiteralsAsBit() {
        assertThat(TypeLattice.classify("", false)).isEqualTo(DataType.BIT);
        assertThat(TypeLattice.classify("0", false)).isEqualTo(DataType.BIT);
        assertThat(TypeLattice.classify("1", false)).isEqualTo(DataType.BIT);
        assertThat(TypeLattice.classify("True", true)).isEqualTo(DataType.BIT);
        assertThat(TypeLattice.classify("False", true)).isEqualTo(DataType.BIT);
    }

    @Test
    void shouldClassifyDigitStringsAsInt() {
        assertThat(TypeLattice.classify("42", false)).isEqualTo(DataType.INT);
        assertThat(TypeLattice.classify("007", true)).isEqualTo(DataType.INT);
        assertThat(TypeLattice.classify("9780131103627", false)).isEqualTo(DataType.INT);
    }

    @Test
    void shouldClassifyDecimalAndExponentLiteralsAsFloat() {
        assertThat(TypeLattice.classify("3.14", false)).isEqualTo(DataType.FLOAT);
        assertThat(TypeLattice.classify(".5", false)).isEqualTo(DataType.FLOAT);
        assertThat(TypeLattice.classify("1e10", false)).isEqualTo(DataType.FLOAT);
        assertThat(TypeLattice.classify("+2.5E-3", false)).isEqualTo(DataType.FLOAT);
        // signed integers are not pure digit strings
        assertThat(TypeLattice.classify("-5", false)).isEqualTo(DataType.FLOAT);
    }

    @Test
    void shouldClassifyOtherTextByContext() {
        assertThat(TypeLattice.classify("hello", false)).isEqualTo(DataType.NVARCHAR);
        assertThat(TypeLattice.classify("hello", true)).isEqualTo(DataType.NTEXT);
        assertThat(TypeLattice.classify("true", false)).isEqualTo(DataType.NVARCHAR);
        assertThat(TypeLattice.classify("1.", false)).isEqualTo(DataType.NVARCHAR);
    }

    @Test
    void shouldStartFromClassificationWhenNothingObserved() {
        assertThat(TypeLattice.merge(null, "12", false)).isEqualTo(DataType.INT);
        assertThat(TypeLattice.merge(null, "text", true)).isEqualTo(DataType.NTEXT);
    }

    @Test
    void shouldWidenButNeverNarrow() {
        assertThat(TypeLattice.merge(DataType.BIT, "2", false)).isEqualTo(DataType.INT);
        assertThat(TypeLattice.merge(DataType.INT, "1", false)).isEqualTo(DataType.INT);
        assertThat(TypeLattice.merge(DataType.INT, "2.5", false)).isEqualTo(DataType.FLOAT);
        assertThat(TypeLattice.merge(DataType.FLOAT, "7", false)).isEqualTo(DataType.FLOAT);
        assertThat(TypeLattice.merge(DataType.NVARCHAR, "0", false)).isEqualTo(DataType.NVARCHAR);
        assertThat(TypeLattice.merge(DataType.NTEXT, "", true)).isEqualTo(DataType.NTEXT);
    }

    @Test
    void shouldBeMonotonicForEveryTypeAndSample() {
        for (DataType previous : DataType.values()) {
            for (String sample : SAMPLES) {
                DataType asValue = TypeLattice.merge(previous, sample, true);
                assertThat(previous.isWiderThan(asValue))
                        .as("merge(%s, '%s') = %s", previous, sample, asValue)
                        .isFalse();
            }
        }
    }

    @Test
    void shouldNeverReachNtextFromAttributes() {
        DataType type = null;
        for (String sample : SAMPLES) {
            type = TypeLattice.merge(type, sample, false);
            assertThat(type).isNotEqualTo(DataType.NTEXT);
        }
        assertThat(type).isEqualTo(DataType.NVARCHAR);
        assertThat(TypeLattice.merge(DataType.NVARCHAR, "x".repeat(10_000), false))
                .isEqualTo(DataType.NVARCHAR);
    }

    @Test
    void shouldAcceptNarrowerOrEqualTypesAsStorable() {
        assertThat(TypeLattice.isStorable(DataType.INT, DataType.BIT)).isTrue();
        assertThat(TypeLattice.isStorable(DataType.INT, DataType.INT)).isTrue();
        assertThat(TypeLattice.isStorable(DataType.NVARCHAR, DataType.FLOAT)).isTrue();
        assertThat(TypeLattice.isStorable(DataType.BIT, DataType.INT)).isFalse();
        assertThat(TypeLattice.isStorable(DataType.FLOAT, DataType.NVARCHAR)).isFalse();
        assertThat(TypeLattice.isStorable(DataType.NVARCHAR, DataType.NTEXT)).isFalse();
    }

    @Test
    void shouldStoreAnythingInNtext() {
        for (DataType candidate : DataType.values()) {
            assertThat(TypeLattice.isStorable(DataType.NTEXT, candidate)).isTrue();
        }
    }
}
