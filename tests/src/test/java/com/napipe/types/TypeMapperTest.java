package com.napipe.types;

import com.napipe.test.TestBase;
import com.napipe.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for raw-kind names and column type descriptors.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("TypeMapper Tests")
public class TypeMapperTest extends TestBase {

    @ParameterizedTest(name = "{0} maps to {1}")
    @CsvSource({
        "BL, BooleanType",
        "i4, IntegerType",
        "R8, DoubleType",
        "TX, StringType",
        "TS, TimeSpanType",
        "DT, TimestampType"
    })
    @DisplayName("Raw-kind names map to scalar types")
    void testScalarRawKinds(String rawKind, String expectedClass) {
        DataType type = TypeMapper.fromRawKind(rawKind);

        assertThat(type.getClass().getSimpleName()).isEqualTo(expectedClass);
        assertThat(TypeMapper.toRawKind(type)).isEqualTo(rawKind.toUpperCase());
    }

    @Test
    @DisplayName("Vector raw-kind names carry the length when known")
    void testVectorRawKinds() {
        assertThat(TypeMapper.toRawKind(new VectorType(FloatType.get(), 3))).isEqualTo("Vec<R4, 3>");
        assertThat(TypeMapper.toRawKind(new VectorType(FloatType.get()))).isEqualTo("Vec<R4>");
        assertThat(TypeMapper.fromRawKind("Vec<R4, 3>")).isEqualTo(new VectorType(FloatType.get(), 3));
        assertThat(TypeMapper.fromRawKind("vec<r8>")).isEqualTo(new VectorType(DoubleType.get()));
    }

    @Test
    @DisplayName("Unknown raw-kind names return null")
    void testUnknownRawKind() {
        assertThat(TypeMapper.fromRawKind("double")).isNull();
        assertThat(TypeMapper.fromRawKind("Vec<XX>")).isNull();
    }

    @Test
    @DisplayName("Descriptors capture shape and round-trip to the data type")
    void testColumnTypeDescriptor() {
        ColumnTypeDescriptor scalar = ColumnTypeDescriptor.of(DoubleType.get());
        ColumnTypeDescriptor fixed = ColumnTypeDescriptor.of(new VectorType(FloatType.get(), 3));
        ColumnTypeDescriptor variable = ColumnTypeDescriptor.of(new VectorType(FloatType.get()));

        assertThat(scalar.isVector()).isFalse();
        assertThat(scalar.hasKnownLength()).isTrue();
        assertThat(fixed.vectorSize()).isEqualTo(3);
        assertThat(fixed.isVariableLengthVector()).isFalse();
        assertThat(variable.isVariableLengthVector()).isTrue();
        assertThat(variable.toDataType()).isEqualTo(new VectorType(FloatType.get()));
        assertThat(scalar.toDataType()).isEqualTo(DoubleType.get());
    }

    @Test
    @DisplayName("Vectors of vectors are rejected")
    void testNestedVectorRejected() {
        assertThatThrownBy(() -> new VectorType(new VectorType(FloatType.get(), 2), 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scalar");
    }
}
