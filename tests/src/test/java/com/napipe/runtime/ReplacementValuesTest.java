package com.napipe.runtime;

import com.napipe.stage.StrategyKind;
import com.napipe.test.TestBase;
import com.napipe.test.TestCategories;
import com.napipe.types.DoubleType;
import com.napipe.types.IntegerType;
import com.napipe.types.LongType;
import com.napipe.types.StringType;
import com.napipe.types.TimeSpanType;
import com.napipe.types.TimestampType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ReplacementValues Tests")
public class ReplacementValuesTest extends TestBase {

    private final List<Object> doubles = Arrays.asList(1.0, null, 4.0, Double.NaN, 7.0);

    @Test
    @DisplayName("Mean, minimum and maximum ignore missing values")
    void testStatisticsIgnoreMissing() {
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, DoubleType.get(), doubles)).isEqualTo(4.0);
        assertThat(ReplacementValues.compute(StrategyKind.MINIMUM, DoubleType.get(), doubles)).isEqualTo(1.0);
        assertThat(ReplacementValues.compute(StrategyKind.MAXIMUM, DoubleType.get(), doubles)).isEqualTo(7.0);
    }

    @Test
    @DisplayName("Default ignores the data")
    void testDefault() {
        assertThat(ReplacementValues.compute(StrategyKind.DEFAULT, DoubleType.get(), doubles)).isEqualTo(0d);
        assertThat(ReplacementValues.compute(StrategyKind.DEFAULT, StringType.get(), List.of("a"))).isEqualTo("");
    }

    @Test
    @DisplayName("Integer means are rounded to the item type")
    void testIntegerMean() {
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, IntegerType.get(), Arrays.asList(1, 2, null)))
            .isEqualTo(2);
    }

    @Test
    @DisplayName("Temporal means")
    void testTemporalMean() {
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, TimeSpanType.get(),
            Arrays.asList(Duration.ofSeconds(1), Duration.ofSeconds(3), null)))
            .isEqualTo(Duration.ofSeconds(2));
        assertThat(ReplacementValues.compute(StrategyKind.MAXIMUM, TimestampType.get(),
            Arrays.asList(Instant.ofEpochSecond(5), null, Instant.ofEpochSecond(9))))
            .isEqualTo(Instant.ofEpochSecond(9));
    }

    @Test
    @DisplayName("Long means stay exact beyond double precision")
    void testLongMeanExact() {
        long large = 9_007_199_254_740_993L;

        assertThat(ReplacementValues.compute(StrategyKind.MEAN, LongType.get(), Arrays.asList(large, large, null)))
            .isEqualTo(large);
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, LongType.get(),
            Arrays.asList(Long.MAX_VALUE, Long.MAX_VALUE - 2)))
            .isEqualTo(Long.MAX_VALUE - 1);
    }

    @Test
    @DisplayName("Integer means round half up")
    void testIntegerMeanRounding() {
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, IntegerType.get(), Arrays.asList(-1, -2)))
            .isEqualTo(-2);
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, IntegerType.get(), Arrays.asList(1, 2, 2)))
            .isEqualTo(2);
    }

    @Test
    @DisplayName("Minimum and maximum compare items of the column type")
    void testExtremes() {
        List<Object> longs = Arrays.asList(5L, null, -3L, 12L);
        List<Object> spans = Arrays.asList(Duration.ofMillis(1500), Duration.ofNanos(7), null);

        assertThat(ReplacementValues.compute(StrategyKind.MINIMUM, LongType.get(), longs)).isEqualTo(-3L);
        assertThat(ReplacementValues.compute(StrategyKind.MAXIMUM, LongType.get(), longs)).isEqualTo(12L);
        assertThat(ReplacementValues.compute(StrategyKind.MINIMUM, TimeSpanType.get(), spans))
            .isEqualTo(Duration.ofNanos(7));
    }

    @Test
    @DisplayName("Timestamp means keep nanoseconds")
    void testTimestampMeanNanos() {
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, TimestampType.get(),
            Arrays.asList(Instant.ofEpochSecond(0, 1), null, Instant.ofEpochSecond(0, 3))))
            .isEqualTo(Instant.ofEpochSecond(0, 2));
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, TimeSpanType.get(),
            Arrays.asList(Duration.ofNanos(1), Duration.ofNanos(4))))
            .isEqualTo(Duration.ofNanos(3));
    }

    @Test
    @DisplayName("Timestamp means far from the epoch do not overflow")
    void testTimestampMeanFarFromEpoch() {
        Instant late = Instant.MAX.minusSeconds(10);

        assertThat(ReplacementValues.compute(StrategyKind.MEAN, TimestampType.get(),
            Arrays.asList(late, Instant.MAX)))
            .isEqualTo(Instant.MAX.minusSeconds(5));
    }

    @Test
    @DisplayName("All-missing input falls back to the default value")
    void testAllMissing() {
        assertThat(ReplacementValues.compute(StrategyKind.MEAN, DoubleType.get(), Arrays.asList(null, Double.NaN)))
            .isEqualTo(0d);
        assertThat(ReplacementValues.compute(StrategyKind.MAXIMUM, IntegerType.get(), List.of())).isEqualTo(0);
    }

    @Test
    @DisplayName("Statistics over text are rejected")
    void testTextRejected() {
        assertThatThrownBy(() -> ReplacementValues.compute(StrategyKind.MINIMUM, StringType.get(), List.of("a")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
