package com.netcracker.core.appstate.property;

import com.netcracker.core.appstate.AppStateException;
import com.netcracker.core.appstate.value.CoercionException;
import com.netcracker.core.appstate.value.Value;
import com.netcracker.core.appstate.value.ValueKind;
import lombok.Getter;
import lombok.Setter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TypedPropertyTest {

    private static final TypedProperty<Sample, Integer> INT =
            TypedProperty.of("Count", Integer.class, Sample::getCount, Sample::setCount);
    private static final TypedProperty<Sample, Long> LONG =
            TypedProperty.of("Total", Long.class, Sample::getTotal, Sample::setTotal);
    private static final TypedProperty<Sample, Float> FLOAT =
            TypedProperty.of("Ratio", Float.class, Sample::getRatio, Sample::setRatio);
    private static final TypedProperty<Sample, BigDecimal> DECIMAL =
            TypedProperty.of("Price", BigDecimal.class, Sample::getPrice, Sample::setPrice);
    private static final TypedProperty<Sample, Duration> DURATION =
            TypedProperty.of("Timeout", Duration.class, Sample::getTimeout, Sample::setTimeout);

    private Sample sample;

    @BeforeEach
    void setUp() {
        sample = new Sample();
    }

    @Test
    void kindFollowsDeclaredType() {
        assertThat(INT.kind()).contains(PropertyKind.INTEGER);
        assertThat(LONG.kind()).contains(PropertyKind.INTEGER);
        assertThat(FLOAT.kind()).contains(PropertyKind.FLOAT);
        assertThat(DECIMAL.kind()).contains(PropertyKind.DECIMAL_FLOAT);
        assertThat(DURATION.kind()).isEmpty();
        assertThat(PropertyKind.of(int.class)).isEmpty();
    }

    @Test
    void normalizedNameIsLowercase() {
        assertEquals("count", INT.normalizedName());
    }

    @Test
    void integerFieldAcceptsTextAndRejectsOverflow() {
        INT.write(sample, Value.of("12"));
        assertEquals(12, sample.getCount());

        assertThatThrownBy(() -> INT.write(sample, Value.of((long) Integer.MAX_VALUE + 1)))
                .isInstanceOf(CoercionException.class)
                .hasMessageContaining("Count");
        assertEquals(12, sample.getCount());

        LONG.write(sample, Value.of((long) Integer.MAX_VALUE + 1));
        assertEquals((long) Integer.MAX_VALUE + 1, sample.getTotal());
    }

    @Test
    void integerFieldTruncatesFloats() {
        INT.write(sample, Value.of(9.9));
        assertEquals(9, sample.getCount());
    }

    @Test
    void floatFieldReadsThroughItsDecimalForm() {
        FLOAT.write(sample, Value.of(2.1));

        Value read = FLOAT.read(sample);

        assertEquals(ValueKind.FLOAT, read.kind());
        assertEquals("2.1", read.asString());
        assertEquals(2.1f, (float) read.asFloat());
    }

    @Test
    void decimalFieldKeepsTextualDigitsAndReadsAsFloat() {
        DECIMAL.write(sample, Value.of("0.1000000000000000055511151231257827"));
        assertEquals(new BigDecimal("0.1000000000000000055511151231257827"), sample.getPrice());

        DECIMAL.write(sample, Value.of(3L));
        assertEquals(BigDecimal.valueOf(3L), sample.getPrice());

        DECIMAL.write(sample, Value.of(4.5));
        assertEquals(ValueKind.FLOAT, DECIMAL.read(sample).kind());
        assertEquals(4.5, DECIMAL.read(sample).asFloat());
    }

    @Test
    void decimalFieldRejectsNonFiniteValues() {
        assertThatThrownBy(() -> DECIMAL.write(sample, Value.of(Double.NaN))).isInstanceOf(CoercionException.class);
        assertThatThrownBy(() -> DECIMAL.write(sample, Value.of("Infinity"))).isInstanceOf(CoercionException.class);
    }

    @Test
    void decimalFieldRejectsLiteralsBeyondDoubleRange() {
        assertThatThrownBy(() -> DECIMAL.write(sample, Value.of("1e400")))
                .isInstanceOf(CoercionException.class)
                .hasMessageContaining("Price");
        assertEquals(BigDecimal.ONE, sample.getPrice());

        DECIMAL.write(sample, Value.of("1e300"));
        DECIMAL.write(sample, DECIMAL.read(sample));
        assertEquals(1e300, DECIMAL.read(sample).asFloat());
    }

    @Test
    void readingNullFieldFails() {
        sample.setPrice(null);

        assertThatThrownBy(() -> DECIMAL.read(sample))
                .isInstanceOf(AppStateException.class)
                .hasMessageContaining("Price");
    }

    @Test
    void unsupportedTypeFailsOnReadAndWrite() {
        assertThatThrownBy(() -> DURATION.read(sample))
                .isInstanceOf(UnsupportedCoercionException.class)
                .hasMessageContaining("Timeout")
                .hasMessageContaining("java.time.Duration");
        assertThatThrownBy(() -> DURATION.write(sample, Value.of("PT1S")))
                .isInstanceOf(UnsupportedCoercionException.class);
    }

    @Getter
    @Setter
    static class Sample {
        private int count;
        private long total;
        private float ratio;
        private BigDecimal price = BigDecimal.ONE;
        private Duration timeout = Duration.ofSeconds(1);
    }
}
