package com.duckora.types;

import com.duckora.test.TestBase;
import com.duckora.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for remote value conversion.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("OracleValueReader Tests")
public class OracleValueReaderTest extends TestBase {

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @Test
        @DisplayName("Decimals are rescaled half-up to the column scale")
        void decimalRescale() {
            Object value = OracleValueReader.convertNumber(new BigDecimal("12.345"), new DecimalType(10, 2));
            assertThat(value).isEqualTo(new BigDecimal("12.35"));
        }

        @Test
        @DisplayName("Decimals with fewer digits are padded to the column scale")
        void decimalPadding() {
            Object value = OracleValueReader.convertNumber(new BigDecimal("7"), new DecimalType(8, 2));
            assertThat(value).isEqualTo(new BigDecimal("7.00"));
        }

        @Test
        void integralTargets() {
            assertThat(OracleValueReader.convertNumber(new BigDecimal("32767"), ShortType.get()))
                .isEqualTo((short) 32767);
            assertThat(OracleValueReader.convertNumber(new BigDecimal("123456789"), IntegerType.get()))
                .isEqualTo(123456789);
            assertThat(OracleValueReader.convertNumber(new BigDecimal("9223372036854775807"), LongType.get()))
                .isEqualTo(Long.MAX_VALUE);
        }

        @Test
        @DisplayName("HUGEINT keeps digits beyond the range of long")
        void hugeInt() {
            BigDecimal big = new BigDecimal("12345678901234567890123456789");
            assertThat(OracleValueReader.convertNumber(big, HugeIntType.get())).isEqualTo(big);
        }

        @Test
        @DisplayName("A value too large for the integer target fails instead of wrapping")
        void overflowFails() {
            assertThatThrownBy(() -> OracleValueReader.convertNumber(new BigDecimal("40000"), ShortType.get()))
                .isInstanceOf(ArithmeticException.class);
        }
    }

    @Nested
    @DisplayName("Timestamps")
    class Timestamps {

        @Test
        void epoch() {
            assertThat(OracleValueReader.toEpochMicros(LocalDateTime.of(1970, 1, 1, 0, 0))).isZero();
        }

        @Test
        @DisplayName("Fractional seconds are kept to the microsecond")
        void micros() {
            LocalDateTime value = LocalDateTime.of(1970, 1, 1, 0, 0, 1, 123_456_789);
            assertThat(OracleValueReader.toEpochMicros(value)).isEqualTo(1_123_456L);
        }

        @Test
        void beforeEpoch() {
            assertThat(OracleValueReader.toEpochMicros(LocalDateTime.of(1969, 12, 31, 23, 59, 59)))
                .isEqualTo(-1_000_000L);
        }

        @Test
        @DisplayName("Zoned values subtract their offset from the local wall time")
        void zoned() {
            OffsetDateTime value = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.ofHoursMinutes(5, 30));
            long expected = value.toInstant().getEpochSecond() * 1_000_000L;
            assertThat(OracleValueReader.toEpochMicros(value)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Intervals")
    class Intervals {

        @Test
        void yearToMonth() {
            assertThat(IntervalValue.parse("2-3")).isEqualTo(new IntervalValue(27, 0, 0));
            assertThat(IntervalValue.parse("-1-6")).isEqualTo(new IntervalValue(-18, 0, 0));
        }

        @Test
        void dayToSecond() {
            IntervalValue value = IntervalValue.parse("3 04:05:06.5");
            assertThat(value.months()).isZero();
            assertThat(value.days()).isEqualTo(3);
            assertThat(value.micros()).isEqualTo(((4 * 60 + 5) * 60 + 6) * 1_000_000L + 500_000L);
            assertThat(value.nanos()).isEqualTo(value.micros() * 1000);
        }

        @Test
        @DisplayName("Fractions beyond microseconds are truncated")
        void truncatedFraction() {
            assertThat(IntervalValue.parse("0 00:00:00.123456789").micros()).isEqualTo(123_456L);
        }
    }
}
