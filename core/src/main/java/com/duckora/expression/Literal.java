package com.duckora.expression;

import com.duckora.types.BooleanType;
import com.duckora.types.DataType;
import com.duckora.types.DateType;
import com.duckora.types.DecimalType;
import com.duckora.types.DoubleType;
import com.duckora.types.FloatType;
import com.duckora.types.IntegerType;
import com.duckora.types.LongType;
import com.duckora.types.StringType;
import com.duckora.types.TimestampType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Expression representing a constant value.
 *
 * <p>The Java value class follows the data type: {@code Boolean},
 * {@code Byte}/{@code Short}/{@code Integer}/{@code Long}/{@code BigInteger}
 * for integral types, {@code Float}, {@code Double}, {@code BigDecimal} for
 * decimals, {@code String}, {@code LocalDate} for dates and
 * {@code LocalDateTime} for timestamps. A null value is the typed NULL.
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    public Literal(Object value, DataType dataType) {
        this.value = value;
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public Object value() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return value == null;
    }

    @Override
    public String toString() {
        return value == null ? "NULL" : value + "::" + dataType;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Literal that
            && Objects.equals(value, that.value)
            && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, dataType);
    }

    public static Literal of(boolean value) {
        return new Literal(value, BooleanType.get());
    }

    public static Literal of(int value) {
        return new Literal(value, IntegerType.get());
    }

    public static Literal of(long value) {
        return new Literal(value, LongType.get());
    }

    public static Literal of(float value) {
        return new Literal(value, FloatType.get());
    }

    public static Literal of(double value) {
        return new Literal(value, DoubleType.get());
    }

    public static Literal of(String value) {
        return new Literal(value, StringType.get());
    }

    /**
     * Creates a decimal literal typed with the value's own precision and scale.
     *
     * @param value the decimal value
     * @return the literal expression
     */
    public static Literal of(BigDecimal value) {
        BigDecimal normalized = value.scale() < 0 ? value.setScale(0) : value;
        int scale = normalized.scale();
        int precision = Math.max(normalized.precision(), scale);
        return new Literal(normalized, new DecimalType(Math.max(precision, 1), scale));
    }

    public static Literal of(LocalDate value) {
        return new Literal(value, DateType.get());
    }

    public static Literal of(LocalDateTime value) {
        return new Literal(value, TimestampType.get());
    }

    /**
     * Creates a typed NULL literal.
     *
     * @param dataType the type of the null
     * @return the literal expression
     */
    public static Literal nullOf(DataType dataType) {
        return new Literal(null, dataType);
    }
}
