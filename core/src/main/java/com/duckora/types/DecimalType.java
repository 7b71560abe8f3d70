package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

import java.util.Objects;

/**
 * Fixed-point decimal, the engine side of a remote NUMBER(p,s) with a
 * positive scale. Precision is 1 to 38 and scale 0 to precision, the range
 * NUMBER shares with a 128-bit Arrow decimal.
 */
public final class DecimalType implements DataType {

    /** Largest precision the engine (and a 128-bit Arrow decimal) can hold. */
    public static final int MAX_PRECISION = 38;

    private final int precision;
    private final int scale;

    /**
     * @throws IllegalArgumentException outside the bounds above
     */
    public DecimalType(int precision, int scale) {
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Decimal precision out of range [1, 38]: " + precision);
        }
        if (scale < 0 || scale > precision) {
            throw new IllegalArgumentException("Decimal scale out of range [0, " + precision + "]: " + scale);
        }
        this.precision = precision;
        this.scale = scale;
    }

    public int precision() {
        return precision;
    }

    public int scale() {
        return scale;
    }

    @Override
    public String typeName() {
        return "decimal(" + precision + "," + scale + ")";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Decimal(precision, scale, 128);
    }

    @Override
    public int defaultSize() {
        return 16;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DecimalType that && precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, scale);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
