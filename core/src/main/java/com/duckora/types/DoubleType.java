package com.duckora.types;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a 64-bit IEEE 754 floating point number.
 *
 * <p>Also the landing type for remote NUMBER columns declared without precision.
 */
public final class DoubleType implements DataType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {}

    public static DoubleType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "double";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DoubleType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
