package com.duckora.types;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a 32-bit IEEE 754 floating point number.
 */
public final class FloatType implements DataType {

    private static final FloatType INSTANCE = new FloatType();

    private FloatType() {}

    public static FloatType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FloatType;
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
