package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a 32-bit signed integer.
 */
public final class IntegerType implements DataType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "integer";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Int(32, true);
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntegerType;
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
