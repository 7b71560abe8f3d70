package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a 64-bit signed integer.
 */
public final class LongType implements DataType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {}

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "bigint";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Int(64, true);
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LongType;
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
