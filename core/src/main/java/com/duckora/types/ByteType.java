package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing an 8-bit signed integer.
 */
public final class ByteType implements DataType {

    private static final ByteType INSTANCE = new ByteType();

    private ByteType() {}

    public static ByteType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "tinyint";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Int(8, true);
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ByteType;
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
