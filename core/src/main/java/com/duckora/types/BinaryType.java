package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing variable-length binary data.
 */
public final class BinaryType implements DataType {

    private static final BinaryType INSTANCE = new BinaryType();

    private BinaryType() {}

    public static BinaryType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "blob";
    }

    @Override
    public ArrowType toArrowType() {
        return ArrowType.Binary.INSTANCE;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BinaryType;
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
