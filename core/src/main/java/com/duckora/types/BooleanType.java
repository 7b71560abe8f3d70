package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a boolean. Materialised as an Arrow bit vector.
 */
public final class BooleanType implements DataType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {}

    public static BooleanType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public ArrowType toArrowType() {
        return ArrowType.Bool.INSTANCE;
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BooleanType;
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
