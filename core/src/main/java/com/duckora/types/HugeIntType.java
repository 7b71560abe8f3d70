package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a 128-bit signed integer.
 *
 * <p>Arrow has no 128-bit integer, so values travel as DECIMAL(38,0).
 */
public final class HugeIntType implements DataType {

    private static final HugeIntType INSTANCE = new HugeIntType();

    private HugeIntType() {}

    public static HugeIntType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "hugeint";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Decimal(38, 0, 128);
    }

    @Override
    public int defaultSize() {
        return 16;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof HugeIntType;
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
