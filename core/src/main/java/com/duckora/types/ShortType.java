package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a 16-bit signed integer.
 *
 * <p>Remote NUMBER columns with scale 0 and precision 1-4 land here.
 */
public final class ShortType implements DataType {

    private static final ShortType INSTANCE = new ShortType();

    private ShortType() {}

    public static ShortType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "smallint";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Int(16, true);
    }

    @Override
    public int defaultSize() {
        return 2;
    }

    @Override
    public boolean isIntegral() {
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ShortType;
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
