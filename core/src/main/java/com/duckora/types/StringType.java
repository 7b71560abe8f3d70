package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a variable-length string.
 *
 * <p>The fallback type for every remote type the bridge does not recognise.
 */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "varchar";
    }

    @Override
    public ArrowType toArrowType() {
        return ArrowType.Utf8.INSTANCE;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StringType;
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
