package com.duckora.types;

import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a time-zone aware timestamp.
 *
 * <p>Values are normalised to UTC microseconds since Unix epoch.
 */
public final class TimestampTZType implements DataType {

    private static final TimestampTZType INSTANCE = new TimestampTZType();

    private TimestampTZType() {}

    public static TimestampTZType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp with time zone";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Timestamp(TimeUnit.MICROSECOND, "UTC");
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampTZType;
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
