package com.duckora.types;

import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a timestamp without time zone.
 *
 * <p>Stored as microseconds since Unix epoch, read as a naive wall-clock value.
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Timestamp(TimeUnit.MICROSECOND, null);
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
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
