package com.duckora.types;

import org.apache.arrow.vector.types.IntervalUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing an interval of months, days and microseconds.
 */
public final class IntervalType implements DataType {

    private static final IntervalType INSTANCE = new IntervalType();

    private IntervalType() {}

    public static IntervalType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "interval";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Interval(IntervalUnit.MONTH_DAY_NANO);
    }

    @Override
    public int defaultSize() {
        return 16;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof IntervalType;
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
