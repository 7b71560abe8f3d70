package com.duckora.types;

import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Data type representing a date (year, month, day) without time information.
 *
 * <p>Stored as days since Unix epoch (1970-01-01). The remote DATE type carries
 * a time of day and therefore never maps here; see {@link TimestampType}.
 */
public final class DateType implements DataType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {}

    public static DateType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public ArrowType toArrowType() {
        return new ArrowType.Date(DateUnit.DAY);
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DateType;
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
