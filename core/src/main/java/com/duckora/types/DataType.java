package com.duckora.types;

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Sealed interface for the logical types of the host engine.
 *
 * <p>Every column the bridge exposes, and every constant a pushed-down filter
 * carries, has one of these types. Each type knows the Arrow type its values
 * are materialised as inside a scan batch.
 *
 * <p>Families:
 * <ul>
 *   <li>Integral: ByteType, ShortType, IntegerType, LongType, HugeIntType</li>
 *   <li>Approximate and exact numerics: FloatType, DoubleType, DecimalType</li>
 *   <li>Temporal: DateType, TimestampType, TimestampTZType, IntervalType</li>
 *   <li>Other: BooleanType, StringType, BinaryType</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, ByteType, ShortType, IntegerType, LongType, HugeIntType,
            FloatType, DoubleType, DecimalType, StringType, BinaryType,
            DateType, TimestampType, TimestampTZType, IntervalType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the Arrow type used for this data type in scan batches.
     *
     * @return the Arrow type
     */
    ArrowType toArrowType();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String, Binary).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }

    /**
     * Returns whether values of this type are exact whole numbers.
     *
     * @return true for the integral types
     */
    default boolean isIntegral() {
        return false;
    }
}
