package com.duckora.types;

import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

import java.util.Objects;

/**
 * One named column of a {@link StructType}.
 */
public record StructField(String name, DataType dataType, boolean nullable) {

    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    /**
     * Creates a nullable field.
     *
     * @param name the field name
     * @param dataType the field data type
     */
    public StructField(String name, DataType dataType) {
        this(name, dataType, true);
    }

    /**
     * Returns the Arrow field for this column.
     *
     * <p>Scan batches always declare their vectors nullable: a remote column
     * reported NOT NULL can still produce nulls through an outer paging wrapper.
     *
     * @return the Arrow field
     */
    public Field toArrowField() {
        return new Field(name, FieldType.nullable(dataType.toArrowType()), null);
    }

    @Override
    public String toString() {
        return name + ": " + dataType + (nullable ? "" : " NOT NULL");
    }
}
