package com.duckora.types;

import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;
import java.util.Objects;

/**
 * Row type of a remote table or query result.
 *
 * <p>A table's StructType mirrors its cached column list; field positions are
 * the stable column indices used by projections and filter column references.
 */
public final class StructType {

    private final List<StructField> fields;

    public StructType(List<StructField> fields) {
        this.fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
    }

    public List<StructField> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    /**
     * @throws IndexOutOfBoundsException if the index is outside the row
     */
    public StructField fieldAt(int index) {
        return fields.get(index);
    }

    /**
     * Returns the position of a field, or -1. Names are compared exactly, so
     * callers upper-case unquoted Oracle names first.
     */
    public int fieldIndex(String name) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public List<String> fieldNames() {
        return fields.stream().map(StructField::name).toList();
    }

    public List<DataType> fieldTypes() {
        return fields.stream().map(StructField::dataType).toList();
    }

    /**
     * Builds the Arrow schema of scan output batches.
     */
    public Schema toArrowSchema() {
        return new Schema(fields.stream().map(StructField::toArrowField).toList());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructType that && fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "StructType(" + fields + ")";
    }
}
