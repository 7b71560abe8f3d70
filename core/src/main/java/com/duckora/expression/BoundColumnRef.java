package com.duckora.expression;

import com.duckora.types.DataType;

import java.util.Objects;

/**
 * Expression referencing a column of the scanned table by position.
 *
 * <p>The index refers to the table's full column list (not the projection).
 * The name is informational; translation resolves the remote column name
 * through the index.
 */
public final class BoundColumnRef implements Expression {

    private final int columnIndex;
    private final String name;
    private final DataType dataType;
    private final boolean nullable;

    /**
     * Creates a bound column reference.
     *
     * @param columnIndex the position in the table's column list
     * @param name the column name, for display
     * @param dataType the column's engine type
     * @param nullable whether the column can hold nulls
     */
    public BoundColumnRef(int columnIndex, String name, DataType dataType, boolean nullable) {
        this.columnIndex = columnIndex;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    /**
     * Creates a nullable bound column reference.
     */
    public BoundColumnRef(int columnIndex, String name, DataType dataType) {
        this(columnIndex, name, dataType, true);
    }

    public int columnIndex() {
        return columnIndex;
    }

    public String name() {
        return name;
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toString() {
        return "#" + columnIndex + ":" + name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BoundColumnRef)) return false;
        BoundColumnRef that = (BoundColumnRef) obj;
        return columnIndex == that.columnIndex &&
               name.equals(that.name) &&
               dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnIndex, name, dataType);
    }
}
