package com.duckora.scan;

import com.duckora.connection.OracleConnectionPool;
import com.duckora.types.ColumnInfo;
import com.duckora.types.DataType;
import com.duckora.types.StringType;
import com.duckora.types.StructField;
import com.duckora.types.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Immutable per-query descriptor of a remote table scan.
 *
 * <p>Holds the target table, its full cached column list with engine types,
 * the filter fragments already pushed to the remote, the projected column
 * positions, paging and the remote major version that selects the paging
 * dialect. Every {@code with*} method returns a modified copy; an instance is
 * never shared between scans with different pushdown results.
 *
 * <p>Projection positions index the full column list. {@link #ROW_ID} selects
 * the remote row identifier pseudo-column, returned as text.
 */
public final class ScanBindData {

    /** Projection id of the row identifier pseudo-column. */
    public static final int ROW_ID = -1;

    /** Output name of the row identifier pseudo-column. */
    public static final String ROW_ID_NAME = "ROWID__";

    private final OracleConnectionPool pool;
    private final String schema;
    private final String table;
    private final List<ColumnInfo> columns;
    private final List<DataType> types;
    private final List<String> filters;
    private final List<Integer> projection;
    private final Long limit;
    private final long offset;
    private final int majorVersion;
    private final int fetchSize;

    private ScanBindData(OracleConnectionPool pool, String schema, String table,
                         List<ColumnInfo> columns, List<DataType> types, List<String> filters,
                         List<Integer> projection, Long limit, long offset,
                         int majorVersion, int fetchSize) {
        this.pool = pool;
        this.schema = schema;
        this.table = table;
        this.columns = columns;
        this.types = types;
        this.filters = filters;
        this.projection = projection;
        this.limit = limit;
        this.offset = offset;
        this.majorVersion = majorVersion;
        this.fetchSize = fetchSize;
    }

    /**
     * Creates bind data projecting every column, with no filters or paging.
     *
     * @param pool the pool scans draw sessions from (may be null for SQL generation only)
     * @param schema the remote schema
     * @param table the remote table
     * @param columns the cached column list
     * @param types the engine type of each column
     * @param majorVersion the remote server's major version
     * @param fetchSize the driver row prefetch
     * @return the bind data
     */
    public static ScanBindData of(OracleConnectionPool pool, String schema, String table,
                                  List<ColumnInfo> columns, List<DataType> types,
                                  int majorVersion, int fetchSize) {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(types, "types must not be null");
        if (columns.size() != types.size()) {
            throw new IllegalArgumentException("columns and types differ in size: "
                + columns.size() + " vs " + types.size());
        }
        List<Integer> all = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            all.add(i);
        }
        return new ScanBindData(pool, schema, table,
            List.copyOf(columns), List.copyOf(types), List.of(), List.copyOf(all),
            null, 0L, majorVersion, fetchSize);
    }

    // ==================== Accessors ====================

    public OracleConnectionPool pool() {
        return pool;
    }

    public String schema() {
        return schema;
    }

    public String table() {
        return table;
    }

    public List<ColumnInfo> columns() {
        return columns;
    }

    public List<DataType> types() {
        return types;
    }

    /**
     * Returns the pushed filter fragments, AND-ed together when rendered.
     */
    public List<String> filters() {
        return filters;
    }

    public List<Integer> projection() {
        return projection;
    }

    public OptionalLong limit() {
        return limit == null ? OptionalLong.empty() : OptionalLong.of(limit);
    }

    public long offset() {
        return offset;
    }

    public int majorVersion() {
        return majorVersion;
    }

    public int fetchSize() {
        return fetchSize;
    }

    /**
     * Returns the remote column names in cached order.
     */
    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnInfo column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /**
     * Returns the output column names of the projection.
     */
    public List<String> projectedNames() {
        List<String> names = new ArrayList<>(projection.size());
        for (int id : projection) {
            names.add(id == ROW_ID ? ROW_ID_NAME : columns.get(id).name());
        }
        return names;
    }

    /**
     * Returns the engine types of the projection.
     */
    public List<DataType> projectedTypes() {
        List<DataType> result = new ArrayList<>(projection.size());
        for (int id : projection) {
            result.add(id == ROW_ID ? StringType.get() : types.get(id));
        }
        return result;
    }

    /**
     * Returns the row type of scan output batches.
     */
    public StructType outputSchema() {
        List<String> names = projectedNames();
        List<DataType> projectedTypes = projectedTypes();
        List<StructField> fields = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            int id = projection.get(i);
            boolean nullable = id == ROW_ID ? false : columns.get(id).nullable();
            fields.add(new StructField(names.get(i), projectedTypes.get(i), nullable));
        }
        return new StructType(fields);
    }

    // ==================== Copies ====================

    /**
     * Returns a copy with additional pushed filter fragments.
     *
     * @param fragments remote SQL predicates, each self-contained
     * @return the copy
     */
    public ScanBindData withAddedFilters(List<String> fragments) {
        List<String> merged = new ArrayList<>(filters);
        merged.addAll(fragments);
        return new ScanBindData(pool, schema, table, columns, types,
            Collections.unmodifiableList(merged), projection, limit, offset, majorVersion, fetchSize);
    }

    /**
     * Returns a copy projecting the given column positions.
     *
     * @param columnIds positions in the full column list, or {@link #ROW_ID}
     * @return the copy
     * @throws IndexOutOfBoundsException if a position is outside the column list
     * @throws IllegalArgumentException if the projection is empty
     */
    public ScanBindData withProjection(List<Integer> columnIds) {
        if (columnIds.isEmpty()) {
            throw new IllegalArgumentException("projection must not be empty");
        }
        for (int id : columnIds) {
            if (id != ROW_ID && (id < 0 || id >= columns.size())) {
                throw new IndexOutOfBoundsException("Projected column " + id
                    + " outside table " + schema + "." + table + " with " + columns.size() + " columns");
            }
        }
        return new ScanBindData(pool, schema, table, columns, types, filters,
            List.copyOf(columnIds), limit, offset, majorVersion, fetchSize);
    }

    public ScanBindData withLimit(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative, got: " + limit);
        }
        return new ScanBindData(pool, schema, table, columns, types, filters,
            projection, limit, offset, majorVersion, fetchSize);
    }

    public ScanBindData withoutLimit() {
        return new ScanBindData(pool, schema, table, columns, types, filters,
            projection, null, offset, majorVersion, fetchSize);
    }

    public ScanBindData withOffset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, got: " + offset);
        }
        return new ScanBindData(pool, schema, table, columns, types, filters,
            projection, limit, offset, majorVersion, fetchSize);
    }

    public ScanBindData withMajorVersion(int majorVersion) {
        return new ScanBindData(pool, schema, table, columns, types, filters,
            projection, limit, offset, majorVersion, fetchSize);
    }

    public ScanBindData withFetchSize(int fetchSize) {
        if (fetchSize <= 0) {
            throw new IllegalArgumentException("fetchSize must be positive, got: " + fetchSize);
        }
        return new ScanBindData(pool, schema, table, columns, types, filters,
            projection, limit, offset, majorVersion, fetchSize);
    }

    /**
     * Two bind data describe the same scan target when schema and table match.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanBindData that)) return false;
        return schema.equals(that.schema) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, table);
    }

    @Override
    public String toString() {
        return "ScanBindData{" + schema + "." + table +
               ", projection=" + projection +
               ", filters=" + filters +
               ", limit=" + limit +
               ", offset=" + offset +
               ", majorVersion=" + majorVersion + "}";
    }
}
