package com.duckora.catalog;

import com.duckora.connection.PooledConnection;
import com.duckora.scan.NodeStatistics;
import com.duckora.scan.OracleScan;
import com.duckora.scan.ScanBindData;
import com.duckora.scan.StreamingConfig;
import com.duckora.types.ColumnInfo;
import com.duckora.types.DataType;
import com.duckora.types.OracleTypeMapping;
import com.duckora.types.StructField;
import com.duckora.types.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A remote table or view with its cached column list.
 *
 * <p>The column order is the dictionary's {@code COLUMN_ID} order and never
 * changes for the lifetime of the entry; column positions used by scans and
 * filters index this list.
 */
public class OracleTableEntry implements CatalogEntry {

    private final OracleSchemaEntry schema;
    private final String name;
    private final List<ColumnInfo> columns;
    private final List<DataType> types;
    private final StructType structType;
    private final EntryKind kind;
    private volatile NodeStatistics cardinality;

    OracleTableEntry(OracleSchemaEntry schema, String name, List<ColumnInfo> columns, EntryKind kind) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.columns = List.copyOf(columns);
        this.kind = kind;

        List<DataType> mapped = new ArrayList<>(columns.size());
        List<StructField> fields = new ArrayList<>(columns.size());
        for (ColumnInfo column : columns) {
            DataType type = OracleTypeMapping.toEngineType(column);
            mapped.add(type);
            fields.add(new StructField(column.name(), type, column.nullable()));
        }
        this.types = Collections.unmodifiableList(mapped);
        this.structType = new StructType(fields);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EntryKind kind() {
        return kind;
    }

    public OracleSchemaEntry schema() {
        return schema;
    }

    public OracleCatalog catalog() {
        return schema.catalog();
    }

    public List<ColumnInfo> columns() {
        return columns;
    }

    public List<DataType> types() {
        return types;
    }

    /**
     * Returns the engine row type of the table.
     */
    public StructType structType() {
        return structType;
    }

    /**
     * Returns the position of a column, or -1 if there is none with that name.
     *
     * @param columnName the column name, compared exactly
     */
    public int columnIndex(String columnName) {
        return structType.fieldIndex(columnName);
    }

    /**
     * Creates bind data projecting every column of this table.
     */
    public ScanBindData bindData() {
        OracleCatalog catalog = catalog();
        return ScanBindData.of(catalog.pool(), schema.name(), name, columns, types,
            catalog.majorVersion(), catalog.params().fetchSize());
    }

    /**
     * Returns a bound scan over this table.
     *
     * @return the scan, in state BOUND
     */
    public OracleScan getScanFunction() {
        return OracleScan.bind(this);
    }

    /**
     * Returns the row count estimate: the remote's statistics when available,
     * otherwise {@link StreamingConfig#DEFAULT_CARDINALITY}. Read once per entry.
     */
    public NodeStatistics getCardinality() {
        NodeStatistics stats = cardinality;
        if (stats == null) {
            OptionalLong rows;
            try (PooledConnection pooled = catalog().pool().borrow()) {
                rows = pooled.get().getTableRowCount(schema.name(), name);
            }
            stats = NodeStatistics.of(rows.orElse(StreamingConfig.DEFAULT_CARDINALITY));
            cardinality = stats;
        }
        return stats;
    }

    @Override
    public String toString() {
        return "OracleTableEntry(" + schema.name() + "." + name + ", " + kind + ", " + structType + ")";
    }
}
