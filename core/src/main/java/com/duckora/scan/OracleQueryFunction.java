package com.duckora.scan;

import com.duckora.catalog.Catalog;
import com.duckora.catalog.CatalogRegistry;
import com.duckora.catalog.OracleCatalog;
import com.duckora.connection.OracleResultStream;
import com.duckora.connection.PooledConnection;
import com.duckora.types.ColumnInfo;
import com.duckora.types.DataType;
import com.duckora.types.OracleTypeMapping;
import com.duckora.types.StructField;
import com.duckora.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pass-through query against an attached remote database.
 *
 * <p>The result columns are discovered by running the query wrapped in a
 * filter that returns no rows; the query itself is sent unchanged when the
 * stream is opened.
 */
public class OracleQueryFunction {

    private static final Logger logger = LoggerFactory.getLogger(OracleQueryFunction.class);

    private final OracleCatalog catalog;
    private final String sql;
    private final List<ColumnInfo> columns;
    private final StructType schema;

    private OracleQueryFunction(OracleCatalog catalog, String sql, List<ColumnInfo> columns) {
        this.catalog = catalog;
        this.sql = sql;
        this.columns = List.copyOf(columns);
        List<StructField> fields = new ArrayList<>(columns.size());
        for (ColumnInfo column : columns) {
            fields.add(new StructField(column.name(), OracleTypeMapping.toEngineType(column), column.nullable()));
        }
        this.schema = new StructType(fields);
    }

    /**
     * Resolves the result columns of a query.
     *
     * @param registry the attached catalogs
     * @param catalogName the attach name of an Oracle catalog
     * @param sql the remote query, in the remote dialect
     * @return the bound function
     * @throws IllegalArgumentException if no Oracle catalog has that name
     * @throws com.duckora.exception.RemoteExecutionException if the query is rejected
     */
    public static OracleQueryFunction bind(CatalogRegistry registry, String catalogName, String sql) {
        Objects.requireNonNull(sql, "sql must not be null");
        Catalog found = registry.get(catalogName)
            .orElseThrow(() -> new IllegalArgumentException("No attached catalog named '" + catalogName + "'"));
        if (!(found instanceof OracleCatalog catalog)) {
            throw new IllegalArgumentException("Catalog '" + catalogName + "' is not an Oracle catalog");
        }

        String probe = probeSql(sql);
        List<ColumnInfo> columns;
        try (PooledConnection pooled = catalog.pool().borrow();
             OracleResultStream result = pooled.get().executeQuery(probe, 1)) {
            columns = result.columns();
        }
        logger.debug("Bound pass-through query on '{}' with {} columns", catalogName, columns.size());
        return new OracleQueryFunction(catalog, sql, columns);
    }

    static String probeSql(String sql) {
        return "SELECT * FROM (" + sql + ") WHERE 1=0";
    }

    public String sql() {
        return sql;
    }

    public List<ColumnInfo> columns() {
        return columns;
    }

    public List<String> names() {
        return schema.fieldNames();
    }

    public List<DataType> types() {
        return schema.fieldTypes();
    }

    public StructType schema() {
        return schema;
    }

    /**
     * Runs the query and streams its rows as Arrow batches.
     *
     * @param allocator the Arrow allocator for output batches
     * @return the batch stream; closing it releases the session
     */
    public ArrowBatchIterator stream(BufferAllocator allocator) {
        PooledConnection connection = catalog.pool().borrow();
        return new OracleScanStream(connection, sql, schema, allocator,
            catalog.configuration().batchSize, catalog.params().fetchSize());
    }
}
