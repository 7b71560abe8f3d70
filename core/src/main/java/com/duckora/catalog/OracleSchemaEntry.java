package com.duckora.catalog;

import com.duckora.connection.OracleConnection;
import com.duckora.connection.PooledConnection;
import com.duckora.connection.TableInfo;
import com.duckora.exception.RemoteExecutionException;
import com.duckora.exception.SchemaException;
import com.duckora.exception.UnsupportedRemoteOperationException;
import com.duckora.types.ColumnInfo;
import com.duckora.types.OracleTypeMapping;
import com.duckora.util.SQLQuoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * One remote schema (Oracle user) and its cache of loaded tables.
 *
 * <p>A table is loaded from the data dictionary the first time it is looked
 * up and cached from then on. A lookup that finds no columns returns empty and
 * caches nothing, so a table created remotely later is found on the next
 * lookup.
 */
public class OracleSchemaEntry implements CatalogEntry {

    private static final Logger logger = LoggerFactory.getLogger(OracleSchemaEntry.class);

    private final OracleCatalog catalog;
    private final String name;
    private final ConcurrentHashMap<String, OracleTableEntry> tables = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    OracleSchemaEntry(OracleCatalog catalog, String name) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EntryKind kind() {
        return EntryKind.SCHEMA;
    }

    public OracleCatalog catalog() {
        return catalog;
    }

    // ==================== Lookups ====================

    /**
     * Returns a table or view, loading its columns on first lookup.
     *
     * @param tableName the table name, in any case
     * @return the entry, or empty if the remote reports no columns for it
     * @throws SchemaException if the dictionary cannot be read
     */
    public Optional<OracleTableEntry> getOrLoadTable(String tableName) {
        return getOrLoadTable(tableName, null);
    }

    private Optional<OracleTableEntry> getOrLoadTable(String tableName, Boolean knownView) {
        String upper = SQLQuoting.toUpper(Objects.requireNonNull(tableName, "tableName must not be null"));
        OracleTableEntry cached = tables.get(upper);
        if (cached != null) {
            return Optional.of(cached);
        }

        List<ColumnInfo> columns;
        boolean isView;
        try (PooledConnection pooled = catalog.pool().borrow()) {
            OracleConnection conn = pooled.get();
            columns = conn.getColumns(name, upper);
            if (columns.isEmpty()) {
                logger.debug("No columns found for {}.{}", name, upper);
                return Optional.empty();
            }
            isView = knownView != null ? knownView : conn.isView(name, upper);
        }

        lock.lock();
        try {
            OracleTableEntry existing = tables.get(upper);
            if (existing != null) {
                return Optional.of(existing);
            }
            OracleTableEntry entry = new OracleTableEntry(this, upper, columns,
                isView ? EntryKind.VIEW : EntryKind.TABLE);
            tables.put(upper, entry);
            logger.debug("Loaded {} {}.{} with {} columns", entry.kind(), name, upper, columns.size());
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lists the remote tables and views of this schema, loading each one.
     *
     * @param callback receives each table entry
     * @throws SchemaException if the listing fails
     */
    public void scan(Consumer<OracleTableEntry> callback) {
        List<TableInfo> listing;
        try (PooledConnection pooled = catalog.pool().borrow()) {
            listing = pooled.get().getTables(name);
        }
        for (TableInfo info : listing) {
            getOrLoadTable(info.name(), info.isView()).ifPresent(callback);
        }
    }

    /**
     * Convenience over {@link #scan(Consumer)}.
     */
    public List<OracleTableEntry> listTables() {
        List<OracleTableEntry> result = new ArrayList<>();
        scan(result::add);
        return result;
    }

    /**
     * Returns whether a table is currently cached (without loading it).
     */
    public boolean isCached(String tableName) {
        return tables.containsKey(SQLQuoting.toUpper(tableName));
    }

    // ==================== DDL ====================

    /**
     * Creates a table remotely and returns its freshly loaded entry.
     *
     * <p>Table and column names are upper-cased, so the table resolves the same
     * way as tables created with unquoted names on the remote.
     *
     * @param info the table definition
     * @return the created (or, with ifNotExists, existing) table
     * @throws UnsupportedRemoteOperationException if the catalog is read-only
     * @throws SchemaException if the remote rejects the DDL
     */
    public OracleTableEntry createTable(CreateTableInfo info) {
        requireWritable("CREATE TABLE");
        String table = SQLQuoting.toUpper(info.table());

        if (info.ifNotExists()) {
            Optional<OracleTableEntry> existing = getOrLoadTable(table);
            if (existing.isPresent()) {
                return existing.get();
            }
        }

        String ddl = createTableSql(name, table, info.columns());
        try (PooledConnection pooled = catalog.pool().borrow()) {
            pooled.get().executeUpdate(ddl);
        } catch (RemoteExecutionException e) {
            throw new SchemaException(e.getMessage(), e);
        }
        logger.info("Created table {}.{}", name, table);

        tables.remove(table);
        return getOrLoadTable(table)
            .orElseThrow(() -> new SchemaException("Table " + name + "." + table
                + " was created but its columns could not be read back"));
    }

    static String createTableSql(String schema, String table, List<ColumnDefinition> columns) {
        StringJoiner cols = new StringJoiner(", ", " (", ")");
        for (ColumnDefinition column : columns) {
            String col = SQLQuoting.quoteIdentifier(SQLQuoting.toUpper(column.name()))
                + " " + OracleTypeMapping.toOracleType(column.dataType());
            cols.add(column.nullable() ? col : col + " NOT NULL");
        }
        return "CREATE TABLE " + SQLQuoting.quoteQualified(schema, table) + cols;
    }

    /**
     * Drops a table or view remotely and evicts it from the cache.
     *
     * @param info what to drop
     * @return true if an object was dropped, false if it did not exist and
     *         {@code ifExists} was set
     * @throws UnsupportedRemoteOperationException if the catalog is read-only
     * @throws SchemaException if the remote rejects the DDL
     */
    public boolean dropEntry(DropInfo info) {
        requireWritable("DROP");
        String object = SQLQuoting.toUpper(info.name());

        if (info.ifExists() && getOrLoadTable(object).isEmpty()) {
            logger.debug("Nothing to drop: {}.{} does not exist", name, object);
            return false;
        }

        String sql = dropSql(name, object, info);
        try (PooledConnection pooled = catalog.pool().borrow()) {
            pooled.get().executeUpdate(sql);
        } catch (RemoteExecutionException e) {
            throw new SchemaException(e.getMessage(), e);
        }
        tables.remove(object);
        logger.info("Dropped {} {}.{}", info.kind(), name, object);
        return true;
    }

    static String dropSql(String schema, String object, DropInfo info) {
        if (info.kind() == EntryKind.VIEW) {
            return "DROP VIEW " + SQLQuoting.quoteQualified(schema, object);
        }
        StringBuilder sql = new StringBuilder("DROP TABLE ").append(SQLQuoting.quoteQualified(schema, object));
        if (info.cascade()) {
            sql.append(" CASCADE CONSTRAINTS");
        }
        if (info.purge()) {
            sql.append(" PURGE");
        }
        return sql.toString();
    }

    /**
     * Index creation is not performed against the remote.
     *
     * @throws UnsupportedRemoteOperationException always
     */
    public void createIndex(String indexName, String tableName, List<String> columns) {
        throw new UnsupportedRemoteOperationException(
            "CREATE INDEX is not supported on Oracle catalog '" + catalog.name() + "' ("
                + indexName + " on " + name + "." + tableName + ")");
    }

    private void requireWritable(String operation) {
        if (catalog.isReadOnly()) {
            throw new UnsupportedRemoteOperationException(
                operation + " is not allowed: Oracle catalog '" + catalog.name() + "' is attached read-only");
        }
    }

    @Override
    public String toString() {
        return "OracleSchemaEntry(" + catalog.name() + "." + name + ")";
    }
}
