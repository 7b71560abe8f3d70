package com.duckora.connection;

import com.duckora.exception.ConnectionException;
import com.duckora.exception.OracleBridgeException;
import com.duckora.exception.RemoteExecutionException;
import com.duckora.exception.SchemaException;
import com.duckora.types.ColumnInfo;
import com.duckora.util.SQLQuoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One live session with the remote database.
 *
 * <p>Every public method holds the connection's lock for the duration of its
 * remote round trip, so a session may be shared between threads without
 * interleaving statements. Result streams returned by
 * {@link #executeQuery(String, int)} take the same lock for each fetch.
 *
 * <p>Example usage:
 * <pre>
 *   try (OracleConnection conn = OracleConnection.open(params)) {
 *       for (TableInfo table : conn.getTables("HR")) {
 *           List&lt;ColumnInfo&gt; columns = conn.getColumns("HR", table.name());
 *       }
 *   }
 * </pre>
 *
 * @see OracleConnectionPool
 */
public class OracleConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OracleConnection.class);

    /** Paging dialect assumed when the server version cannot be read. */
    public static final int FALLBACK_MAJOR_VERSION = 11;

    private static final Pattern VERSION_NUMBER = Pattern.compile("(\\d+)(\\.\\d+)+");

    static final String TABLES_SQL =
        "SELECT OBJECT_NAME, OBJECT_TYPE FROM ALL_OBJECTS " +
        "WHERE OWNER = ? AND OBJECT_TYPE IN ('TABLE', 'VIEW') ORDER BY OBJECT_NAME";

    static final String COLUMNS_SQL =
        "SELECT COLUMN_NAME, DATA_TYPE, DATA_PRECISION, DATA_SCALE, CHAR_LENGTH, NULLABLE " +
        "FROM ALL_TAB_COLUMNS WHERE OWNER = ? AND TABLE_NAME = ? ORDER BY COLUMN_ID";

    static final String SCHEMAS_SQL = "SELECT USERNAME FROM ALL_USERS ORDER BY USERNAME";

    static final String OBJECT_TYPE_SQL =
        "SELECT OBJECT_TYPE FROM ALL_OBJECTS " +
        "WHERE OWNER = ? AND OBJECT_NAME = ? AND OBJECT_TYPE IN ('TABLE', 'VIEW')";

    static final String ROW_COUNT_SQL =
        "SELECT NUM_ROWS FROM ALL_TABLES WHERE OWNER = ? AND TABLE_NAME = ?";

    private final Connection connection;
    private final OracleConnectionParameters params;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean closed = false;

    /**
     * Wraps an already open JDBC session.
     *
     * @param connection the JDBC session, in autocommit mode
     * @param params the parameters the session was opened with
     */
    public OracleConnection(Connection connection, OracleConnectionParameters params) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.params = Objects.requireNonNull(params, "params must not be null");
    }

    /**
     * Opens a session through the Oracle thin driver.
     *
     * @param params the connection parameters
     * @return the open session
     * @throws ConnectionException if the session cannot be established
     */
    public static OracleConnection open(OracleConnectionParameters params) {
        return open(params, ConnectionOpener.oracleThin());
    }

    /**
     * Opens a session with the given opener.
     *
     * @param params the connection parameters
     * @param opener the session source
     * @return the open session
     * @throws ConnectionException if the session cannot be established
     */
    public static OracleConnection open(OracleConnectionParameters params, ConnectionOpener opener) {
        Objects.requireNonNull(params, "params must not be null");
        Objects.requireNonNull(opener, "opener must not be null");
        Connection raw;
        try {
            raw = opener.open(params);
        } catch (SQLException e) {
            throw new ConnectionException(
                OracleBridgeException.remoteMessage("connect", e.getMessage()), e);
        }
        try {
            if (!raw.getAutoCommit()) {
                raw.setAutoCommit(true);
            }
        } catch (SQLException e) {
            try {
                raw.close();
            } catch (SQLException closeError) {
                e.addSuppressed(closeError);
            }
            throw new ConnectionException(
                OracleBridgeException.remoteMessage("connect", e.getMessage()), e);
        }
        logger.debug("Opened session to {}", params.connectTarget());
        return new OracleConnection(raw, params);
    }

    public OracleConnectionParameters params() {
        return params;
    }

    // ==================== Metadata ====================

    /**
     * Lists the tables and views owned by a schema, ordered by name.
     *
     * @param schema the owner (upper-cased before binding)
     * @return the listing, empty if the schema has no tables
     * @throws SchemaException if the dictionary query fails
     */
    public List<TableInfo> getTables(String schema) {
        String owner = SQLQuoting.toUpper(schema);
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(TABLES_SQL)) {
            ps.setString(1, owner);
            List<TableInfo> tables = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    tables.add(new TableInfo(owner, rs.getString(1), "VIEW".equals(rs.getString(2))));
                }
            }
            return tables;
        } catch (SQLException e) {
            throw new SchemaException(OracleBridgeException.remoteMessage("getTables", e.getMessage()), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Reads the column list of a table in declaration order.
     *
     * <p>Absent precision reads as 0, absent scale as
     * {@link ColumnInfo#UNSPECIFIED_SCALE}, absent char length as 0.
     *
     * @param schema the owner
     * @param table the table name
     * @return the columns, empty if the table does not exist
     * @throws SchemaException if the dictionary query fails
     */
    public List<ColumnInfo> getColumns(String schema, String table) {
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(COLUMNS_SQL)) {
            ps.setString(1, SQLQuoting.toUpper(schema));
            ps.setString(2, SQLQuoting.toUpper(table));
            List<ColumnInfo> columns = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(new ColumnInfo(
                        rs.getString(1),
                        rs.getString(2),
                        intOrDefault(rs, 3, 0),
                        intOrDefault(rs, 4, ColumnInfo.UNSPECIFIED_SCALE),
                        intOrDefault(rs, 5, 0),
                        "Y".equals(rs.getString(6))));
                }
            }
            return columns;
        } catch (SQLException e) {
            throw new SchemaException(OracleBridgeException.remoteMessage("getColumns", e.getMessage()), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lists the schemas (users) visible to the session.
     *
     * @return the schema names, ordered
     * @throws SchemaException if the dictionary query fails
     */
    public List<String> getSchemas() {
        lock.lock();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(SCHEMAS_SQL)) {
            List<String> schemas = new ArrayList<>();
            while (rs.next()) {
                schemas.add(rs.getString(1));
            }
            return schemas;
        } catch (SQLException e) {
            throw new SchemaException(OracleBridgeException.remoteMessage("getSchemas", e.getMessage()), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns whether a named object is a view.
     *
     * @param schema the owner
     * @param name the object name
     * @return true for a view; false for a table, a missing object or a failed lookup
     */
    public boolean isView(String schema, String name) {
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(OBJECT_TYPE_SQL)) {
            ps.setString(1, SQLQuoting.toUpper(schema));
            ps.setString(2, SQLQuoting.toUpper(name));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && "VIEW".equals(rs.getString(1));
            }
        } catch (SQLException e) {
            logger.warn("Could not read object type of {}.{}: {}", schema, name, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the optimizer's row count statistic for a table.
     *
     * <p>Statistics are only hints: a missing table, missing statistics or a
     * failed query all yield an empty result.
     *
     * @param schema the owner
     * @param table the table name
     * @return the row count, or empty when unknown
     */
    public OptionalLong getTableRowCount(String schema, String table) {
        lock.lock();
        try (PreparedStatement ps = connection.prepareStatement(ROW_COUNT_SQL)) {
            ps.setString(1, SQLQuoting.toUpper(schema));
            ps.setString(2, SQLQuoting.toUpper(table));
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    long rows = rs.getLong(1);
                    if (!rs.wasNull()) {
                        return OptionalLong.of(rows);
                    }
                }
            }
            return OptionalLong.empty();
        } catch (SQLException e) {
            logger.warn("Row count statistics unavailable for {}.{}: {}", schema, table, e.getMessage());
            return OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the server version as a dotted string, e.g. {@code 19.3.0.0.0}.
     *
     * @return the version, or {@code unknown: <reason>} if it cannot be read
     */
    public String getServerVersion() {
        lock.lock();
        try {
            String product = connection.getMetaData().getDatabaseProductVersion();
            if (product == null) {
                return "unknown: no version reported";
            }
            // banners carry "Release 19.0.0.0.0" before "Version 19.3.0.0.0"; the last number wins
            Matcher m = VERSION_NUMBER.matcher(product);
            String version = null;
            while (m.find()) {
                version = m.group();
            }
            return version != null ? version : product.trim();
        } catch (SQLException e) {
            logger.warn("Could not read server version: {}", e.getMessage());
            return "unknown: " + e.getMessage();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the server's major version, used to pick the paging dialect.
     *
     * @return the major version, or {@link #FALLBACK_MAJOR_VERSION} if unknown
     */
    public int getServerMajorVersion() {
        lock.lock();
        try {
            DatabaseMetaData md = connection.getMetaData();
            int major = md.getDatabaseMajorVersion();
            if (major > 0) {
                return major;
            }
        } catch (SQLException | RuntimeException e) {
            logger.warn("Could not read server major version, assuming {}: {}",
                FALLBACK_MAJOR_VERSION, e.getMessage());
        } finally {
            lock.unlock();
        }
        return FALLBACK_MAJOR_VERSION;
    }

    // ==================== Statements ====================

    /**
     * Runs a query and returns a streaming cursor over its rows.
     *
     * <p>The cursor stays open across fetches; the caller must close it.
     *
     * @param sql the query
     * @param fetchSize the driver row prefetch
     * @return the open result stream
     * @throws RemoteExecutionException if the query fails to execute
     */
    public OracleResultStream executeQuery(String sql, int fetchSize) {
        logger.debug("Executing remote query: {}", sql);
        lock.lock();
        Statement stmt = null;
        try {
            stmt = connection.createStatement();
            stmt.setFetchSize(fetchSize);
            ResultSet rs = stmt.executeQuery(sql);
            return new OracleResultStream(this, stmt, rs, sql);
        } catch (SQLException e) {
            closeQuietly(stmt);
            throw new RemoteExecutionException(
                OracleBridgeException.remoteMessage("executeQuery", e.getMessage()), e, sql);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a DML or DDL statement in autocommit mode.
     *
     * @param sql the statement
     * @return the update count
     * @throws RemoteExecutionException if the statement fails
     */
    public int executeUpdate(String sql) {
        logger.debug("Executing remote statement: {}", sql);
        lock.lock();
        try (Statement stmt = connection.createStatement()) {
            return stmt.executeUpdate(sql);
        } catch (SQLException e) {
            throw new RemoteExecutionException(
                OracleBridgeException.remoteMessage("executeUpdate", e.getMessage()), e, sql);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Binds one row of parameters on a prepared insert.
     */
    @FunctionalInterface
    public interface RowBinder {
        void bind(PreparedStatement ps, Object[] row) throws SQLException;
    }

    /**
     * Inserts rows with a prepared statement.
     *
     * <p>Unbatched, each row is executed and committed on its own, so rows
     * before a failing one stay committed. Batched, rows go to the remote as
     * one JDBC batch.
     *
     * @param sql the parameterised INSERT
     * @param rows the parameter rows
     * @param binder binds one row onto the statement
     * @param batched whether to send the rows as one batch
     * @return the number of rows inserted
     * @throws RemoteExecutionException if preparing, binding or executing fails
     */
    public long insert(String sql, List<Object[]> rows, RowBinder binder, boolean batched) {
        logger.debug("Inserting {} rows ({}): {}", rows.size(), batched ? "batched" : "row at a time", sql);
        lock.lock();
        long inserted = 0;
        boolean batchSent = false;
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (Object[] row : rows) {
                binder.bind(ps, row);
                if (batched) {
                    ps.addBatch();
                } else {
                    ps.executeUpdate();
                    inserted++;
                }
            }
            if (batched && !rows.isEmpty()) {
                batchSent = true;
                ps.executeBatch();
                inserted = rows.size();
            }
            return inserted;
        } catch (SQLException e) {
            // under autocommit a failed batch may already have applied a prefix of its rows
            String outcome = batchSent
                ? "batch of " + rows.size() + " rows failed; rows applied before the failure are unknown"
                : inserted + " rows committed before failure";
            throw new RemoteExecutionException(
                OracleBridgeException.remoteMessage("insert", e.getMessage())
                    + " (" + outcome + ")", e, sql);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Returns whether the underlying session is closed.
     */
    public boolean isClosed() {
        if (closed) {
            return true;
        }
        try {
            return connection.isClosed();
        } catch (SQLException e) {
            return true;
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            connection.close();
            logger.debug("Closed session to {}", params.connectTarget());
        } catch (SQLException e) {
            logger.warn("Failed to close session to {}: {}", params.connectTarget(), e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lock() {
        return lock;
    }

    private static int intOrDefault(ResultSet rs, int index, int defaultValue) throws SQLException {
        BigDecimal value = rs.getBigDecimal(index);
        return value == null ? defaultValue : value.intValue();
    }

    private static void closeQuietly(Statement stmt) {
        if (stmt == null) {
            return;
        }
        try {
            stmt.close();
        } catch (SQLException e) {
            logger.debug("Failed to close statement: {}", e.getMessage());
        }
    }
}
