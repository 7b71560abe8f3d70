package com.duckora.connection;

import com.duckora.exception.OracleBridgeException;
import com.duckora.exception.RemoteExecutionException;
import com.duckora.types.ColumnInfo;
import com.duckora.types.DataType;
import com.duckora.types.OracleTypeMapping;
import com.duckora.types.OracleValueReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Open remote cursor that is drained in chunks.
 *
 * <p>Each {@link #fetch(int)} call takes the owning connection's lock, reads
 * at most the requested number of rows and converts every cell with
 * {@link OracleValueReader}. The cursor is executed exactly once; fetches
 * continue from where the previous one stopped.
 */
public class OracleResultStream implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OracleResultStream.class);

    private final OracleConnection owner;
    private final Statement statement;
    private final ResultSet resultSet;
    private final String sql;
    private final List<ColumnInfo> columns;
    private List<DataType> targetTypes;
    private boolean exhausted = false;
    private boolean closed = false;

    OracleResultStream(OracleConnection owner, Statement statement, ResultSet resultSet, String sql)
            throws SQLException {
        this.owner = owner;
        this.statement = statement;
        this.resultSet = resultSet;
        this.sql = sql;
        this.columns = ColumnInfo.fromResultSetMetaData(resultSet.getMetaData());
        this.targetTypes = defaultTargets(columns);
    }

    /**
     * Returns the result columns as described by the driver.
     */
    public List<ColumnInfo> columns() {
        return Collections.unmodifiableList(columns);
    }

    /**
     * Overrides the engine types cells are converted to.
     *
     * @param targetTypes one engine type per result column
     * @return this stream
     */
    public OracleResultStream withTargetTypes(List<DataType> targetTypes) {
        if (targetTypes.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size()
                + " target types, got " + targetTypes.size());
        }
        this.targetTypes = new ArrayList<>(targetTypes);
        return this;
    }

    public List<DataType> targetTypes() {
        return Collections.unmodifiableList(targetTypes);
    }

    /**
     * Fetches up to {@code maxRows} rows.
     *
     * @param maxRows the maximum number of rows to return
     * @return converted rows; an empty list once the cursor is exhausted
     * @throws RemoteExecutionException if the driver fails while fetching
     */
    public List<Object[]> fetch(int maxRows) {
        if (exhausted || closed) {
            return Collections.emptyList();
        }
        List<Object[]> rows = new ArrayList<>(Math.min(maxRows, 4096));
        owner.lock().lock();
        try {
            while (rows.size() < maxRows) {
                if (!resultSet.next()) {
                    exhausted = true;
                    break;
                }
                Object[] row = new Object[columns.size()];
                for (int i = 0; i < row.length; i++) {
                    row[i] = OracleValueReader.read(resultSet, i + 1, columns.get(i), targetTypes.get(i));
                }
                rows.add(row);
            }
            return rows;
        } catch (SQLException | ArithmeticException e) {
            throw new RemoteExecutionException(
                OracleBridgeException.remoteMessage("fetch", e.getMessage()), e, sql);
        } finally {
            owner.lock().unlock();
        }
    }

    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        owner.lock().lock();
        try {
            resultSet.close();
            statement.close();
        } catch (SQLException e) {
            logger.warn("Failed to close remote cursor: {}", e.getMessage());
        } finally {
            owner.lock().unlock();
        }
    }

    private static List<DataType> defaultTargets(List<ColumnInfo> columns) {
        List<DataType> types = new ArrayList<>(columns.size());
        for (ColumnInfo column : columns) {
            types.add(OracleTypeMapping.toEngineType(column));
        }
        return types;
    }
}
