package com.duckora.scan;

import com.duckora.connection.OracleResultStream;
import com.duckora.connection.PooledConnection;
import com.duckora.exception.OracleBridgeException;
import com.duckora.exception.RemoteExecutionException;
import com.duckora.types.DataType;
import com.duckora.types.StructType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Streaming Arrow batch iterator over one remote query.
 *
 * <p>The query is executed once, on the first {@link #hasNext()}, and its
 * cursor stays open across batches; each batch fetches at most
 * {@code batchSize} rows. When the cursor is exhausted, fails or the stream is
 * closed, the cursor is closed and the session goes back to its pool.
 *
 * <p>A remote failure is recorded (see {@link #getError()}) and rethrown from
 * {@code hasNext()}; later calls return false.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OracleScanStream stream = new OracleScanStream(pooled, sql, schema, allocator, 2048, 10000)) {
 *     while (stream.hasNext()) {
 *         VectorSchemaRoot batch = stream.next();
 *         // Process batch - do NOT close, owned by stream
 *     }
 * }
 * }</pre>
 */
public class OracleScanStream implements ArrowBatchIterator {

    private static final Logger logger = LoggerFactory.getLogger(OracleScanStream.class);

    private final PooledConnection connection;
    private final String sql;
    private final List<DataType> types;
    private final VectorSchemaRoot root;
    private final int batchSize;
    private final int fetchSize;

    private OracleResultStream cursor;
    private boolean batchLoaded = false;
    private boolean exhausted = false;
    private boolean closed = false;
    private long totalRowCount = 0;
    private int batchCount = 0;
    private Exception error = null;

    /**
     * Creates a stream; nothing is sent to the remote until the first hasNext().
     *
     * @param connection the borrowed session, released when the stream ends
     * @param sql the remote query
     * @param schema the row type of the query's result
     * @param allocator Arrow memory allocator
     * @param batchSize rows per batch
     * @param fetchSize driver row prefetch
     */
    public OracleScanStream(PooledConnection connection, String sql, StructType schema,
                            BufferAllocator allocator, int batchSize, int fetchSize) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        this.types = schema.fieldTypes();
        this.root = VectorSchemaRoot.create(schema.toArrowSchema(), allocator);
        this.batchSize = StreamingConfig.normalizeBatchSize(batchSize);
        this.fetchSize = fetchSize;
    }

    public String sql() {
        return sql;
    }

    @Override
    public Schema getSchema() {
        return root.getSchema();
    }

    @Override
    public boolean hasNext() {
        if (closed || error != null || exhausted) {
            return false;
        }
        if (batchLoaded) {
            return true;
        }
        try {
            if (cursor == null) {
                cursor = connection.get().executeQuery(sql, fetchSize).withTargetTypes(types);
            }
            List<Object[]> rows = cursor.fetch(batchSize);
            if (rows.isEmpty()) {
                exhausted = true;
                logger.debug("Remote query exhausted after {} rows in {} batches", totalRowCount, batchCount);
                releaseRemote();
                return false;
            }
            ArrowBatchWriter.write(root, rows, types);
            batchLoaded = true;
            return true;
        } catch (OracleBridgeException e) {
            throw fail(e);
        } catch (RuntimeException e) {
            // value conversion and Arrow writes fail outside the driver
            throw fail(new RemoteExecutionException(
                OracleBridgeException.remoteMessage("fetch", String.valueOf(e.getMessage())), e, sql));
        }
    }

    @Override
    public VectorSchemaRoot next() {
        if (closed) {
            throw new IllegalStateException("Stream is closed");
        }
        if (!hasNext()) {
            throw new NoSuchElementException("No more batches");
        }
        totalRowCount += root.getRowCount();
        batchCount++;
        batchLoaded = false;
        if (logger.isDebugEnabled()) {
            logger.debug("Batch {}: {} rows (total: {})", batchCount, root.getRowCount(), totalRowCount);
        }
        return root;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    @Override
    public long getTotalRowCount() {
        return totalRowCount;
    }

    @Override
    public int getBatchCount() {
        return batchCount;
    }

    @Override
    public boolean hasError() {
        return error != null;
    }

    @Override
    public Exception getError() {
        return error;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        releaseRemote();
        root.close();
    }

    private OracleBridgeException fail(OracleBridgeException e) {
        error = e;
        logger.error("Remote scan failed: {}", e.getMessage());
        releaseRemote();
        return e;
    }

    private void releaseRemote() {
        if (cursor != null) {
            cursor.close();
            cursor = null;
        }
        connection.close();
    }
}
