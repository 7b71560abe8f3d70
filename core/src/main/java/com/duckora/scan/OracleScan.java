package com.duckora.scan;

import com.duckora.catalog.OracleTableEntry;
import com.duckora.connection.PooledConnection;
import com.duckora.exception.RemoteExecutionException;
import com.duckora.expression.Expression;
import com.duckora.pushdown.FilterPushdown;
import com.duckora.pushdown.PushdownResult;
import com.duckora.pushdown.SelectQueryBuilder;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Table scan function over one remote table.
 *
 * <p>Lifecycle (see {@link ScanState}): {@link #bind} produces a BOUND scan.
 * While bound, the planner may push filters, a projection and paging into
 * the bind data. {@link #initGlobal()} fixes the plan, {@link #initLocal}
 * borrows a session and {@link #scan()} returns batches until the remote
 * cursor is drained.
 *
 * <p>Scans run as a single task on a single thread.
 */
public class OracleScan implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OracleScan.class);

    /**
     * Scan-wide state shared by all local states.
     *
     * @param sql the remote query
     * @param taskCount number of independent scan tasks
     * @param maxThreads maximum threads the engine may use
     */
    public record GlobalScanState(String sql, int taskCount, int maxThreads) {
    }

    private ScanBindData bindData;
    private final NodeStatistics cardinality;
    private final int batchSize;
    private ScanState state;
    private GlobalScanState global;
    private OracleScanStream stream;

    private OracleScan(ScanBindData bindData, NodeStatistics cardinality, int batchSize) {
        this.bindData = bindData;
        this.cardinality = cardinality;
        this.batchSize = StreamingConfig.normalizeBatchSize(batchSize);
        this.state = ScanState.BOUND;
    }

    /**
     * Binds a scan over a cataloged table, using its cardinality estimate and
     * the catalog's batch size.
     */
    public static OracleScan bind(OracleTableEntry table) {
        Objects.requireNonNull(table, "table must not be null");
        return new OracleScan(table.bindData(), table.getCardinality(),
            table.catalog().configuration().batchSize);
    }

    /**
     * Binds a scan over prepared bind data with the default estimates.
     */
    public static OracleScan bind(ScanBindData bindData) {
        Objects.requireNonNull(bindData, "bindData must not be null");
        return new OracleScan(bindData, NodeStatistics.of(StreamingConfig.DEFAULT_CARDINALITY),
            StreamingConfig.DEFAULT_BATCH_SIZE);
    }

    public ScanState state() {
        return state;
    }

    public ScanBindData bindData() {
        return bindData;
    }

    public NodeStatistics cardinality() {
        return cardinality;
    }

    public int batchSize() {
        return batchSize;
    }

    /**
     * Returns the remote query for the current bind data.
     */
    public String sql() {
        return global != null ? global.sql() : SelectQueryBuilder.build(bindData);
    }

    // ==================== Planning ====================

    /**
     * Offers filters to the remote.
     *
     * @param filters bound filter expressions, implicitly AND-ed
     * @return the filters the engine must still evaluate
     */
    public List<Expression> pushdownFilters(List<? extends Expression> filters) {
        requireState(ScanState.BOUND, "pushdownFilters");
        PushdownResult result = FilterPushdown.pushdown(bindData, filters);
        bindData = result.bindData();
        return result.remaining();
    }

    /**
     * Restricts the scan to the given column positions.
     *
     * @param columnIds positions in the table's column list, or {@link ScanBindData#ROW_ID}
     */
    public OracleScan project(List<Integer> columnIds) {
        requireState(ScanState.BOUND, "project");
        bindData = bindData.withProjection(columnIds);
        return this;
    }

    public OracleScan limit(long limit) {
        requireState(ScanState.BOUND, "limit");
        bindData = bindData.withLimit(limit);
        return this;
    }

    public OracleScan offset(long offset) {
        requireState(ScanState.BOUND, "offset");
        bindData = bindData.withOffset(offset);
        return this;
    }

    // ==================== Execution ====================

    /**
     * Fixes the remote query. Repeated calls return the same state.
     */
    public GlobalScanState initGlobal() {
        if (global == null) {
            requireState(ScanState.BOUND, "initGlobal");
            global = new GlobalScanState(SelectQueryBuilder.build(bindData), 1, 1);
            logger.debug("Planned scan of {}.{}: {}", bindData.schema(), bindData.table(), global.sql());
        }
        return global;
    }

    /**
     * Borrows a session from the pool and prepares the batch stream.
     *
     * @param allocator the Arrow allocator for output batches
     * @throws com.duckora.exception.ConnectionException if no session can be opened
     */
    public void initLocal(BufferAllocator allocator) {
        initGlobal();
        requireState(ScanState.BOUND, "initLocal");
        PooledConnection connection = bindData.pool().borrow();
        stream = new OracleScanStream(connection, global.sql(), bindData.outputSchema(),
            allocator, batchSize, bindData.fetchSize());
        state = ScanState.INITIALIZED;
    }

    /**
     * Returns the next batch, or empty once the remote cursor is drained.
     *
     * <p>The returned root is owned by the scan and reused between calls.
     *
     * @throws RemoteExecutionException if the remote query fails; the scan is
     *         then FAILED and its session released
     */
    public Optional<VectorSchemaRoot> scan() {
        if (state == ScanState.EXHAUSTED) {
            return Optional.empty();
        }
        if (state != ScanState.INITIALIZED && state != ScanState.STREAMING) {
            throw new IllegalStateException("Cannot scan in state " + state);
        }
        try {
            if (stream.hasNext()) {
                state = ScanState.STREAMING;
                return Optional.of(stream.next());
            }
        } catch (RemoteExecutionException e) {
            state = ScanState.FAILED;
            throw e;
        }
        state = ScanState.EXHAUSTED;
        logger.debug("Scan of {}.{} done: {} rows in {} batches", bindData.schema(), bindData.table(),
            stream.getTotalRowCount(), stream.getBatchCount());
        return Optional.empty();
    }

    /**
     * Returns the batch stream, for callers that prefer iterating.
     */
    public ArrowBatchIterator stream() {
        if (stream == null) {
            throw new IllegalStateException("Scan not initialized");
        }
        return stream;
    }

    @Override
    public void close() {
        if (stream != null) {
            stream.close();
        }
    }

    private void requireState(ScanState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException(operation + " requires state " + expected + ", scan is " + state);
        }
    }
}
