package com.duckora.scan;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.Iterator;

/**
 * Batches of a remote result, pulled one at a time.
 *
 * <pre>{@code
 * try (ArrowBatchIterator batches = query.stream(allocator)) {
 *     while (batches.hasNext()) {
 *         VectorSchemaRoot batch = batches.next();
 *         // read the batch; it is refilled by the next call
 *     }
 * }
 * }</pre>
 *
 * <p>The root returned by {@link #next()} belongs to the iterator and is
 * reused for every batch; callers never close it. A remote failure is
 * thrown from {@link #hasNext()} and also kept for {@link #getError()}.
 */
public interface ArrowBatchIterator extends Iterator<VectorSchemaRoot>, AutoCloseable {

    Schema getSchema();

    /** Rows handed out so far. */
    long getTotalRowCount();

    /** Batches handed out so far. */
    int getBatchCount();

    boolean hasError();

    /**
     * @return the failure that ended iteration, or null
     */
    Exception getError();

    /**
     * Closes the remote cursor, returns the session to its pool and frees the
     * batch buffers. Idempotent.
     */
    @Override
    void close();
}
