package com.duckora.connection;

import java.util.Objects;

/**
 * Auto-closeable loan of a pooled session.
 *
 * <p>This class implements the loan pattern for connection management,
 * ensuring that sessions are always returned to the pool even in the
 * presence of exceptions.
 *
 * <p>Usage:
 * <pre>
 *   try (PooledConnection pooled = pool.borrow()) {
 *       pooled.get().executeUpdate("DROP TABLE \"HR\".\"TMP\"");
 *   } // Automatically released back to pool
 * </pre>
 *
 * @see OracleConnectionPool
 */
public class PooledConnection implements AutoCloseable {

    private final OracleConnection connection;
    private final OracleConnectionPool pool;
    private boolean released = false;

    PooledConnection(OracleConnection connection, OracleConnectionPool pool) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    /**
     * Returns the borrowed session.
     *
     * @return the session
     * @throws IllegalStateException if the session was already released
     */
    public OracleConnection get() {
        if (released) {
            throw new IllegalStateException("Connection already released to pool");
        }
        return connection;
    }

    /**
     * Releases the session back to the pool. Idempotent.
     */
    @Override
    public void close() {
        if (!released) {
            released = true;
            pool.release(connection);
        }
    }

    public boolean isReleased() {
        return released;
    }
}
