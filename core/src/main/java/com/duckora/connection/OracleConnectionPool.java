package com.duckora.connection;

import com.duckora.exception.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of idle remote sessions for one attached database.
 *
 * <p>Idle sessions are kept on a LIFO stack guarded by a single lock, so the
 * most recently used session (the one most likely still warm) is handed out
 * first. Opening a new session happens outside the lock. The pool never blocks
 * and never caps the number of sessions in use; it only caps how many idle
 * sessions it keeps.
 *
 * <p>Example usage:
 * <pre>
 *   OracleConnectionPool pool = new OracleConnectionPool(params);
 *
 *   try (PooledConnection pooled = pool.borrow()) {
 *       List&lt;TableInfo&gt; tables = pooled.get().getTables("HR");
 *   } // Automatically released
 *
 *   pool.close();
 * </pre>
 */
public class OracleConnectionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(OracleConnectionPool.class);

    public static final int DEFAULT_MAX_IDLE = 8;

    private final OracleConnectionParameters params;
    private final ConnectionOpener opener;
    private final int maxIdle;
    private final Deque<OracleConnection> idle = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private boolean closed = false;

    public OracleConnectionPool(OracleConnectionParameters params) {
        this(params, ConnectionOpener.oracleThin(), DEFAULT_MAX_IDLE);
    }

    /**
     * Creates a pool.
     *
     * @param params the parameters new sessions are opened with
     * @param opener the session source
     * @param maxIdle the maximum number of idle sessions kept
     */
    public OracleConnectionPool(OracleConnectionParameters params, ConnectionOpener opener, int maxIdle) {
        this.params = Objects.requireNonNull(params, "params must not be null");
        this.opener = Objects.requireNonNull(opener, "opener must not be null");
        if (maxIdle <= 0) {
            throw new IllegalArgumentException("maxIdle must be positive, got: " + maxIdle);
        }
        this.maxIdle = maxIdle;
    }

    public OracleConnectionParameters params() {
        return params;
    }

    /**
     * Takes an idle session, or opens a new one when none is idle.
     *
     * @return a session owned exclusively by the caller until released
     * @throws ConnectionException if the pool is closed or a session cannot be opened
     */
    public OracleConnection acquire() {
        lock.lock();
        try {
            if (closed) {
                throw new ConnectionException("Connection pool is closed");
            }
            while (!idle.isEmpty()) {
                OracleConnection conn = idle.pop();
                if (!conn.isClosed()) {
                    return conn;
                }
            }
        } finally {
            lock.unlock();
        }
        return OracleConnection.open(params, opener);
    }

    /**
     * Borrows a session that is released when the returned handle is closed.
     *
     * @return the loan handle
     */
    public PooledConnection borrow() {
        return new PooledConnection(acquire(), this);
    }

    /**
     * Returns a session to the pool.
     *
     * <p>Closed sessions are dropped. When the pool is full or closed the
     * session is closed instead of kept.
     *
     * @param conn the session (may be null)
     */
    public void release(OracleConnection conn) {
        if (conn == null || conn.isClosed()) {
            return;
        }
        boolean keep;
        lock.lock();
        try {
            keep = !closed && idle.size() < maxIdle;
            if (keep) {
                idle.push(conn);
            }
        } finally {
            lock.unlock();
        }
        if (!keep) {
            logger.debug("Connection pool full or closed, closing released session");
            conn.close();
        }
    }

    /**
     * Closes every idle session. Sessions currently in use are unaffected and
     * may still be released back afterwards.
     */
    public void clearCache() {
        List<OracleConnection> drained = drainIdle();
        drained.forEach(OracleConnection::close);
        if (!drained.isEmpty()) {
            logger.debug("Closed {} idle sessions", drained.size());
        }
    }

    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxIdle() {
        return maxIdle;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the pool and its idle sessions. Sessions released later are closed.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            lock.unlock();
        }
        clearCache();
    }

    private List<OracleConnection> drainIdle() {
        lock.lock();
        try {
            List<OracleConnection> drained = new ArrayList<>(idle);
            idle.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }
}
