package com.duckora.connection;

import com.duckora.exception.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide holder of the resolved Oracle JDBC driver.
 *
 * <p>Created lazily on first use under a lock and never torn down. Driver
 * resolution failing (thin driver not on the classpath) is reported as a
 * {@link ConnectionException}.
 */
public final class OracleDriverContext {

    private static final Logger logger = LoggerFactory.getLogger(OracleDriverContext.class);

    static final String URL_PREFIX = "jdbc:oracle:thin:";

    private static final ReentrantLock INIT_LOCK = new ReentrantLock();
    private static volatile OracleDriverContext instance;

    private final Driver driver;

    private OracleDriverContext(Driver driver) {
        this.driver = driver;
    }

    /**
     * Returns the shared context, resolving the driver on first call.
     *
     * @return the driver context
     * @throws ConnectionException if no driver accepts thin URLs
     */
    public static OracleDriverContext get() {
        OracleDriverContext ctx = instance;
        if (ctx != null) {
            return ctx;
        }
        INIT_LOCK.lock();
        try {
            if (instance == null) {
                try {
                    Driver driver = DriverManager.getDriver(URL_PREFIX);
                    logger.info("Oracle JDBC driver resolved: {} {}.{}",
                        driver.getClass().getName(), driver.getMajorVersion(), driver.getMinorVersion());
                    instance = new OracleDriverContext(driver);
                } catch (SQLException e) {
                    throw new ConnectionException(
                        "Oracle JDBC driver is not available: " + e.getMessage(), e);
                }
            }
            return instance;
        } finally {
            INIT_LOCK.unlock();
        }
    }

    /**
     * Opens a session with the driver.
     *
     * @param params the connection parameters
     * @return the open connection
     * @throws SQLException if the driver refuses the connection
     */
    public Connection connect(OracleConnectionParameters params) throws SQLException {
        Connection conn = driver.connect(params.jdbcUrl(), driverProperties(params));
        if (conn == null) {
            throw new SQLException("Driver did not accept URL " + params.jdbcUrl());
        }
        return conn;
    }

    /**
     * Builds the driver connection properties for the parameters.
     */
    static Properties driverProperties(OracleConnectionParameters params) {
        Properties props = new Properties();
        if (params.user() != null) {
            props.setProperty("user", params.user());
        }
        if (params.password() != null) {
            props.setProperty("password", params.password());
        }
        props.setProperty("defaultRowPrefetch", Integer.toString(params.fetchSize()));
        if (params.hasWallet()) {
            props.setProperty("oracle.net.wallet_location", params.walletLocation());
            props.setProperty("oracle.net.tns_admin", params.walletLocation());
        }
        return props;
    }
}
