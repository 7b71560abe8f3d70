package com.duckora.connection;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a raw JDBC session for a set of connection parameters.
 *
 * <p>The default opener goes through {@link OracleDriverContext}. Other
 * implementations can hand out sessions from any JDBC source that exposes
 * the Oracle data dictionary views the bridge queries.
 */
@FunctionalInterface
public interface ConnectionOpener {

    /**
     * Opens a new session.
     *
     * @param params the connection parameters
     * @return an open JDBC connection in autocommit mode
     * @throws SQLException if the session cannot be established
     */
    Connection open(OracleConnectionParameters params) throws SQLException;

    /**
     * Returns the opener that connects through the Oracle thin driver.
     */
    static ConnectionOpener oracleThin() {
        return params -> OracleDriverContext.get().connect(params);
    }
}
