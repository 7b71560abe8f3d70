package com.duckora.exception;

/**
 * Exception thrown when a remote statement fails to prepare, execute or fetch.
 *
 * <p>Keeps the SQL text that failed so callers and logs can show exactly
 * what was sent to the remote.
 *
 * <p>Example usage:
 * <pre>
 *   try (OracleResultStream rows = connection.executeQuery(sql, 10000)) {
 *       ...
 *   } catch (RemoteExecutionException e) {
 *       log.error(e.getTechnicalMessage());
 *   }
 * </pre>
 */
public class RemoteExecutionException extends OracleBridgeException {

    private final String failedSQL;

    /**
     * Creates a remote execution exception.
     *
     * @param message the error message
     * @param sql the SQL that failed to execute
     */
    public RemoteExecutionException(String message, String sql) {
        super(ErrorKind.REMOTE_EXECUTION, message);
        this.failedSQL = sql;
    }

    /**
     * Creates a remote execution exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute
     */
    public RemoteExecutionException(String message, Throwable cause, String sql) {
        super(ErrorKind.REMOTE_EXECUTION, message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Remote Execution Failed\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (failedSQL != null) {
            sb.append("Failed SQL:\n").append(failedSQL).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getClass().getName()).append("\n");
            sb.append("Cause Message: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }
}
