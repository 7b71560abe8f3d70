package com.duckora.exception;

/**
 * Raised when a remote session cannot be opened.
 */
public class ConnectionException extends OracleBridgeException {

    public ConnectionException(String message) {
        super(ErrorKind.CONNECTION, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION, message, cause);
    }
}
