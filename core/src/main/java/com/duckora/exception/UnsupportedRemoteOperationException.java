package com.duckora.exception;

/**
 * Raised for operations the bridge does not perform against the remote,
 * such as index creation, DDL against a read-only catalog, or writing a
 * vector type that has no remote binding.
 */
public class UnsupportedRemoteOperationException extends OracleBridgeException {

    public UnsupportedRemoteOperationException(String message) {
        super(ErrorKind.UNSUPPORTED_OPERATION, message);
    }
}
