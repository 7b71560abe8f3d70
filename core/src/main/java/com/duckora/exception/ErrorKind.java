package com.duckora.exception;

/**
 * Classification of bridge failures.
 */
public enum ErrorKind {
    /** Opening a remote session failed. */
    CONNECTION,
    /** A remote statement failed to prepare, execute or fetch. */
    REMOTE_EXECUTION,
    /** Remote metadata could not be read or interpreted. */
    SCHEMA,
    /** The requested operation is not available against the remote. */
    UNSUPPORTED_OPERATION
}
