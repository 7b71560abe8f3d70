package com.duckora.exception;

/**
 * Raised when remote dictionary metadata cannot be read.
 */
public class SchemaException extends OracleBridgeException {

    public SchemaException(String message) {
        super(ErrorKind.SCHEMA, message);
    }

    public SchemaException(String message, Throwable cause) {
        super(ErrorKind.SCHEMA, message, cause);
    }
}
