package com.duckora.exception;

import java.util.Objects;

/**
 * Base class for all failures raised by the Oracle bridge.
 *
 * <p>Every failure carries an {@link ErrorKind}. Not-found conditions are never
 * reported through this hierarchy; lookups return {@code Optional.empty()}.
 *
 * <p>Messages produced by {@link #remoteMessage(String, String)} follow the
 * form {@code Oracle error in <context>: <driver message>} so that the failing
 * operation and the driver diagnostic are both visible to the user.
 */
public class OracleBridgeException extends RuntimeException {

    private final ErrorKind kind;

    public OracleBridgeException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public OracleBridgeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the failure classification.
     *
     * @return the error kind
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Formats a remote diagnostic with the operation that produced it.
     *
     * @param context the operation name, e.g. {@code "getColumns"}
     * @param driverMessage the driver's diagnostic text (may be null)
     * @return the formatted message
     */
    public static String remoteMessage(String context, String driverMessage) {
        String detail = driverMessage == null ? "unknown error" : driverMessage.trim();
        return "Oracle error in " + context + ": " + detail;
    }
}
