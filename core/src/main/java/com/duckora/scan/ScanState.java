package com.duckora.scan;

/**
 * Lifecycle of one {@link OracleScan}.
 *
 * <pre>
 *   UNBOUND → BOUND → INITIALIZED → STREAMING → EXHAUSTED
 *                          │            │
 *                          └────────────┴──→ FAILED
 * </pre>
 */
public enum ScanState {
    UNBOUND,
    BOUND,
    INITIALIZED,
    STREAMING,
    EXHAUSTED,
    FAILED
}
