package com.duckora.write;

/**
 * How rows are sent to the remote on insert.
 */
public enum InsertMode {
    /**
     * One execute per row in autocommit mode. Rows inserted before a failing
     * row stay committed.
     */
    ROW_AT_A_TIME,

    /** All rows of a batch sent as one JDBC batch. */
    BATCHED
}
