package com.duckora.connection;

import java.util.Objects;

/**
 * One row of a remote table listing.
 *
 * @param schema the owning schema
 * @param name the table or view name
 * @param isView true for views
 */
public record TableInfo(String schema, String name, boolean isView) {

    public TableInfo {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }
}
