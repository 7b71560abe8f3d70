package com.duckora.catalog;

import java.util.List;
import java.util.Objects;

/**
 * A CREATE TABLE request against a schema.
 *
 * @param table the table name
 * @param columns the column definitions, at least one
 * @param ifNotExists return the existing table instead of failing
 */
public record CreateTableInfo(String table, List<ColumnDefinition> columns, boolean ifNotExists) {

    public CreateTableInfo {
        Objects.requireNonNull(table, "table must not be null");
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("a table needs at least one column");
        }
    }

    public CreateTableInfo(String table, List<ColumnDefinition> columns) {
        this(table, columns, false);
    }
}
