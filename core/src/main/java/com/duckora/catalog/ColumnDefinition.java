package com.duckora.catalog;

import com.duckora.types.DataType;

import java.util.Objects;

/**
 * One column of a CREATE TABLE request.
 *
 * @param name the column name (upper-cased when created remotely)
 * @param dataType the engine type, mapped to an Oracle type for the DDL
 * @param nullable false renders NOT NULL
 */
public record ColumnDefinition(String name, DataType dataType, boolean nullable) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    public ColumnDefinition(String name, DataType dataType) {
        this(name, dataType, true);
    }
}
