package com.duckora.catalog;

/**
 * Kind tag of a catalog entry.
 */
public enum EntryKind {
    SCHEMA,
    TABLE,
    VIEW
}
