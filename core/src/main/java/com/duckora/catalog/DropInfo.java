package com.duckora.catalog;

import java.util.Objects;

/**
 * A DROP request against a schema.
 *
 * @param name the table or view name
 * @param kind {@link EntryKind#TABLE} or {@link EntryKind#VIEW}
 * @param ifExists succeed silently when the object does not exist
 * @param cascade also drop referencing constraints (tables only)
 * @param purge bypass the recycle bin (tables only)
 */
public record DropInfo(String name, EntryKind kind, boolean ifExists, boolean cascade, boolean purge) {

    public DropInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == EntryKind.SCHEMA) {
            throw new IllegalArgumentException("schemas cannot be dropped through the bridge");
        }
    }

    public static DropInfo table(String name) {
        return new DropInfo(name, EntryKind.TABLE, false, false, false);
    }

    public static DropInfo tableIfExists(String name) {
        return new DropInfo(name, EntryKind.TABLE, true, false, false);
    }

    public DropInfo withPurge(boolean purge) {
        return new DropInfo(name, kind, ifExists, cascade, purge);
    }

    public DropInfo withCascade(boolean cascade) {
        return new DropInfo(name, kind, ifExists, cascade, purge);
    }
}
