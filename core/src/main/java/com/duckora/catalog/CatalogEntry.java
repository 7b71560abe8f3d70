package com.duckora.catalog;

/**
 * An object exposed through a {@link Catalog}: a schema, table or view.
 */
public interface CatalogEntry {

    /**
     * Returns the entry name as stored by the catalog.
     *
     * @return the name
     */
    String name();

    /**
     * Returns the kind tag of this entry.
     *
     * @return the kind
     */
    EntryKind kind();
}
