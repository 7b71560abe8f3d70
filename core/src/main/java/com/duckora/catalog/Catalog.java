package com.duckora.catalog;

/**
 * An attached database as seen by the engine.
 *
 * <p>Implementations resolve schemas and tables on demand and may cache
 * what they resolve; {@link #clearCache()} discards that cache.
 */
public interface Catalog extends AutoCloseable {

    /**
     * Returns the name the catalog was attached under.
     *
     * @return the attach name
     */
    String name();

    /**
     * Returns the type tag of the catalog, e.g. {@code "oracle"}.
     *
     * @return the catalog type
     */
    String catalogType();

    /**
     * Discards cached metadata so the next lookup reads it again.
     */
    void clearCache();

    /**
     * Detaches the catalog and releases its resources.
     */
    @Override
    void close();
}
