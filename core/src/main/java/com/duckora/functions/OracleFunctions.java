package com.duckora.functions;

import com.duckora.catalog.Catalog;
import com.duckora.catalog.CatalogRegistry;
import com.duckora.catalog.OracleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Diagnostic functions over attached Oracle catalogs.
 *
 * <p>These never throw for a missing or failing catalog; failures become a
 * sentinel result and a log line.
 */
public final class OracleFunctions {

    private static final Logger logger = LoggerFactory.getLogger(OracleFunctions.class);

    /**
     * One key/value row of {@link #info}.
     */
    public record InfoRow(String key, String value) {
    }

    private OracleFunctions() {
    }

    /**
     * Discards the cached metadata and idle sessions of a catalog.
     *
     * @param registry the attached catalogs
     * @param catalogName the attach name
     * @return 1 on success, 0 if there is no such Oracle catalog or clearing failed
     */
    public static int clearCache(CatalogRegistry registry, String catalogName) {
        Optional<OracleCatalog> catalog = oracleCatalog(registry, catalogName);
        if (catalog.isEmpty()) {
            logger.warn("oracle_clear_cache: no Oracle catalog named '{}'", catalogName);
            return 0;
        }
        try {
            catalog.get().clearCache();
            return 1;
        } catch (RuntimeException e) {
            logger.warn("oracle_clear_cache on '{}' failed: {}", catalogName, e.getMessage());
            return 0;
        }
    }

    /**
     * Describes a catalog: its server version and type tag.
     *
     * @param registry the attached catalogs
     * @param catalogName the attach name
     * @return {@code server_version} and {@code catalog_type} rows, or a single
     *         {@code error} row
     */
    public static List<InfoRow> info(CatalogRegistry registry, String catalogName) {
        Optional<OracleCatalog> catalog = oracleCatalog(registry, catalogName);
        if (catalog.isEmpty()) {
            return List.of(new InfoRow("error", "No Oracle catalog named '" + catalogName + "'"));
        }
        try {
            return List.of(
                new InfoRow("server_version", catalog.get().serverVersion()),
                new InfoRow("catalog_type", catalog.get().catalogType()));
        } catch (RuntimeException e) {
            logger.warn("oracle_info on '{}' failed: {}", catalogName, e.getMessage());
            return List.of(new InfoRow("error", e.getMessage()));
        }
    }

    private static Optional<OracleCatalog> oracleCatalog(CatalogRegistry registry, String catalogName) {
        Optional<Catalog> found = registry.get(catalogName);
        if (found.isPresent() && found.get() instanceof OracleCatalog oracle) {
            return Optional.of(oracle);
        }
        return Optional.empty();
    }
}
