package com.duckora.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attached catalogs by name.
 *
 * <p>Names are compared exactly. Detaching a catalog closes it.
 */
public class CatalogRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CatalogRegistry.class);

    private final ConcurrentHashMap<String, Catalog> catalogs = new ConcurrentHashMap<>();

    /**
     * Registers an attached catalog.
     *
     * @param catalog the catalog
     * @throws IllegalStateException if a catalog with the same name is attached
     */
    public void register(Catalog catalog) {
        Objects.requireNonNull(catalog, "catalog must not be null");
        Catalog previous = catalogs.putIfAbsent(catalog.name(), catalog);
        if (previous != null) {
            throw new IllegalStateException("Catalog already attached: " + catalog.name());
        }
        logger.info("Attached {} catalog '{}'", catalog.catalogType(), catalog.name());
    }

    public Optional<Catalog> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(catalogs.get(name));
    }

    /**
     * Detaches and closes a catalog.
     *
     * @param name the attach name
     * @return true if a catalog was detached
     */
    public boolean detach(String name) {
        Catalog removed = catalogs.remove(name);
        if (removed == null) {
            return false;
        }
        removed.close();
        logger.info("Detached catalog '{}'", name);
        return true;
    }

    public List<String> names() {
        return new ArrayList<>(catalogs.keySet());
    }

    @Override
    public void close() {
        for (String name : names()) {
            detach(name);
        }
    }
}
