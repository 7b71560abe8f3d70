package com.duckora.catalog;

import com.duckora.connection.ConnectionOpener;
import com.duckora.connection.ConnectionStringParser;
import com.duckora.connection.OracleConnection;
import com.duckora.connection.OracleConnectionParameters;
import com.duckora.connection.OracleConnectionPool;
import com.duckora.connection.PooledConnection;
import com.duckora.scan.StreamingConfig;
import com.duckora.util.SQLQuoting;
import com.duckora.write.InsertMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * An attached Oracle database projected into the engine's catalog model.
 *
 * <p>Schemas are created lazily and without remote metadata on first lookup;
 * tables are loaded from the data dictionary on first lookup and cached
 * until {@link #clearCache()}. Staleness is only ever resolved by an explicit
 * cache clear.
 *
 * <p>Example usage:
 * <pre>
 *   OracleCatalog catalog = OracleCatalog.attach("ora",
 *       "host=db port=1521 service=ORCL user=hr password=secret",
 *       AttachOptions.defaults());
 *
 *   Optional&lt;OracleTableEntry&gt; employees = catalog.getEntry("HR", "EMPLOYEES");
 *   catalog.close();
 * </pre>
 *
 * @see OracleSchemaEntry
 * @see OracleTableEntry
 */
public class OracleCatalog implements Catalog {

    private static final Logger logger = LoggerFactory.getLogger(OracleCatalog.class);

    public static final String CATALOG_TYPE = "oracle";

    private final String name;
    private final OracleConnectionParameters params;
    private final OracleConnectionPool pool;
    private final Configuration config;
    private final ConcurrentHashMap<String, OracleSchemaEntry> schemas = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private volatile int majorVersion;

    OracleCatalog(String name, OracleConnectionParameters params, OracleConnectionPool pool,
                  Configuration config, int majorVersion) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.params = Objects.requireNonNull(params, "params must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.majorVersion = majorVersion;
    }

    /**
     * Attaches through the Oracle thin driver with the default configuration.
     */
    public static OracleCatalog attach(String name, String target, AttachOptions options) {
        return attach(name, target, options, new Configuration(), ConnectionOpener.oracleThin());
    }

    /**
     * Attaches a remote database.
     *
     * <p>Parses the target, applies the options, opens one session to verify
     * connectivity and read the server version, hands that session to the
     * pool and preloads the default schema entry.
     *
     * @param name the attach name
     * @param target the attach target (key/value, easy-connect or alias form)
     * @param options attach options layered over the target
     * @param config pool, batch and insert settings
     * @param opener the session source
     * @return the attached catalog
     * @throws IllegalArgumentException if the target is malformed
     * @throws com.duckora.exception.ConnectionException if the remote cannot be reached
     */
    public static OracleCatalog attach(String name, String target, AttachOptions options,
                                       Configuration config, ConnectionOpener opener) {
        Objects.requireNonNull(options, "options must not be null");
        OracleConnectionParameters params = applyOptions(ConnectionStringParser.parse(target), options);

        OracleConnectionPool pool = new OracleConnectionPool(params, opener, config.poolSize);
        OracleConnection probe;
        try {
            probe = pool.acquire();
        } catch (RuntimeException e) {
            pool.close();
            throw e;
        }
        int major = probe.getServerMajorVersion();
        pool.release(probe);

        OracleCatalog catalog = new OracleCatalog(name, params, pool, config, major);
        catalog.preloadDefaultSchema();
        logger.info("Attached Oracle catalog '{}' ({}, server major version {})", name, params, major);
        return catalog;
    }

    static OracleConnectionParameters applyOptions(OracleConnectionParameters params, AttachOptions options) {
        OracleConnectionParameters.Builder builder = params.toBuilder();
        if (options.readOnly()) {
            builder.readOnly(true);
        }
        if (options.schema() != null && !options.schema().isBlank()) {
            builder.schema(options.schema());
        }
        if (options.fetchSize() != null) {
            builder.fetchSize(options.fetchSize());
        }
        return builder.build();
    }

    // ==================== Lookups ====================

    /**
     * Resolves a schema, creating its (metadata-free) entry on first use.
     *
     * <p>No remote call is made; a schema that does not exist remotely simply
     * has no tables.
     *
     * @param schemaName the schema name, in any case
     * @return the schema entry
     */
    public OracleSchemaEntry getSchema(String schemaName) {
        String upper = SQLQuoting.toUpper(Objects.requireNonNull(schemaName, "schemaName must not be null"));
        OracleSchemaEntry cached = schemas.get(upper);
        if (cached != null) {
            return cached;
        }
        lock.lock();
        try {
            OracleSchemaEntry existing = schemas.get(upper);
            if (existing != null) {
                return existing;
            }
            OracleSchemaEntry entry = new OracleSchemaEntry(this, upper);
            schemas.put(upper, entry);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the schema entry for the effective default schema.
     */
    public OracleSchemaEntry getDefaultSchema() {
        return getSchema(params.effectiveSchema());
    }

    /**
     * Lists the remote schemas, resolving each one through {@link #getSchema(String)}.
     *
     * @param callback receives each schema entry
     * @throws com.duckora.exception.SchemaException if the listing fails
     */
    public void scanSchemas(Consumer<OracleSchemaEntry> callback) {
        List<String> names;
        try (PooledConnection pooled = pool.borrow()) {
            names = pooled.get().getSchemas();
        }
        for (String schemaName : names) {
            callback.accept(getSchema(schemaName));
        }
    }

    /**
     * Convenience over {@link #scanSchemas(Consumer)}.
     */
    public List<OracleSchemaEntry> listSchemas() {
        List<OracleSchemaEntry> result = new ArrayList<>();
        scanSchemas(result::add);
        return result;
    }

    /**
     * Resolves a table or view.
     *
     * @param schemaName the schema
     * @param tableName the table
     * @return the table entry, or empty if it does not exist remotely
     */
    public Optional<OracleTableEntry> getEntry(String schemaName, String tableName) {
        return getSchema(schemaName).getOrLoadTable(tableName);
    }

    // ==================== Cache ====================

    /**
     * Discards every cached schema and table, closes the idle sessions and
     * re-primes the default schema. Safe to call repeatedly.
     */
    @Override
    public void clearCache() {
        lock.lock();
        try {
            schemas.clear();
        } finally {
            lock.unlock();
        }
        pool.clearCache();
        preloadDefaultSchema();
        logger.info("Cleared metadata cache of catalog '{}'", name);
    }

    /**
     * Returns the names of the schemas currently cached.
     */
    public List<String> cachedSchemaNames() {
        return new ArrayList<>(schemas.keySet());
    }

    private void preloadDefaultSchema() {
        String schema = params.effectiveSchema();
        if (!schema.isEmpty()) {
            getSchema(schema);
        }
    }

    // ==================== Accessors ====================

    @Override
    public String name() {
        return name;
    }

    @Override
    public String catalogType() {
        return CATALOG_TYPE;
    }

    public OracleConnectionParameters params() {
        return params;
    }

    public OracleConnectionPool pool() {
        return pool;
    }

    public Configuration configuration() {
        return config;
    }

    public boolean isReadOnly() {
        return params.readOnly();
    }

    /**
     * Returns the remote major version read at attach time.
     */
    public int majorVersion() {
        return majorVersion;
    }

    /**
     * Reads the remote server version.
     *
     * @return the version string, or {@code unknown: <reason>}
     */
    public String serverVersion() {
        try (PooledConnection pooled = pool.borrow()) {
            return pooled.get().getServerVersion();
        }
    }

    @Override
    public void close() {
        pool.close();
        logger.debug("Closed catalog '{}'", name);
    }

    /**
     * Settings of an attached catalog.
     */
    public static class Configuration {
        /** Maximum number of idle remote sessions kept */
        public int poolSize = OracleConnectionPool.DEFAULT_MAX_IDLE;

        /** Rows per scan batch */
        public int batchSize = StreamingConfig.DEFAULT_BATCH_SIZE;

        /** How table writes reach the remote */
        public InsertMode insertMode = InsertMode.ROW_AT_A_TIME;

        /**
         * Sets the maximum number of idle sessions.
         *
         * @param size the pool size
         * @return this configuration
         */
        public Configuration withPoolSize(int size) {
            if (size <= 0) {
                throw new IllegalArgumentException("poolSize must be positive");
            }
            this.poolSize = size;
            return this;
        }

        /**
         * Sets the scan batch size.
         *
         * @param size rows per batch, normalized by {@link StreamingConfig}
         * @return this configuration
         */
        public Configuration withBatchSize(int size) {
            this.batchSize = StreamingConfig.normalizeBatchSize(size);
            return this;
        }

        /**
         * Sets how table writes reach the remote.
         *
         * @param mode the insert mode
         * @return this configuration
         */
        public Configuration withInsertMode(InsertMode mode) {
            this.insertMode = Objects.requireNonNull(mode, "mode must not be null");
            return this;
        }
    }
}
