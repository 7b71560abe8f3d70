package com.duckora.functions;

import com.duckora.catalog.AttachOptions;
import com.duckora.catalog.Catalog;
import com.duckora.catalog.CatalogRegistry;
import com.duckora.catalog.OracleCatalog;
import com.duckora.functions.OracleFunctions.InfoRow;
import com.duckora.test.OracleEmulator;
import com.duckora.test.TestBase;
import com.duckora.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the cache-clearing and info functions.
 */
@TestCategories.Tier2
@TestCategories.Integration
@DisplayName("OracleFunctions Tests")
public class OracleFunctionsTest extends TestBase {

    private OracleEmulator remote;
    private CatalogRegistry registry;
    private OracleCatalog catalog;

    /** A catalog of some other kind, attached under the name "memory". */
    private static final class OtherCatalog implements Catalog {
        int clears = 0;

        @Override
        public String name() {
            return "memory";
        }

        @Override
        public String catalogType() {
            return "duckdb";
        }

        @Override
        public void clearCache() {
            clears++;
        }

        @Override
        public void close() {
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        remote = new OracleEmulator();
        catalog = OracleCatalog.attach("ora", OracleEmulator.hrTarget(), AttachOptions.defaults(),
            new OracleCatalog.Configuration(), remote.opener());
        registry = new CatalogRegistry();
        registry.register(catalog);
    }

    @AfterEach
    void tearDown() throws Exception {
        registry.close();
        remote.close();
    }

    @Test
    @DisplayName("Clearing the cache of an Oracle catalog returns 1 and drops cached entries")
    void clearCache() {
        catalog.getEntry("HR", "EMPLOYEES").orElseThrow();

        assertThat(OracleFunctions.clearCache(registry, "ora")).isEqualTo(1);

        assertThat(catalog.getSchema("HR").isCached("EMPLOYEES")).isFalse();
        assertThat(catalog.pool().idleCount()).isZero();
        assertThat(OracleFunctions.clearCache(registry, "ora")).isEqualTo(1);
    }

    @Test
    void clearCacheUnknownCatalog() {
        assertThat(OracleFunctions.clearCache(registry, "nope")).isZero();
        assertThat(OracleFunctions.clearCache(registry, null)).isZero();
    }

    @Test
    @DisplayName("Catalogs of other kinds are left alone")
    void clearCacheOtherCatalog() {
        OtherCatalog other = new OtherCatalog();
        registry.register(other);

        assertThat(OracleFunctions.clearCache(registry, "memory")).isZero();
        assertThat(other.clears).isZero();
    }

    @Test
    void info() {
        List<InfoRow> rows = OracleFunctions.info(registry, "ora");

        logData("Info", rows);
        assertThat(rows).extracting(InfoRow::key).containsExactly("server_version", "catalog_type");
        assertThat(rows.get(0).value()).isEqualTo(catalog.serverVersion());
        assertThat(rows.get(1).value()).isEqualTo("oracle");
    }

    @Test
    void infoUnknownCatalog() {
        assertThat(OracleFunctions.info(registry, "nope"))
            .singleElement()
            .satisfies(row -> {
                assertThat(row.key()).isEqualTo("error");
                assertThat(row.value()).contains("nope");
            });
    }
}
