package com.duckora.connection;

import com.duckora.util.SQLQuoting;

import java.util.Objects;

/**
 * Immutable description of how to reach one Oracle database.
 *
 * <p>Exactly one of alias, service name and SID decides the connect target,
 * in that order of precedence: an alias (TNS name) ignores host, port and
 * service; a service name produces the easy-connect form
 * {@code //host:port/service}; a SID produces a full connect descriptor.
 *
 * <p>Example usage:
 * <pre>
 *   OracleConnectionParameters params = OracleConnectionParameters.builder()
 *       .host("db.example.com")
 *       .serviceName("ORCLPDB1")
 *       .user("hr")
 *       .password("secret")
 *       .build();
 *
 *   params.jdbcUrl();          // jdbc:oracle:thin:@//db.example.com:1521/ORCLPDB1
 *   params.effectiveSchema();  // HR
 * </pre>
 */
public final class OracleConnectionParameters {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 1521;
    public static final int DEFAULT_FETCH_SIZE = 10000;

    private final String host;
    private final int port;
    private final String serviceName;
    private final String sid;
    private final String alias;
    private final String user;
    private final String password;
    private final String walletLocation;
    private final String schema;
    private final boolean readOnly;
    private final int fetchSize;

    private OracleConnectionParameters(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.serviceName = builder.serviceName;
        this.sid = builder.sid;
        this.alias = builder.alias;
        this.user = builder.user;
        this.password = builder.password;
        this.walletLocation = builder.walletLocation;
        this.schema = builder.schema;
        this.readOnly = builder.readOnly;
        this.fetchSize = builder.fetchSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String serviceName() {
        return serviceName;
    }

    public String sid() {
        return sid;
    }

    public String alias() {
        return alias;
    }

    public String user() {
        return user;
    }

    public String password() {
        return password;
    }

    public String walletLocation() {
        return walletLocation;
    }

    /**
     * Returns the schema override, or null when the user's own schema is used.
     */
    public String schema() {
        return schema;
    }

    public boolean readOnly() {
        return readOnly;
    }

    public int fetchSize() {
        return fetchSize;
    }

    public boolean hasWallet() {
        return !isBlank(walletLocation);
    }

    /**
     * Returns the schema objects are resolved in when none is named: the
     * override if present, otherwise the user, upper-cased either way.
     *
     * @return the effective schema, or an empty string when neither is set
     */
    public String effectiveSchema() {
        if (!isBlank(schema)) {
            return SQLQuoting.toUpper(schema);
        }
        return user == null ? "" : SQLQuoting.toUpper(user);
    }

    /**
     * Builds the connect target understood by the thin driver after {@code @}.
     *
     * @return the alias, the easy-connect string, or a SID descriptor
     */
    public String connectTarget() {
        if (!isBlank(alias)) {
            return alias;
        }
        if (!isBlank(serviceName)) {
            return "//" + host + ":" + port + "/" + serviceName;
        }
        if (!isBlank(sid)) {
            return "(DESCRIPTION=(ADDRESS=(PROTOCOL=TCP)(HOST=" + host + ")(PORT=" + port + "))"
                + "(CONNECT_DATA=(SID=" + sid + ")))";
        }
        return "//" + host + ":" + port;
    }

    public String jdbcUrl() {
        return "jdbc:oracle:thin:@" + connectTarget();
    }

    // ==================== Copies ====================

    public OracleConnectionParameters withSchema(String schema) {
        return toBuilder().schema(schema).build();
    }

    public OracleConnectionParameters withReadOnly(boolean readOnly) {
        return toBuilder().readOnly(readOnly).build();
    }

    public OracleConnectionParameters withFetchSize(int fetchSize) {
        return toBuilder().fetchSize(fetchSize).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OracleConnectionParameters that)) return false;
        return port == that.port &&
               readOnly == that.readOnly &&
               fetchSize == that.fetchSize &&
               Objects.equals(host, that.host) &&
               Objects.equals(serviceName, that.serviceName) &&
               Objects.equals(sid, that.sid) &&
               Objects.equals(alias, that.alias) &&
               Objects.equals(user, that.user) &&
               Objects.equals(password, that.password) &&
               Objects.equals(walletLocation, that.walletLocation) &&
               Objects.equals(schema, that.schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, serviceName, sid, alias, user, password,
            walletLocation, schema, readOnly, fetchSize);
    }

    // password is never printed
    @Override
    public String toString() {
        return "OracleConnectionParameters{target=" + connectTarget() +
               ", user=" + user +
               ", schema=" + effectiveSchema() +
               ", readOnly=" + readOnly +
               ", fetchSize=" + fetchSize +
               (hasWallet() ? ", wallet=" + walletLocation : "") + "}";
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Builder for {@link OracleConnectionParameters}.
     */
    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String serviceName;
        private String sid;
        private String alias;
        private String user;
        private String password;
        private String walletLocation;
        private String schema;
        private boolean readOnly;
        private int fetchSize = DEFAULT_FETCH_SIZE;

        private Builder() {
        }

        private Builder(OracleConnectionParameters p) {
            this.host = p.host;
            this.port = p.port;
            this.serviceName = p.serviceName;
            this.sid = p.sid;
            this.alias = p.alias;
            this.user = p.user;
            this.password = p.password;
            this.walletLocation = p.walletLocation;
            this.schema = p.schema;
            this.readOnly = p.readOnly;
            this.fetchSize = p.fetchSize;
        }

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host must not be null");
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("port must be between 1 and 65535, got: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder sid(String sid) {
            this.sid = sid;
            return this;
        }

        public Builder alias(String alias) {
            this.alias = alias;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder walletLocation(String walletLocation) {
            this.walletLocation = walletLocation;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder readOnly(boolean readOnly) {
            this.readOnly = readOnly;
            return this;
        }

        public Builder fetchSize(int fetchSize) {
            if (fetchSize <= 0) {
                throw new IllegalArgumentException("fetchSize must be positive, got: " + fetchSize);
            }
            this.fetchSize = fetchSize;
            return this;
        }

        public OracleConnectionParameters build() {
            return new OracleConnectionParameters(this);
        }
    }
}
