package com.duckora.test;

import com.duckora.connection.ConnectionOpener;
import com.duckora.connection.OracleConnectionParameters;
import org.duckdb.DuckDBConnection;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * In-memory stand-in for a remote Oracle database, backed by DuckDB.
 *
 * <p>The Oracle data dictionary ({@code ALL_USERS}, {@code ALL_OBJECTS},
 * {@code ALL_TAB_COLUMNS}, {@code ALL_TABLES}) is provided as views over
 * DuckDB's information schema, with DuckDB types reported under their Oracle
 * names. Sessions handed out by {@link #opener()} share the database and
 * rewrite the Oracle column types in DDL to DuckDB ones. Every statement text
 * the bridge sends is recorded.
 *
 * <p>Fixture data lives in schemas {@code HR} and {@code SALES}.
 */
public class OracleEmulator implements AutoCloseable {

    private static final String[] DICTIONARY = {
        "CREATE VIEW ALL_USERS AS " +
        "SELECT schema_name AS USERNAME FROM information_schema.schemata " +
        "WHERE catalog_name = current_database() " +
        "AND schema_name NOT IN ('main', 'information_schema', 'pg_catalog')",

        "CREATE VIEW ALL_OBJECTS AS " +
        "SELECT table_schema AS OWNER, table_name AS OBJECT_NAME, " +
        "CASE WHEN table_type = 'VIEW' THEN 'VIEW' ELSE 'TABLE' END AS OBJECT_TYPE " +
        "FROM information_schema.tables " +
        "WHERE table_catalog = current_database() AND table_schema <> 'main'",

        "CREATE VIEW ALL_TAB_COLUMNS AS " +
        "SELECT table_schema AS OWNER, table_name AS TABLE_NAME, column_name AS COLUMN_NAME, " +
        "CASE " +
        "  WHEN data_type LIKE 'DECIMAL%' THEN 'NUMBER' " +
        "  WHEN data_type IN ('TINYINT', 'SMALLINT', 'INTEGER', 'BIGINT', 'HUGEINT') THEN 'NUMBER' " +
        "  WHEN data_type = 'VARCHAR' THEN 'VARCHAR2' " +
        "  WHEN data_type = 'DOUBLE' THEN 'BINARY_DOUBLE' " +
        "  WHEN data_type = 'FLOAT' THEN 'BINARY_FLOAT' " +
        "  WHEN data_type = 'TIMESTAMP' THEN 'TIMESTAMP(6)' " +
        "  WHEN data_type = 'TIMESTAMP WITH TIME ZONE' THEN 'TIMESTAMP(6) WITH TIME ZONE' " +
        "  ELSE data_type END AS DATA_TYPE, " +
        "CASE " +
        "  WHEN data_type LIKE 'DECIMAL%' THEN numeric_precision " +
        "  WHEN data_type = 'TINYINT' THEN 3 " +
        "  WHEN data_type = 'SMALLINT' THEN 5 " +
        "  WHEN data_type = 'INTEGER' THEN 10 " +
        "  WHEN data_type = 'BIGINT' THEN 19 " +
        "  WHEN data_type = 'HUGEINT' THEN 38 " +
        "  ELSE NULL END AS DATA_PRECISION, " +
        "CASE " +
        "  WHEN data_type LIKE 'DECIMAL%' THEN numeric_scale " +
        "  WHEN data_type IN ('TINYINT', 'SMALLINT', 'INTEGER', 'BIGINT', 'HUGEINT') THEN 0 " +
        "  ELSE NULL END AS DATA_SCALE, " +
        "CASE WHEN data_type = 'VARCHAR' THEN 4000 ELSE 0 END AS CHAR_LENGTH, " +
        "CASE WHEN is_nullable = 'YES' THEN 'Y' ELSE 'N' END AS NULLABLE, " +
        "ordinal_position AS COLUMN_ID " +
        "FROM information_schema.columns " +
        "WHERE table_catalog = current_database() AND table_schema <> 'main'",

        "CREATE TABLE ALL_TABLES (OWNER VARCHAR, TABLE_NAME VARCHAR, NUM_ROWS BIGINT)"
    };

    private static final String[] FIXTURES = {
        "CREATE SCHEMA \"HR\"",
        "CREATE SCHEMA \"SALES\"",

        "CREATE TABLE \"HR\".\"EMPLOYEES\" (" +
        "\"EMPLOYEE_ID\" DECIMAL(6,0) NOT NULL, " +
        "\"FIRST_NAME\" VARCHAR, " +
        "\"LAST_NAME\" VARCHAR NOT NULL, " +
        "\"SALARY\" DECIMAL(8,2), " +
        "\"DEPARTMENT_ID\" DECIMAL(4,0), " +
        "\"HIRE_DATE\" TIMESTAMP)",

        "INSERT INTO \"HR\".\"EMPLOYEES\" VALUES " +
        "(100, 'Steven', 'King', 24000.00, 90, TIMESTAMP '2003-06-17 00:00:00'), " +
        "(101, 'Neena', 'Kochhar', 17000.00, 90, TIMESTAMP '2005-09-21 00:00:00'), " +
        "(102, 'Lex', 'De Haan', 17000.00, 90, TIMESTAMP '2001-01-13 00:00:00'), " +
        "(103, 'Alexander', 'Hunold', 9000.00, 60, TIMESTAMP '2006-01-03 00:00:00'), " +
        "(104, 'Bruce', 'Ernst', 6000.00, 60, TIMESTAMP '2007-05-21 00:00:00'), " +
        "(107, 'Diana', 'Lorentz', 4200.00, 60, TIMESTAMP '2007-02-07 00:00:00'), " +
        "(178, 'Kimberely', 'Grant', 7000.00, NULL, TIMESTAMP '2007-05-24 00:00:00'), " +
        "(205, NULL, 'Higgins', 12008.00, 110, TIMESTAMP '2002-06-07 12:30:00')",

        "CREATE VIEW \"HR\".\"IT_STAFF\" AS " +
        "SELECT \"EMPLOYEE_ID\", \"LAST_NAME\" FROM \"HR\".\"EMPLOYEES\" WHERE \"DEPARTMENT_ID\" = 60",

        "CREATE TABLE \"HR\".\"NUMBERS\" AS SELECT CAST(range AS DECIMAL(9,0)) AS \"N\" FROM range(5000)",

        "CREATE TABLE \"SALES\".\"ORDERS\" (" +
        "\"ORDER_ID\" DECIMAL(12,0) NOT NULL, " +
        "\"AMOUNT\" DOUBLE, " +
        "\"NOTE\" VARCHAR)",

        "INSERT INTO \"SALES\".\"ORDERS\" VALUES (1, 10.5, 'first'), (2, 99.95, NULL)",

        "INSERT INTO ALL_TABLES VALUES ('HR', 'EMPLOYEES', 8), ('SALES', 'ORDERS', NULL)"
    };

    private static final Pattern NUMBER_SCALED = Pattern.compile("NUMBER\\((\\d+),(\\d+)\\)");
    private static final Pattern NUMBER_PRECISION = Pattern.compile("NUMBER\\((\\d+)\\)");
    private static final Pattern VARCHAR2 = Pattern.compile("N?VARCHAR2\\(\\d+\\)");
    private static final Pattern INTERVAL_DS = Pattern.compile("INTERVAL DAY\\(\\d+\\) TO SECOND\\(\\d+\\)");

    private final DuckDBConnection root;
    private final List<String> statements = new CopyOnWriteArrayList<>();
    private final AtomicInteger opened = new AtomicInteger();
    private final AtomicInteger closed = new AtomicInteger();
    private volatile boolean refuseConnections = false;
    private volatile boolean breakSessionSetup = false;

    public OracleEmulator() throws SQLException {
        this.root = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:");
        try (Statement stmt = root.createStatement()) {
            for (String sql : DICTIONARY) {
                stmt.execute(sql);
            }
            for (String sql : FIXTURES) {
                stmt.execute(sql);
            }
        }
    }

    /**
     * Returns a session source backed by this database.
     */
    public ConnectionOpener opener() {
        return this::open;
    }

    /**
     * Connection parameters for the HR user.
     */
    public static OracleConnectionParameters hrParams() {
        return OracleConnectionParameters.builder()
            .host("emulator")
            .serviceName("FREEPDB1")
            .user("hr")
            .password("hr")
            .build();
    }

    /**
     * Attach target matching {@link #hrParams()}.
     */
    public static String hrTarget() {
        return "//emulator:1521/FREEPDB1 user=hr password=hr";
    }

    private Connection open(OracleConnectionParameters params) throws SQLException {
        if (refuseConnections) {
            throw new SQLException("ORA-12541: TNS:no listener");
        }
        opened.incrementAndGet();
        return shim(root.duplicate(), breakSessionSetup);
    }

    /**
     * Makes later opens fail the way an unreachable listener does.
     */
    public void refuseConnections(boolean refuse) {
        this.refuseConnections = refuse;
    }

    /**
     * Makes later sessions come up outside autocommit and reject switching it on.
     */
    public void breakSessionSetup(boolean broken) {
        this.breakSessionSetup = broken;
    }

    public int openedSessions() {
        return opened.get();
    }

    public int closedSessions() {
        return closed.get();
    }

    /**
     * Returns every statement text sent through emulator sessions, in order.
     */
    public List<String> statements() {
        return new ArrayList<>(statements);
    }

    public void clearStatements() {
        statements.clear();
    }

    /**
     * Runs SQL directly against the backing database, bypassing the recording.
     */
    public void execute(String sql) throws SQLException {
        try (Statement stmt = root.createStatement()) {
            stmt.execute(sql);
        }
    }

    /**
     * Reads a single numeric value directly from the backing database.
     */
    public long queryLong(String sql) throws SQLException {
        try (Statement stmt = root.createStatement();
             java.sql.ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    static String toDuckDbDialect(String sql) {
        String trimmed = sql.stripLeading().toUpperCase();
        if (!trimmed.startsWith("CREATE") && !trimmed.startsWith("DROP")) {
            return sql;
        }
        String out = NUMBER_SCALED.matcher(sql).replaceAll("DECIMAL($1,$2)");
        out = NUMBER_PRECISION.matcher(out).replaceAll("DECIMAL($1,0)");
        out = VARCHAR2.matcher(out).replaceAll("VARCHAR");
        out = INTERVAL_DS.matcher(out).replaceAll("INTERVAL");
        return out.replace("BINARY_DOUBLE", "DOUBLE")
            .replace("BINARY_FLOAT", "FLOAT")
            .replace(" CASCADE CONSTRAINTS", " CASCADE")
            .replace(" PURGE", "");
    }

    private Connection shim(Connection target, boolean brokenSetup) {
        return (Connection) Proxy.newProxyInstance(
            OracleEmulator.class.getClassLoader(),
            new Class<?>[]{Connection.class},
            (proxy, method, args) -> {
                try {
                    switch (method.getName()) {
                        case "getAutoCommit":
                            return brokenSetup ? Boolean.FALSE : method.invoke(target, args);
                        case "setAutoCommit":
                            if (brokenSetup) {
                                throw new SQLException("ORA-03113: end-of-file on communication channel");
                            }
                            return method.invoke(target, args);
                        case "close":
                            closed.incrementAndGet();
                            return method.invoke(target, args);
                        case "createStatement":
                            return statementShim((Statement) method.invoke(target, args));
                        case "prepareStatement":
                            statements.add((String) args[0]);
                            args[0] = toDuckDbDialect((String) args[0]);
                            return (PreparedStatement) method.invoke(target, args);
                        default:
                            return method.invoke(target, args);
                    }
                } catch (InvocationTargetException e) {
                    throw e.getCause();
                }
            });
    }

    private Statement statementShim(Statement target) {
        return (Statement) Proxy.newProxyInstance(
            OracleEmulator.class.getClassLoader(),
            new Class<?>[]{Statement.class},
            (proxy, method, args) -> {
                try {
                    if (method.getName().startsWith("execute") && args != null
                            && args.length > 0 && args[0] instanceof String sql) {
                        statements.add(sql);
                        args[0] = toDuckDbDialect(sql);
                    }
                    return method.invoke(target, args);
                } catch (InvocationTargetException e) {
                    throw e.getCause();
                }
            });
    }

    @Override
    public void close() throws SQLException {
        root.close();
    }
}
