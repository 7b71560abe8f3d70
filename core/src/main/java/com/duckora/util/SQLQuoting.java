package com.duckora.util;

import java.util.Locale;

/**
 * Utilities for quoting identifiers and literals in Oracle SQL.
 *
 * <p>Identifiers are always double-quoted, so they are matched case-sensitively
 * by the remote. Callers normalise names with {@link #toUpper(String)} first;
 * the remote dictionary stores unquoted names upper-cased.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifier("EMPLOYEES");        // "EMPLOYEES"
 *   SQLQuoting.quoteQualified("HR", "EMPLOYEES");   // "HR"."EMPLOYEES"
 *   SQLQuoting.quoteLiteral("O'Reilly");            // 'O''Reilly'
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {
    }

    /**
     * Quotes an identifier (schema, table or column name).
     *
     * <p>Embedded double quotes are doubled.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Quotes a schema-qualified object name.
     *
     * @param schema the owning schema
     * @param name the object name
     * @return {@code "SCHEMA"."NAME"}
     */
    public static String quoteQualified(String schema, String name) {
        return quoteIdentifier(schema) + "." + quoteIdentifier(name);
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }
        String escaped = value.replace("'", "''");
        return "'" + escaped + "'";
    }

    /**
     * Upper-cases a remote object name using a locale-independent mapping.
     *
     * @param name the name, may be null
     * @return the upper-cased name, or null
     */
    public static String toUpper(String name) {
        return name == null ? null : name.toUpperCase(Locale.ROOT);
    }
}
