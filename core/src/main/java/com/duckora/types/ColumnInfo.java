package com.duckora.types;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Remote column metadata as reported by the data dictionary.
 *
 * <p>{@code scale} carries {@link #UNSPECIFIED_SCALE} when the remote reports
 * no scale, which is distinct from a declared scale of 0: {@code NUMBER}
 * without arguments is (precision 0, unspecified scale) while {@code INTEGER}
 * is (precision 0, scale 0).
 *
 * @param name remote column name, upper-cased as stored by the dictionary
 * @param typeName remote type name, e.g. {@code NUMBER}, {@code TIMESTAMP(6)}
 * @param precision numeric precision, 0 when absent
 * @param scale numeric scale, or {@link #UNSPECIFIED_SCALE}
 * @param charLength character length, 0 when absent
 * @param nullable whether the column accepts nulls
 */
public record ColumnInfo(String name, String typeName, int precision, int scale,
                         int charLength, boolean nullable) {

    /** Scale reported for numbers declared without one. */
    public static final int UNSPECIFIED_SCALE = -127;

    public ColumnInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(typeName, "typeName must not be null");
    }

    public boolean hasUnspecifiedScale() {
        return scale == UNSPECIFIED_SCALE;
    }

    /**
     * Describes the columns of an arbitrary query from its result metadata.
     *
     * <p>Type names the Oracle driver reports are kept (with its interval
     * shorthands expanded). Anything else is described from the generic JDBC
     * type code so that the read mapping still finds a sensible engine type.
     *
     * @param md the result set metadata
     * @return the columns in result order
     * @throws SQLException if the metadata cannot be read
     */
    public static List<ColumnInfo> fromResultSetMetaData(ResultSetMetaData md) throws SQLException {
        int count = md.getColumnCount();
        List<ColumnInfo> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            String label = md.getColumnLabel(i);
            boolean nullable = md.isNullable(i) != ResultSetMetaData.columnNoNulls;
            String reported = md.getColumnTypeName(i) == null
                ? "" : md.getColumnTypeName(i).toUpperCase(Locale.ROOT);
            int precision = Math.max(md.getPrecision(i), 0);
            int scale = md.getScale(i);

            if (OracleTypeMapping.isKnownRemoteType(reported)) {
                columns.add(new ColumnInfo(label, reported, precision, scale, 0, nullable));
            } else if ("INTERVALYM".equals(reported)) {
                columns.add(new ColumnInfo(label, "INTERVAL YEAR TO MONTH", 0, 0, 0, nullable));
            } else if ("INTERVALDS".equals(reported)) {
                columns.add(new ColumnInfo(label, "INTERVAL DAY TO SECOND", 0, 0, 0, nullable));
            } else {
                columns.add(fromJdbcType(label, md.getColumnType(i), precision, scale, nullable));
            }
        }
        return columns;
    }

    private static ColumnInfo fromJdbcType(String label, int jdbcType, int precision, int scale,
                                           boolean nullable) {
        switch (jdbcType) {
            case Types.BOOLEAN:
            case Types.BIT:
                return new ColumnInfo(label, "NUMBER", 1, 0, 0, nullable);
            case Types.TINYINT:
            case Types.SMALLINT:
                return new ColumnInfo(label, "NUMBER", 4, 0, 0, nullable);
            case Types.INTEGER:
                return new ColumnInfo(label, "NUMBER", 9, 0, 0, nullable);
            case Types.BIGINT:
                return new ColumnInfo(label, "NUMBER", 18, 0, 0, nullable);
            case Types.DECIMAL:
            case Types.NUMERIC:
                return new ColumnInfo(label, "NUMBER", precision, scale, 0, nullable);
            case Types.REAL:
                return new ColumnInfo(label, "BINARY_FLOAT", 0, UNSPECIFIED_SCALE, 0, nullable);
            case Types.FLOAT:
            case Types.DOUBLE:
                return new ColumnInfo(label, "BINARY_DOUBLE", 0, UNSPECIFIED_SCALE, 0, nullable);
            case Types.DATE:
                return new ColumnInfo(label, "DATE", 0, 0, 0, nullable);
            case Types.TIMESTAMP:
                return new ColumnInfo(label, "TIMESTAMP", 0, 0, 0, nullable);
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return new ColumnInfo(label, "TIMESTAMP WITH TIME ZONE", 0, 0, 0, nullable);
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
                return new ColumnInfo(label, "RAW", 0, 0, 0, nullable);
            case Types.BLOB:
                return new ColumnInfo(label, "BLOB", 0, 0, 0, nullable);
            case Types.CLOB:
            case Types.NCLOB:
                return new ColumnInfo(label, "CLOB", 0, 0, 0, nullable);
            default:
                return new ColumnInfo(label, "VARCHAR2", 0, 0, 0, nullable);
        }
    }
}
