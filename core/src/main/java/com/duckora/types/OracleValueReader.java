package com.duckora.types;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Converts one remote cell into the Java value the Arrow batch writer expects
 * for the target engine type.
 *
 * <p>Value classes per engine type:
 * <ul>
 *   <li>SMALLINT → {@code Short}, INTEGER → {@code Integer}, BIGINT → {@code Long}</li>
 *   <li>HUGEINT → {@code BigDecimal} with scale 0</li>
 *   <li>DECIMAL(p,s) → {@code BigDecimal} rescaled to s (HALF_UP)</li>
 *   <li>FLOAT → {@code Float}, DOUBLE → {@code Double}</li>
 *   <li>VARCHAR → {@code String}, BLOB → {@code byte[]}</li>
 *   <li>TIMESTAMP / TIMESTAMP WITH TIME ZONE → {@code Long} epoch microseconds (UTC)</li>
 *   <li>INTERVAL → {@link IntervalValue}</li>
 * </ul>
 * SQL NULL is always returned as {@code null}.
 */
public final class OracleValueReader {

    private OracleValueReader() {
    }

    /**
     * Reads column {@code index} of the current row.
     *
     * @param rs the result set positioned on a row
     * @param index the 1-based column index
     * @param column the remote column metadata
     * @param target the engine type of the column
     * @return the converted value, or null for SQL NULL
     * @throws SQLException if the driver fails to produce the value
     */
    public static Object read(ResultSet rs, int index, ColumnInfo column, DataType target)
            throws SQLException {
        if (target instanceof ShortType || target instanceof IntegerType
                || target instanceof LongType || target instanceof HugeIntType
                || target instanceof DecimalType || target instanceof ByteType) {
            BigDecimal number = rs.getBigDecimal(index);
            return number == null ? null : convertNumber(number, target);
        }
        if (target instanceof FloatType) {
            float f = rs.getFloat(index);
            return rs.wasNull() ? null : f;
        }
        if (target instanceof DoubleType) {
            double d = rs.getDouble(index);
            return rs.wasNull() ? null : d;
        }
        if (target instanceof BooleanType) {
            boolean b = rs.getBoolean(index);
            return rs.wasNull() ? null : b;
        }
        if (target instanceof StringType) {
            if (OracleTypeMapping.isLob(column.typeName())) {
                return readClob(rs.getClob(index));
            }
            return rs.getString(index);
        }
        if (target instanceof BinaryType) {
            if (OracleTypeMapping.isLob(column.typeName())) {
                return readBlob(rs.getBlob(index));
            }
            return rs.getBytes(index);
        }
        if (target instanceof TimestampType) {
            Timestamp ts = rs.getTimestamp(index);
            return ts == null ? null : toEpochMicros(ts.toLocalDateTime());
        }
        if (target instanceof TimestampTZType) {
            OffsetDateTime odt = rs.getObject(index, OffsetDateTime.class);
            return odt == null ? null : toEpochMicros(odt);
        }
        if (target instanceof DateType) {
            java.sql.Date date = rs.getDate(index);
            return date == null ? null : (int) date.toLocalDate().toEpochDay();
        }
        if (target instanceof IntervalType) {
            String text = rs.getString(index);
            return text == null ? null : IntervalValue.parse(text);
        }
        return rs.getString(index);
    }

    /**
     * Converts a remote number to the value class of an exact numeric engine type.
     *
     * @param number the remote value
     * @param target an integral or decimal engine type
     * @return the converted value
     * @throws ArithmeticException if an integral target cannot hold the value
     */
    public static Object convertNumber(BigDecimal number, DataType target) {
        if (target instanceof DecimalType d) {
            return number.setScale(d.scale(), RoundingMode.HALF_UP);
        }
        if (target instanceof HugeIntType) {
            return number.setScale(0, RoundingMode.HALF_UP);
        }
        if (target instanceof ByteType) {
            return number.byteValueExact();
        }
        if (target instanceof ShortType) {
            return number.shortValueExact();
        }
        if (target instanceof IntegerType) {
            return number.intValueExact();
        }
        return number.longValueExact();
    }

    /**
     * Microseconds since the epoch for a naive date-time interpreted as UTC.
     */
    public static long toEpochMicros(LocalDateTime value) {
        long seconds = value.toEpochSecond(ZoneOffset.UTC);
        return Math.addExact(Math.multiplyExact(seconds, 1_000_000L), value.getNano() / 1000L);
    }

    /**
     * Microseconds since the epoch of a zoned value: its local wall time as
     * UTC minus the stored offset.
     */
    public static long toEpochMicros(OffsetDateTime value) {
        long localMicros = toEpochMicros(value.toLocalDateTime());
        long offsetSeconds = value.getOffset().getTotalSeconds();
        return localMicros - offsetSeconds * 1_000_000L;
    }

    private static String readClob(Clob clob) throws SQLException {
        if (clob == null) {
            return null;
        }
        try {
            long length = clob.length();
            if (length == 0) {
                return "";
            }
            return clob.getSubString(1, Math.toIntExact(length));
        } finally {
            clob.free();
        }
    }

    private static byte[] readBlob(Blob blob) throws SQLException {
        if (blob == null) {
            return null;
        }
        try {
            long length = blob.length();
            if (length == 0) {
                return new byte[0];
            }
            return blob.getBytes(1, Math.toIntExact(length));
        } finally {
            blob.free();
        }
    }
}
