package com.duckora.types;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps Oracle column types to engine DataTypes and back.
 *
 * <p>The read mapping is total: every remote type name produces an engine type,
 * with unknown names falling back to {@link StringType}. The write mapping
 * used for CREATE TABLE is narrower and lossy on purpose (text is always
 * {@code VARCHAR2(4000)}, integers get fixed precisions), so reading back a
 * table created through the bridge does not always return the original types.
 *
 * <p>Examples:
 * <pre>
 *   NUMBER              → DOUBLE
 *   NUMBER(4)           → SMALLINT
 *   NUMBER(10,0)        → BIGINT
 *   NUMBER(8,2)         → DECIMAL(8,2)
 *   DATE                → TIMESTAMP
 *   TIMESTAMP(6) WITH TIME ZONE → TIMESTAMP WITH TIME ZONE
 * </pre>
 *
 * @see ColumnInfo
 */
public final class OracleTypeMapping {

    // TIMESTAMP(6), INTERVAL DAY(2) TO SECOND(6): precision arguments are irrelevant here
    private static final Pattern TYPE_ARGUMENTS = Pattern.compile("\\(\\s*\\d+\\s*(,\\s*\\d+\\s*)?\\)");

    private OracleTypeMapping() {
    }

    /**
     * Converts remote column metadata to the engine type used for reads.
     *
     * @param column the remote column
     * @return the engine data type, never null
     */
    public static DataType toEngineType(ColumnInfo column) {
        String type = normalize(column.typeName());

        switch (type) {
            case "NUMBER":
                return numberType(column.precision(), column.scale());
            case "FLOAT":
            case "BINARY_DOUBLE":
                return DoubleType.get();
            case "BINARY_FLOAT":
                return FloatType.get();
            case "VARCHAR2":
            case "NVARCHAR2":
            case "VARCHAR":
            case "CHAR":
            case "NCHAR":
            case "ROWID":
            case "UROWID":
            case "CLOB":
            case "NCLOB":
            case "LONG":
                return StringType.get();
            case "DATE":
            case "TIMESTAMP":
            case "TIMESTAMP WITH LOCAL TIME ZONE":
                return TimestampType.get();
            case "TIMESTAMP WITH TIME ZONE":
                return TimestampTZType.get();
            case "BLOB":
            case "RAW":
            case "LONG RAW":
                return BinaryType.get();
            case "INTERVAL YEAR TO MONTH":
            case "INTERVAL DAY TO SECOND":
                return IntervalType.get();
            default:
                return StringType.get();
        }
    }

    /**
     * Applies the NUMBER(p,s) rules.
     *
     * <p>No precision and unspecified scale is a floating NUMBER. Scale 0 (or
     * unspecified) with a known precision picks the narrowest integer holding
     * that many digits. {@code NUMBER(*,0)}, which the dictionary reports as
     * precision 0 with scale 0, can hold 38 digits and maps to HUGEINT.
     */
    static DataType numberType(int precision, int scale) {
        boolean unspecifiedScale = scale == ColumnInfo.UNSPECIFIED_SCALE;
        if (precision == 0 && unspecifiedScale) {
            return DoubleType.get();
        }
        if (scale == 0 || unspecifiedScale) {
            if (precision == 0) return HugeIntType.get();
            if (precision <= 4) return ShortType.get();
            if (precision <= 9) return IntegerType.get();
            if (precision <= 18) return LongType.get();
            if (precision <= 38) return HugeIntType.get();
        }
        if (precision > 0 && precision <= DecimalType.MAX_PRECISION && scale >= 0 && scale <= precision) {
            return new DecimalType(precision, scale);
        }
        return DoubleType.get();
    }

    /**
     * Converts an engine type to the Oracle column type used in CREATE TABLE.
     *
     * @param type the engine type
     * @return the Oracle DDL type string
     */
    public static String toOracleType(DataType type) {
        if (type instanceof BooleanType) return "NUMBER(1)";
        if (type instanceof ByteType) return "NUMBER(3)";
        if (type instanceof ShortType) return "NUMBER(5)";
        if (type instanceof IntegerType) return "NUMBER(10)";
        if (type instanceof LongType) return "NUMBER(19)";
        if (type instanceof HugeIntType) return "NUMBER(38)";
        if (type instanceof FloatType) return "BINARY_FLOAT";
        if (type instanceof DoubleType) return "BINARY_DOUBLE";
        if (type instanceof DecimalType d) {
            return String.format("NUMBER(%d,%d)", d.precision(), d.scale());
        }
        if (type instanceof StringType) return "VARCHAR2(4000)";
        if (type instanceof BinaryType) return "BLOB";
        if (type instanceof DateType) return "DATE";
        if (type instanceof TimestampType) return "TIMESTAMP";
        if (type instanceof TimestampTZType) return "TIMESTAMP WITH TIME ZONE";
        if (type instanceof IntervalType) return "INTERVAL DAY(9) TO SECOND(9)";
        return "VARCHAR2(4000)";
    }

    /**
     * Returns whether the read mapping recognises this remote type name.
     *
     * @param typeName the remote type name, in any case
     * @return true if the name has an explicit mapping
     */
    public static boolean isKnownRemoteType(String typeName) {
        switch (normalize(typeName)) {
            case "NUMBER", "FLOAT", "BINARY_FLOAT", "BINARY_DOUBLE",
                 "VARCHAR2", "NVARCHAR2", "CHAR", "NCHAR", "ROWID", "UROWID",
                 "CLOB", "NCLOB", "LONG", "DATE", "TIMESTAMP",
                 "TIMESTAMP WITH LOCAL TIME ZONE", "TIMESTAMP WITH TIME ZONE",
                 "BLOB", "RAW", "LONG RAW",
                 "INTERVAL YEAR TO MONTH", "INTERVAL DAY TO SECOND":
                return true;
            default:
                return false;
        }
    }

    /**
     * Returns whether values of this remote type are large objects that must
     * be read through a LOB locator.
     */
    public static boolean isLob(String typeName) {
        String type = normalize(typeName);
        return type.equals("CLOB") || type.equals("NCLOB") || type.equals("BLOB");
    }

    /**
     * Upper-cases a remote type name and removes precision arguments, so
     * {@code timestamp(6) with time zone} becomes {@code TIMESTAMP WITH TIME ZONE}.
     */
    static String normalize(String typeName) {
        if (typeName == null) {
            return "";
        }
        String stripped = TYPE_ARGUMENTS.matcher(typeName).replaceAll("");
        return stripped.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }
}
