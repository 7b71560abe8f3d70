package com.duckora.write;

import com.duckora.catalog.OracleCatalog;
import com.duckora.catalog.OracleTableEntry;
import com.duckora.connection.PooledConnection;
import com.duckora.exception.SchemaException;
import com.duckora.exception.UnsupportedRemoteOperationException;
import com.duckora.util.SQLQuoting;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.IntervalMonthDayNanoVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampMicroTZVector;
import org.apache.arrow.vector.TimeStampMicroVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.holders.NullableIntervalMonthDayNanoHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Inserts Arrow batches into a remote table.
 *
 * <p>Batch columns are matched to table columns by name (case-insensitive).
 * Every cell is converted to a JDBC value before anything is sent, so an
 * unsupported column type fails the whole batch up front.
 */
public class OracleTableWriter {

    private static final Logger logger = LoggerFactory.getLogger(OracleTableWriter.class);

    private static final long MICROS_PER_SECOND = 1_000_000L;

    private final OracleTableEntry table;
    private final InsertMode mode;

    public OracleTableWriter(OracleTableEntry table) {
        this(table, table.catalog().configuration().insertMode);
    }

    public OracleTableWriter(OracleTableEntry table, InsertMode mode) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public InsertMode mode() {
        return mode;
    }

    /**
     * Inserts every row of the batch.
     *
     * @param batch the rows to insert
     * @return the number of rows inserted
     * @throws UnsupportedRemoteOperationException if the catalog is read-only or a
     *         column has a type that cannot be written
     * @throws SchemaException if a batch column does not exist in the table
     * @throws com.duckora.exception.RemoteExecutionException if the remote rejects a row
     */
    public long insert(VectorSchemaRoot batch) {
        OracleCatalog catalog = table.catalog();
        if (catalog.isReadOnly()) {
            throw new UnsupportedRemoteOperationException("INSERT is not allowed: Oracle catalog '"
                + catalog.name() + "' is attached read-only");
        }

        List<FieldVector> vectors = batch.getFieldVectors();
        List<String> targetColumns = new ArrayList<>(vectors.size());
        int[] sqlTypes = new int[vectors.size()];
        for (int col = 0; col < vectors.size(); col++) {
            FieldVector vector = vectors.get(col);
            String column = SQLQuoting.toUpper(vector.getName());
            if (table.columnIndex(column) < 0) {
                throw new SchemaException("Column " + column + " does not exist in "
                    + table.schema().name() + "." + table.name());
            }
            targetColumns.add(column);
            sqlTypes[col] = sqlType(vector);
        }

        int rowCount = batch.getRowCount();
        List<Object[]> rows = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            Object[] values = new Object[vectors.size()];
            for (int col = 0; col < vectors.size(); col++) {
                values[col] = jdbcValue(vectors.get(col), row);
            }
            rows.add(values);
        }
        if (rows.isEmpty()) {
            return 0;
        }

        String sql = insertSql(table.schema().name(), table.name(), targetColumns);
        long inserted;
        try (PooledConnection pooled = catalog.pool().borrow()) {
            inserted = pooled.get().insert(sql, rows, (ps, values) -> {
                for (int i = 0; i < values.length; i++) {
                    if (values[i] == null) {
                        ps.setNull(i + 1, sqlTypes[i]);
                    } else {
                        ps.setObject(i + 1, values[i]);
                    }
                }
            }, mode == InsertMode.BATCHED);
        }
        logger.debug("Inserted {} rows into {}.{}", inserted, table.schema().name(), table.name());
        return inserted;
    }

    static String insertSql(String schema, String table, List<String> columns) {
        StringJoiner names = new StringJoiner(", ", " (", ")");
        StringJoiner params = new StringJoiner(", ", " VALUES (", ")");
        for (String column : columns) {
            names.add(SQLQuoting.quoteIdentifier(column));
            params.add("?");
        }
        return "INSERT INTO " + SQLQuoting.quoteQualified(schema, table) + names + params;
    }

    static int sqlType(FieldVector vector) {
        if (vector instanceof BitVector || vector instanceof TinyIntVector
                || vector instanceof SmallIntVector || vector instanceof IntVector
                || vector instanceof BigIntVector || vector instanceof DecimalVector) {
            return Types.NUMERIC;
        } else if (vector instanceof Float4Vector) {
            return Types.REAL;
        } else if (vector instanceof Float8Vector) {
            return Types.DOUBLE;
        } else if (vector instanceof VarCharVector) {
            return Types.VARCHAR;
        } else if (vector instanceof VarBinaryVector) {
            return Types.VARBINARY;
        } else if (vector instanceof DateDayVector) {
            return Types.DATE;
        } else if (vector instanceof TimeStampMicroVector) {
            return Types.TIMESTAMP;
        } else if (vector instanceof TimeStampMicroTZVector) {
            return Types.TIMESTAMP_WITH_TIMEZONE;
        } else if (vector instanceof IntervalMonthDayNanoVector) {
            return Types.VARCHAR;
        }
        throw new UnsupportedRemoteOperationException("Cannot write column '" + vector.getName()
            + "' of type " + vector.getField().getType() + " to Oracle");
    }

    /**
     * Reads one cell as a value the driver binds directly.
     */
    static Object jdbcValue(FieldVector vector, int row) {
        if (vector.isNull(row)) {
            return null;
        }
        if (vector instanceof BitVector bits) {
            return bits.get(row) != 0 ? 1 : 0;
        } else if (vector instanceof TinyIntVector tiny) {
            return (short) tiny.get(row);
        } else if (vector instanceof SmallIntVector small) {
            return small.get(row);
        } else if (vector instanceof IntVector ints) {
            return ints.get(row);
        } else if (vector instanceof BigIntVector bigs) {
            return bigs.get(row);
        } else if (vector instanceof DecimalVector decimals) {
            return decimals.getObject(row);
        } else if (vector instanceof Float4Vector floats) {
            return floats.get(row);
        } else if (vector instanceof Float8Vector doubles) {
            return doubles.get(row);
        } else if (vector instanceof VarCharVector chars) {
            return new String(chars.get(row), StandardCharsets.UTF_8);
        } else if (vector instanceof VarBinaryVector binary) {
            return binary.get(row);
        } else if (vector instanceof DateDayVector dates) {
            return LocalDate.ofEpochDay(dates.get(row));
        } else if (vector instanceof TimeStampMicroVector timestamps) {
            return Timestamp.valueOf(toLocalDateTime(timestamps.get(row)));
        } else if (vector instanceof TimeStampMicroTZVector timestamps) {
            return Instant.EPOCH.plus(timestamps.get(row), ChronoUnit.MICROS).atOffset(ZoneOffset.UTC);
        } else if (vector instanceof IntervalMonthDayNanoVector intervals) {
            NullableIntervalMonthDayNanoHolder holder = new NullableIntervalMonthDayNanoHolder();
            intervals.get(row, holder);
            return dayToSecondLiteral(vector.getName(), holder.months, holder.days, holder.nanoseconds);
        }
        // reached only for vectors sqlType() rejected already
        throw new UnsupportedRemoteOperationException("Cannot write column '" + vector.getName() + "' to Oracle");
    }

    static LocalDateTime toLocalDateTime(long epochMicros) {
        long seconds = Math.floorDiv(epochMicros, MICROS_PER_SECOND);
        long micros = Math.floorMod(epochMicros, MICROS_PER_SECOND);
        return LocalDateTime.ofEpochSecond(seconds, (int) (micros * 1000), ZoneOffset.UTC);
    }

    /**
     * Renders an interval as INTERVAL DAY TO SECOND text, e.g. {@code +3 04:05:06.500000}.
     * Month components have no day-to-second equivalent and are rejected.
     */
    static String dayToSecondLiteral(String column, int months, int days, long nanos) {
        if (months != 0) {
            throw new UnsupportedRemoteOperationException("Cannot write interval with a month component to "
                + "INTERVAL DAY TO SECOND column '" + column + "'");
        }
        long totalMicros = Math.addExact(Math.multiplyExact((long) days, 86_400L * MICROS_PER_SECOND), nanos / 1000);
        String sign = totalMicros < 0 ? "-" : "+";
        long abs = Math.abs(totalMicros);
        long d = abs / (86_400L * MICROS_PER_SECOND);
        long rest = abs % (86_400L * MICROS_PER_SECOND);
        long h = rest / (3_600L * MICROS_PER_SECOND);
        rest %= 3_600L * MICROS_PER_SECOND;
        long m = rest / (60L * MICROS_PER_SECOND);
        rest %= 60L * MICROS_PER_SECOND;
        return "%s%d %02d:%02d:%02d.%06d".formatted(sign, d, h, m, rest / MICROS_PER_SECOND, rest % MICROS_PER_SECOND);
    }
}
