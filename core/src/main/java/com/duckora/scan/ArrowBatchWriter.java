package com.duckora.scan;

import com.duckora.types.BinaryType;
import com.duckora.types.BooleanType;
import com.duckora.types.ByteType;
import com.duckora.types.DataType;
import com.duckora.types.DateType;
import com.duckora.types.DecimalType;
import com.duckora.types.DoubleType;
import com.duckora.types.FloatType;
import com.duckora.types.HugeIntType;
import com.duckora.types.IntegerType;
import com.duckora.types.IntervalType;
import com.duckora.types.IntervalValue;
import com.duckora.types.LongType;
import com.duckora.types.ShortType;
import com.duckora.types.StringType;
import com.duckora.types.TimestampTZType;
import com.duckora.types.TimestampType;
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

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Fills a {@link VectorSchemaRoot} from converted remote rows.
 *
 * <p>Row values must use the value classes produced by
 * {@link com.duckora.types.OracleValueReader}; a null leaves the slot unset (null).
 */
public final class ArrowBatchWriter {

    private ArrowBatchWriter() {
    }

    /**
     * Replaces the content of {@code root} with {@code rows}.
     *
     * @param root the batch to fill; its vectors must match {@code types}
     * @param rows the rows, one value per column
     * @param types the engine type of each column
     */
    public static void write(VectorSchemaRoot root, List<Object[]> rows, List<DataType> types) {
        List<FieldVector> vectors = root.getFieldVectors();
        if (vectors.size() != types.size()) {
            throw new IllegalArgumentException("Batch has " + vectors.size()
                + " vectors but " + types.size() + " types were given");
        }

        root.allocateNew();
        for (int col = 0; col < vectors.size(); col++) {
            FieldVector vector = vectors.get(col);
            DataType type = types.get(col);
            for (int row = 0; row < rows.size(); row++) {
                Object value = rows.get(row)[col];
                // freshly allocated slots are already null
                if (value != null) {
                    setValue(vector, row, value, type);
                }
            }
            vector.setValueCount(rows.size());
        }
        root.setRowCount(rows.size());
    }

    static void setValue(FieldVector vector, int row, Object value, DataType type) {
        if (type instanceof BooleanType) {
            ((BitVector) vector).setSafe(row, ((Boolean) value) ? 1 : 0);
        } else if (type instanceof ByteType) {
            ((TinyIntVector) vector).setSafe(row, ((Number) value).byteValue());
        } else if (type instanceof ShortType) {
            ((SmallIntVector) vector).setSafe(row, ((Number) value).shortValue());
        } else if (type instanceof IntegerType) {
            ((IntVector) vector).setSafe(row, ((Number) value).intValue());
        } else if (type instanceof LongType) {
            ((BigIntVector) vector).setSafe(row, ((Number) value).longValue());
        } else if (type instanceof HugeIntType || type instanceof DecimalType) {
            ((DecimalVector) vector).setSafe(row, (BigDecimal) value);
        } else if (type instanceof FloatType) {
            ((Float4Vector) vector).setSafe(row, ((Number) value).floatValue());
        } else if (type instanceof DoubleType) {
            ((Float8Vector) vector).setSafe(row, ((Number) value).doubleValue());
        } else if (type instanceof StringType) {
            ((VarCharVector) vector).setSafe(row, value.toString().getBytes(StandardCharsets.UTF_8));
        } else if (type instanceof BinaryType) {
            ((VarBinaryVector) vector).setSafe(row, (byte[]) value);
        } else if (type instanceof DateType) {
            ((DateDayVector) vector).setSafe(row, ((Number) value).intValue());
        } else if (type instanceof TimestampType) {
            ((TimeStampMicroVector) vector).setSafe(row, ((Number) value).longValue());
        } else if (type instanceof TimestampTZType) {
            ((TimeStampMicroTZVector) vector).setSafe(row, ((Number) value).longValue());
        } else if (type instanceof IntervalType) {
            IntervalValue interval = (IntervalValue) value;
            ((IntervalMonthDayNanoVector) vector).setSafe(row,
                interval.months(), interval.days(), interval.nanos());
        } else {
            throw new IllegalArgumentException("No Arrow vector for type " + type);
        }
    }
}
