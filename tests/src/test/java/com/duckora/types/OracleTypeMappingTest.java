package com.duckora.types;

import com.duckora.test.TestBase;
import com.duckora.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the remote to engine type mapping and back.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.TypeMapping
@DisplayName("OracleTypeMapping Tests")
public class OracleTypeMappingTest extends TestBase {

    private static ColumnInfo column(String type, int precision, int scale) {
        return new ColumnInfo("C", type, precision, scale, 0, true);
    }

    // ==================== NUMBER ====================

    @Nested
    @DisplayName("NUMBER(p,s) mapping")
    class NumberMapping {

        @ParameterizedTest(name = "NUMBER({0},0) -> {1}")
        @CsvSource({
            "1, smallint",
            "4, smallint",
            "5, integer",
            "9, integer",
            "10, bigint",
            "18, bigint",
            "19, hugeint",
            "38, hugeint"
        })
        @DisplayName("Integer widths follow the digit count")
        void integerBoundaries(int precision, String expected) {
            DataType type = OracleTypeMapping.toEngineType(column("NUMBER", precision, 0));
            assertThat(type.typeName()).isEqualTo(expected);
        }

        @Test
        @DisplayName("NUMBER without precision or scale is DOUBLE")
        void floatingNumber() {
            assertThat(OracleTypeMapping.toEngineType(column("NUMBER", 0, ColumnInfo.UNSPECIFIED_SCALE)))
                .isEqualTo(DoubleType.get());
        }

        @Test
        @DisplayName("NUMBER(*,0) is HUGEINT")
        void integerWithoutPrecision() {
            assertThat(OracleTypeMapping.toEngineType(column("NUMBER", 0, 0)))
                .isEqualTo(HugeIntType.get());
        }

        @Test
        @DisplayName("Precision with unspecified scale is treated as scale 0")
        void unspecifiedScaleWithPrecision() {
            assertThat(OracleTypeMapping.toEngineType(column("NUMBER", 9, ColumnInfo.UNSPECIFIED_SCALE)))
                .isEqualTo(IntegerType.get());
        }

        @Test
        @DisplayName("NUMBER(10,2) is DECIMAL(10,2)")
        void decimal() {
            DataType type = OracleTypeMapping.toEngineType(column("NUMBER", 10, 2));
            assertThat(type).isEqualTo(new DecimalType(10, 2));
            assertThat(type.typeName()).isEqualTo("decimal(10,2)");
        }

        @ParameterizedTest(name = "NUMBER({0},{1}) -> double")
        @CsvSource({"5, -2", "3, 5", "0, 2"})
        @DisplayName("Negative scale, scale above precision or missing precision fall back to DOUBLE")
        void fallbackToDouble(int precision, int scale) {
            assertThat(OracleTypeMapping.toEngineType(column("NUMBER", precision, scale)))
                .isEqualTo(DoubleType.get());
        }
    }

    // ==================== Other types ====================

    @Nested
    @DisplayName("Non-numeric mapping")
    class OtherTypes {

        @ParameterizedTest(name = "{0} -> varchar")
        @ValueSource(strings = {"VARCHAR2", "NVARCHAR2", "CHAR", "NCHAR", "ROWID", "UROWID",
            "CLOB", "NCLOB", "LONG", "XMLTYPE", "SDO_GEOMETRY"})
        @DisplayName("Character, row id and unknown types map to VARCHAR")
        void characterTypes(String type) {
            assertThat(OracleTypeMapping.toEngineType(column(type, 0, 0))).isEqualTo(StringType.get());
        }

        @ParameterizedTest(name = "{0} -> timestamp")
        @ValueSource(strings = {"DATE", "TIMESTAMP(6)", "timestamp(9) with local time zone", "TIMESTAMP"})
        @DisplayName("DATE and local timestamps map to TIMESTAMP")
        void timestamps(String type) {
            assertThat(OracleTypeMapping.toEngineType(column(type, 0, 0))).isEqualTo(TimestampType.get());
        }

        @Test
        @DisplayName("TIMESTAMP WITH TIME ZONE keeps its zone")
        void zonedTimestamp() {
            assertThat(OracleTypeMapping.toEngineType(column("TIMESTAMP(6) WITH TIME ZONE", 0, 6)))
                .isEqualTo(TimestampTZType.get());
        }

        @ParameterizedTest(name = "{0} -> blob")
        @ValueSource(strings = {"BLOB", "RAW", "LONG RAW"})
        void binaryTypes(String type) {
            assertThat(OracleTypeMapping.toEngineType(column(type, 0, 0))).isEqualTo(BinaryType.get());
        }

        @Test
        void floatingTypes() {
            assertThat(OracleTypeMapping.toEngineType(column("BINARY_FLOAT", 0, 0))).isEqualTo(FloatType.get());
            assertThat(OracleTypeMapping.toEngineType(column("BINARY_DOUBLE", 0, 0))).isEqualTo(DoubleType.get());
            assertThat(OracleTypeMapping.toEngineType(column("FLOAT", 126, 0))).isEqualTo(DoubleType.get());
        }

        @ParameterizedTest(name = "{0} -> interval")
        @ValueSource(strings = {"INTERVAL YEAR(2) TO MONTH", "INTERVAL DAY(2) TO SECOND(6)"})
        void intervals(String type) {
            assertThat(OracleTypeMapping.toEngineType(column(type, 0, 0))).isEqualTo(IntervalType.get());
        }

        @Test
        @DisplayName("Only CLOB, NCLOB and BLOB are read through LOB locators")
        void lobDetection() {
            assertThat(OracleTypeMapping.isLob("clob")).isTrue();
            assertThat(OracleTypeMapping.isLob("NCLOB")).isTrue();
            assertThat(OracleTypeMapping.isLob("BLOB")).isTrue();
            assertThat(OracleTypeMapping.isLob("RAW")).isFalse();
            assertThat(OracleTypeMapping.isLob("VARCHAR2")).isFalse();
        }
    }

    // ==================== Write mapping ====================

    @Nested
    @DisplayName("Engine to Oracle DDL types")
    class WriteMapping {

        @Test
        void integralTypes() {
            assertThat(OracleTypeMapping.toOracleType(BooleanType.get())).isEqualTo("NUMBER(1)");
            assertThat(OracleTypeMapping.toOracleType(ByteType.get())).isEqualTo("NUMBER(3)");
            assertThat(OracleTypeMapping.toOracleType(ShortType.get())).isEqualTo("NUMBER(5)");
            assertThat(OracleTypeMapping.toOracleType(IntegerType.get())).isEqualTo("NUMBER(10)");
            assertThat(OracleTypeMapping.toOracleType(LongType.get())).isEqualTo("NUMBER(19)");
            assertThat(OracleTypeMapping.toOracleType(HugeIntType.get())).isEqualTo("NUMBER(38)");
        }

        @Test
        void otherTypes() {
            assertThat(OracleTypeMapping.toOracleType(FloatType.get())).isEqualTo("BINARY_FLOAT");
            assertThat(OracleTypeMapping.toOracleType(DoubleType.get())).isEqualTo("BINARY_DOUBLE");
            assertThat(OracleTypeMapping.toOracleType(new DecimalType(12, 3))).isEqualTo("NUMBER(12,3)");
            assertThat(OracleTypeMapping.toOracleType(StringType.get())).isEqualTo("VARCHAR2(4000)");
            assertThat(OracleTypeMapping.toOracleType(BinaryType.get())).isEqualTo("BLOB");
            assertThat(OracleTypeMapping.toOracleType(DateType.get())).isEqualTo("DATE");
            assertThat(OracleTypeMapping.toOracleType(TimestampType.get())).isEqualTo("TIMESTAMP");
            assertThat(OracleTypeMapping.toOracleType(TimestampTZType.get())).isEqualTo("TIMESTAMP WITH TIME ZONE");
            assertThat(OracleTypeMapping.toOracleType(IntervalType.get())).isEqualTo("INTERVAL DAY(9) TO SECOND(9)");
        }

        @Test
        @DisplayName("A decimal survives the round trip through DDL and the dictionary")
        void decimalRoundTrip() {
            DecimalType original = new DecimalType(15, 4);
            String ddl = OracleTypeMapping.toOracleType(original);
            assertThat(OracleTypeMapping.toEngineType(column(ddl, 15, 4))).isEqualTo(original);
        }
    }
}
