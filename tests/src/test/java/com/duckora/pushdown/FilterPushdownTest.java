package com.duckora.pushdown;

import com.duckora.expression.BinaryExpression;
import com.duckora.expression.BoundColumnRef;
import com.duckora.expression.Expression;
import com.duckora.expression.FunctionCall;
import com.duckora.expression.InExpression;
import com.duckora.expression.LikeExpression;
import com.duckora.expression.Literal;
import com.duckora.expression.UnaryExpression;
import com.duckora.scan.ScanBindData;
import com.duckora.test.TestBase;
import com.duckora.test.TestCategories;
import com.duckora.types.ColumnInfo;
import com.duckora.types.DataType;
import com.duckora.types.DecimalType;
import com.duckora.types.IntegerType;
import com.duckora.types.ShortType;
import com.duckora.types.StringType;
import com.duckora.types.TimestampType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for translating engine filters to remote predicates.
 */
@TestCategories.Tier1
@TestCategories.Unit
@TestCategories.Pushdown
@DisplayName("FilterPushdown Tests")
public class FilterPushdownTest extends TestBase {

    private static final List<ColumnInfo> COLUMNS = List.of(
        new ColumnInfo("EMPLOYEE_ID", "NUMBER", 6, 0, 0, false),
        new ColumnInfo("LAST_NAME", "VARCHAR2", 0, ColumnInfo.UNSPECIFIED_SCALE, 25, false),
        new ColumnInfo("SALARY", "NUMBER", 8, 2, 0, true),
        new ColumnInfo("DEPARTMENT_ID", "NUMBER", 4, 0, 0, true),
        new ColumnInfo("HIRE_DATE", "DATE", 0, ColumnInfo.UNSPECIFIED_SCALE, 0, true));

    private static final List<DataType> TYPES = List.of(
        IntegerType.get(), StringType.get(), new DecimalType(8, 2), ShortType.get(), TimestampType.get());

    private static final ScanBindData BIND = ScanBindData.of(null, "HR", "EMPLOYEES", COLUMNS, TYPES, 19, 100);

    private static BoundColumnRef col(int index) {
        return new BoundColumnRef(index, COLUMNS.get(index).name(), TYPES.get(index));
    }

    private static Optional<String> translate(Expression expr) {
        return FilterPushdown.translatePredicate(expr, BIND);
    }

    @Nested
    @DisplayName("Supported predicates")
    class Supported {

        @Test
        void comparison() {
            assertThat(translate(BinaryExpression.equal(col(3), Literal.of(90))))
                .hasValue("(\"DEPARTMENT_ID\" = 90)");
            assertThat(translate(BinaryExpression.notEqual(col(3), Literal.of(90))))
                .hasValue("(\"DEPARTMENT_ID\" <> 90)");
            assertThat(translate(BinaryExpression.greaterThanOrEqual(col(2), Literal.of(new BigDecimal("1000.50")))))
                .hasValue("(\"SALARY\" >= 1000.50)");
            assertThat(translate(BinaryExpression.lessThan(Literal.of(5), col(0))))
                .hasValue("(5 < \"EMPLOYEE_ID\")");
        }

        @Test
        void conjunctionAndDisjunction() {
            Expression expr = BinaryExpression.and(
                BinaryExpression.equal(col(3), Literal.of(90)),
                BinaryExpression.or(
                    BinaryExpression.greaterThan(col(2), Literal.of(10000)),
                    UnaryExpression.isNull(col(2))));

            assertThat(translate(expr)).hasValue(
                "((\"DEPARTMENT_ID\" = 90) AND ((\"SALARY\" > 10000) OR (\"SALARY\" IS NULL)))");
        }

        @Test
        void notAndNullChecks() {
            assertThat(translate(UnaryExpression.not(BinaryExpression.equal(col(0), Literal.of(1)))))
                .hasValue("(NOT (\"EMPLOYEE_ID\" = 1))");
            assertThat(translate(UnaryExpression.isNotNull(col(3))))
                .hasValue("(\"DEPARTMENT_ID\" IS NOT NULL)");
        }

        @Test
        void likeWithEscape() {
            assertThat(translate(new LikeExpression(col(1), Literal.of("K%"), false)))
                .hasValue("(\"LAST_NAME\" LIKE 'K%')");
            assertThat(translate(new LikeExpression(col(1), Literal.of("O''%"), false)))
                .hasValue("(\"LAST_NAME\" LIKE 'O''''%')");
            assertThat(translate(new LikeExpression(col(1), Literal.of("50!%"), Literal.of("!"), true, false)))
                .hasValue("(\"LAST_NAME\" NOT LIKE '50!%' ESCAPE '!')");
        }

        @Test
        void inList() {
            assertThat(translate(new InExpression(col(3), List.of(Literal.of(60), Literal.of(90)), false)))
                .hasValue("(\"DEPARTMENT_ID\" IN (60, 90))");
            assertThat(translate(new InExpression(col(1), List.of(Literal.of("King")), true)))
                .hasValue("(\"LAST_NAME\" NOT IN ('King'))");
        }

        @Test
        @DisplayName("IN lists up to the remote limit of 1000 items are pushed")
        void inListAtLimit() {
            List<Literal> values = new ArrayList<>();
            for (int i = 0; i < FilterPushdown.MAX_IN_LIST; i++) {
                values.add(Literal.of(i));
            }
            assertThat(translate(new InExpression(col(0), values, false))).isPresent();

            values.add(Literal.of(FilterPushdown.MAX_IN_LIST));
            assertThat(translate(new InExpression(col(0), values, false))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Constants")
    class Constants {

        @Test
        void renderings() {
            assertThat(FilterPushdown.literal(Literal.of(true))).isEqualTo("1");
            assertThat(FilterPushdown.literal(Literal.of(false))).isEqualTo("0");
            assertThat(FilterPushdown.literal(Literal.of(42L))).isEqualTo("42");
            assertThat(FilterPushdown.literal(Literal.of(2.5))).isEqualTo("2.5");
            assertThat(FilterPushdown.literal(Literal.nullOf(IntegerType.get()))).isEqualTo("NULL");
            assertThat(FilterPushdown.literal(Literal.of("it's"))).isEqualTo("'it''s'");
            assertThat(FilterPushdown.literal(Literal.of(new BigDecimal("1E+3")))).isEqualTo("1000");
        }

        @Test
        void dates() {
            assertThat(FilterPushdown.literal(Literal.of(LocalDate.of(2024, 1, 31))))
                .isEqualTo("DATE '2024-01-31'");
            assertThat(FilterPushdown.literal(Literal.of(LocalDateTime.of(2024, 1, 31, 8, 5, 9))))
                .isEqualTo("TIMESTAMP '2024-01-31 08:05:09'");
            assertThat(FilterPushdown.literal(Literal.of(LocalDateTime.of(2024, 1, 31, 8, 5, 9, 120_000_000))))
                .isEqualTo("TIMESTAMP '2024-01-31 08:05:09.120000'");
            assertThat(FilterPushdown.literal(Literal.of(LocalDate.of(1, 1, 1))))
                .isEqualTo("DATE '0001-01-01'");
            assertThat(FilterPushdown.literal(Literal.of(LocalDateTime.of(9999, 12, 31, 23, 59, 59))))
                .isEqualTo("TIMESTAMP '9999-12-31 23:59:59'");
        }

        @Test
        @DisplayName("Dates outside four-digit AD years stay with the engine")
        void datesOutsideLiteralRange() {
            assertThat(FilterPushdown.literal(Literal.of(LocalDate.of(-5, 1, 1)))).isNull();
            assertThat(FilterPushdown.literal(Literal.of(LocalDate.of(0, 6, 1)))).isNull();
            assertThat(FilterPushdown.literal(Literal.of(LocalDateTime.of(0, 6, 1, 0, 0)))).isNull();
            assertThat(FilterPushdown.literal(Literal.of(LocalDate.of(10000, 1, 1)))).isNull();

            Expression bc = BinaryExpression.greaterThan(col(4), Literal.of(LocalDateTime.of(-5, 1, 1, 0, 0)));
            assertThat(translate(bc)).isEmpty();
        }

        @Test
        @DisplayName("Constants without a faithful remote form are not pushed")
        void unrepresentable() {
            assertThat(FilterPushdown.literal(Literal.of(Double.NaN))).isNull();
            assertThat(FilterPushdown.literal(Literal.of(Float.POSITIVE_INFINITY))).isNull();
            assertThat(FilterPushdown.literal(Literal.of(""))).isNull();
        }
    }

    @Nested
    @DisplayName("Unsupported predicates")
    class Unsupported {

        @Test
        void arithmetic() {
            Expression expr = BinaryExpression.equal(BinaryExpression.add(col(0), Literal.of(1)), Literal.of(101));
            assertThat(translate(expr)).isEmpty();
        }

        @Test
        void functions() {
            Expression upper = new FunctionCall("upper", List.of(col(1)), StringType.get());
            assertThat(translate(BinaryExpression.equal(upper, Literal.of("KING")))).isEmpty();
        }

        @Test
        void distinctFromAndIlike() {
            Expression distinct = new BinaryExpression(col(3), BinaryExpression.Operator.DISTINCT_FROM, Literal.of(90));
            assertThat(translate(distinct)).isEmpty();
            assertThat(translate(new LikeExpression(col(1), Literal.of("k%"), null, false, true))).isEmpty();
        }

        @Test
        @DisplayName("A column outside the cached column list fails")
        void columnOutOfRange() {
            Expression expr = BinaryExpression.equal(
                new BoundColumnRef(COLUMNS.size(), "GHOST", IntegerType.get()), Literal.of(1));
            assertThat(translate(expr)).isEmpty();
        }

        @Test
        @DisplayName("A bare column is not a predicate")
        void bareColumn() {
            assertThat(translate(col(0))).isEmpty();
        }

        @Test
        @DisplayName("IN with a non-constant item fails")
        void inWithColumn() {
            assertThat(translate(new InExpression(col(0), List.of(Literal.of(1), col(3)), false))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Top-level pushdown")
    class TopLevel {

        @Test
        @DisplayName("A conjunction with an unsupported child is kept whole by the engine")
        void noPartialConjunction() {
            Expression supported = BinaryExpression.equal(col(3), Literal.of(90));
            Expression unsupported = BinaryExpression.equal(
                BinaryExpression.add(col(0), Literal.of(1)), Literal.of(101));
            Expression conjunction = BinaryExpression.and(supported, unsupported);

            PushdownResult result = FilterPushdown.pushdown(BIND, List.of(conjunction));

            assertThat(result.pushed()).isEmpty();
            assertThat(result.remaining()).containsExactly(conjunction);
            assertThat(result.bindData().filters()).isEmpty();
            assertThat(result.fullyPushed()).isFalse();
        }

        @Test
        @DisplayName("Each top-level filter is pushed or kept on its own")
        void independentFilters() {
            Expression pushed = BinaryExpression.equal(col(3), Literal.of(90));
            Expression kept = BinaryExpression.equal(
                new FunctionCall("length", List.of(col(1)), IntegerType.get()), Literal.of(4));

            PushdownResult result = FilterPushdown.pushdown(BIND, List.of(pushed, kept));

            assertThat(result.pushed()).containsExactly("(\"DEPARTMENT_ID\" = 90)");
            assertThat(result.remaining()).containsExactly(kept);
            assertThat(result.bindData().filters()).containsExactly("(\"DEPARTMENT_ID\" = 90)");
            assertThat(BIND.filters()).isEmpty();
        }

        @Test
        void fullyPushed() {
            PushdownResult result = FilterPushdown.pushdown(BIND, List.of(
                BinaryExpression.equal(col(3), Literal.of(90)),
                BinaryExpression.greaterThan(col(2), Literal.of(1000))));

            assertThat(result.fullyPushed()).isTrue();
            assertThat(SelectQueryBuilder.buildUnpaged(result.bindData()))
                .endsWith("WHERE (\"DEPARTMENT_ID\" = 90) AND (\"SALARY\" > 1000)");
        }
    }
}
