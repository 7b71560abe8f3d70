package com.duckora.pushdown;

import com.duckora.expression.BinaryExpression;
import com.duckora.expression.BoundColumnRef;
import com.duckora.expression.Expression;
import com.duckora.expression.InExpression;
import com.duckora.expression.LikeExpression;
import com.duckora.expression.Literal;
import com.duckora.expression.UnaryExpression;
import com.duckora.scan.ScanBindData;
import com.duckora.util.SQLQuoting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Translates engine filter expressions into Oracle SQL predicates.
 *
 * <p>Translation is all-or-nothing per top-level filter: a filter is either
 * rendered completely and removed from the engine's list, or left untouched
 * for the engine to evaluate. A conjunction containing one untranslatable
 * child is never split, so the remote and the engine never each apply half
 * of a predicate.
 *
 * <p>Translatable nodes:
 * <ul>
 *   <li>column references (by position in the table's column list)</li>
 *   <li>literals: NULL, booleans as 1/0, integers, finite floats, decimals,
 *       non-empty strings, dates and timestamps</li>
 *   <li>comparisons =, &lt;&gt;, &lt;, &lt;=, &gt;, &gt;=</li>
 *   <li>AND, OR, NOT, IS NULL, IS NOT NULL</li>
 *   <li>[NOT] LIKE with an optional escape character</li>
 *   <li>[NOT] IN over at most {@value #MAX_IN_LIST} literals</li>
 * </ul>
 * Everything else (arithmetic, function calls, ILIKE, IS [NOT] DISTINCT FROM)
 * stays with the engine.
 *
 * <p>Example:
 * <pre>
 *   DEPARTMENT_ID = 90 AND upper(LAST_NAME) = 'KING'
 *     → nothing pushed (the function call blocks the whole conjunction)
 *   DEPARTMENT_ID = 90
 *     → ("DEPARTMENT_ID" = 90)
 * </pre>
 */
public final class FilterPushdown {

    private static final Logger logger = LoggerFactory.getLogger(FilterPushdown.class);

    /** Largest IN list the remote accepts. */
    public static final int MAX_IN_LIST = 1000;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

    // ANSI datetime literals on the remote only take four-digit AD years
    private static final int MIN_LITERAL_YEAR = 1;
    private static final int MAX_LITERAL_YEAR = 9999;

    private FilterPushdown() {
    }

    /**
     * Offers filters to the remote.
     *
     * @param bindData the scan's bind data
     * @param filters the engine's top-level filters (implicitly AND-ed)
     * @return the updated bind data and the filters the engine keeps
     */
    public static PushdownResult pushdown(ScanBindData bindData, List<? extends Expression> filters) {
        List<String> pushed = new ArrayList<>();
        List<Expression> remaining = new ArrayList<>();

        for (Expression filter : filters) {
            Optional<String> sql = translatePredicate(filter, bindData);
            if (sql.isPresent()) {
                logger.debug("Pushed filter {} as {}", filter, sql.get());
                pushed.add(sql.get());
            } else {
                logger.debug("Filter {} stays with the engine", filter);
                remaining.add(filter);
            }
        }

        ScanBindData updated = pushed.isEmpty() ? bindData : bindData.withAddedFilters(pushed);
        return new PushdownResult(updated, pushed, remaining);
    }

    /**
     * Translates one boolean expression.
     *
     * @param expr the predicate
     * @param bindData supplies the column names
     * @return the SQL text, or empty if any part is untranslatable
     */
    public static Optional<String> translatePredicate(Expression expr, ScanBindData bindData) {
        return Optional.ofNullable(predicate(expr, bindData.columnNames()));
    }

    // ==================== Predicates ====================

    private static String predicate(Expression expr, List<String> columns) {
        if (expr instanceof BinaryExpression b) {
            return binary(b, columns);
        }
        if (expr instanceof UnaryExpression u) {
            return unary(u, columns);
        }
        if (expr instanceof LikeExpression like) {
            return like(like, columns);
        }
        if (expr instanceof InExpression in) {
            return in(in, columns);
        }
        // bare columns, constants, functions
        return null;
    }

    private static String binary(BinaryExpression b, List<String> columns) {
        BinaryExpression.Operator op = b.operator();

        if (op.isLogical()) {
            String left = predicate(b.left(), columns);
            String right = left == null ? null : predicate(b.right(), columns);
            if (right == null) {
                return null;
            }
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }

        if (op.isComparison()) {
            String left = operand(b.left(), columns);
            String right = left == null ? null : operand(b.right(), columns);
            if (right == null) {
                return null;
            }
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }

        // arithmetic and null-safe comparisons
        return null;
    }

    private static String unary(UnaryExpression u, List<String> columns) {
        switch (u.operator()) {
            case NOT: {
                String inner = predicate(u.operand(), columns);
                return inner == null ? null : "(NOT " + inner + ")";
            }
            case IS_NULL:
            case IS_NOT_NULL: {
                String inner = operand(u.operand(), columns);
                return inner == null ? null : "(" + inner + " " + u.operator().symbol() + ")";
            }
            default:
                return null;
        }
    }

    private static String like(LikeExpression like, List<String> columns) {
        if (like.caseInsensitive()) {
            return null;
        }
        String value = operand(like.value(), columns);
        String pattern = value == null ? null : operand(like.pattern(), columns);
        if (pattern == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder("(").append(value)
            .append(like.negated() ? " NOT LIKE " : " LIKE ").append(pattern);
        if (like.escape() != null) {
            if (!(like.escape() instanceof Literal esc) || !(esc.value() instanceof String s) || s.length() != 1) {
                return null;
            }
            sb.append(" ESCAPE ").append(SQLQuoting.quoteLiteral(s));
        }
        return sb.append(")").toString();
    }

    private static String in(InExpression in, List<String> columns) {
        if (in.values().size() > MAX_IN_LIST) {
            return null;
        }
        String test = operand(in.testExpr(), columns);
        if (test == null) {
            return null;
        }
        StringJoiner list = new StringJoiner(", ", "(", ")");
        for (Expression value : in.values()) {
            if (!(value instanceof Literal literal)) {
                return null;
            }
            String rendered = literal(literal);
            if (rendered == null) {
                return null;
            }
            list.add(rendered);
        }
        return "(" + test + (in.isNegated() ? " NOT IN " : " IN ") + list + ")";
    }

    // ==================== Operands ====================

    private static String operand(Expression expr, List<String> columns) {
        if (expr instanceof BoundColumnRef ref) {
            int index = ref.columnIndex();
            if (index < 0 || index >= columns.size()) {
                return null;
            }
            return SQLQuoting.quoteIdentifier(columns.get(index));
        }
        if (expr instanceof Literal literal) {
            return literal(literal);
        }
        return null;
    }

    /**
     * Renders a constant as an Oracle literal.
     *
     * @param literal the constant
     * @return the SQL text, or null when the value has no faithful remote form
     */
    static String literal(Literal literal) {
        Object value = literal.value();
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Float f) {
            return Float.isFinite(f) ? Float.toString(f) : null;
        }
        if (value instanceof Double d) {
            return Double.isFinite(d) ? Double.toString(d) : null;
        }
        if (value instanceof BigDecimal d) {
            return d.toPlainString();
        }
        if (value instanceof String s) {
            // the remote stores '' as NULL, so comparisons against it do not mean the same thing
            return s.isEmpty() ? null : SQLQuoting.quoteLiteral(s);
        }
        if (value instanceof LocalDate date) {
            return hasLiteralYear(date.getYear()) ? "DATE '" + DATE_FORMAT.format(date) + "'" : null;
        }
        if (value instanceof LocalDateTime ts) {
            return hasLiteralYear(ts.getYear()) ? "TIMESTAMP '" + formatTimestamp(ts) + "'" : null;
        }
        return null;
    }

    private static boolean hasLiteralYear(int year) {
        return year >= MIN_LITERAL_YEAR && year <= MAX_LITERAL_YEAR;
    }

    private static String formatTimestamp(LocalDateTime ts) {
        String base = TIMESTAMP_FORMAT.format(ts);
        int micros = ts.getNano() / 1000;
        if (micros == 0) {
            return base;
        }
        return base + "." + String.format("%06d", micros);
    }
}
