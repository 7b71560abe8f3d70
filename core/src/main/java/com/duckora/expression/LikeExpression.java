package com.duckora.expression;

import com.duckora.types.BooleanType;
import com.duckora.types.DataType;

import java.util.Objects;

/**
 * Expression representing a LIKE or ILIKE predicate with an optional escape.
 *
 * <p>Examples:
 * <pre>
 *   name LIKE '%SMITH'
 *   name NOT LIKE 'A%'
 *   code LIKE '10!%%' ESCAPE '!'
 *   name ILIKE '%smith%'
 * </pre>
 */
public final class LikeExpression implements Expression {

    private final Expression value;
    private final Expression pattern;
    private final Expression escape;
    private final boolean negated;
    private final boolean caseInsensitive;

    public LikeExpression(Expression value, Expression pattern, Expression escape,
                          boolean negated, boolean caseInsensitive) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.escape = escape;
        this.negated = negated;
        this.caseInsensitive = caseInsensitive;
    }

    public LikeExpression(Expression value, Expression pattern, boolean negated) {
        this(value, pattern, null, negated, false);
    }

    public Expression value() {
        return value;
    }

    public Expression pattern() {
        return pattern;
    }

    /**
     * Returns the escape character expression, or null when there is none.
     */
    public Expression escape() {
        return escape;
    }

    public boolean negated() {
        return negated;
    }

    public boolean caseInsensitive() {
        return caseInsensitive;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return value.nullable() || pattern.nullable();
    }

    @Override
    public String toString() {
        String not = negated ? "NOT " : "";
        String op = caseInsensitive ? "ILIKE" : "LIKE";
        String esc = escape == null ? "" : " ESCAPE " + escape;
        return "(%s %s%s %s%s)".formatted(value, not, op, pattern, esc);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof LikeExpression that
            && negated == that.negated
            && caseInsensitive == that.caseInsensitive
            && value.equals(that.value)
            && pattern.equals(that.pattern)
            && Objects.equals(escape, that.escape);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, pattern, escape, negated, caseInsensitive);
    }
}
