package com.duckora.expression;

import com.duckora.types.BooleanType;
import com.duckora.types.DataType;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Membership test {@code x [NOT] IN (v1, v2, ...)} over a non-empty list.
 *
 * <p>Oracle caps literal IN lists at 1000 items; longer lists are kept for
 * the engine to evaluate.
 */
public final class InExpression implements Expression {

    private final Expression testExpr;
    private final List<Expression> values;
    private final boolean negated;

    public InExpression(Expression testExpr, List<? extends Expression> values, boolean negated) {
        this.testExpr = Objects.requireNonNull(testExpr, "testExpr must not be null");
        this.values = List.copyOf(Objects.requireNonNull(values, "values must not be null"));
        if (this.values.isEmpty()) {
            throw new IllegalArgumentException("IN list must have at least one value");
        }
        this.negated = negated;
    }

    public Expression testExpr() {
        return testExpr;
    }

    public List<Expression> values() {
        return values;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return testExpr.nullable() || values.stream().anyMatch(Expression::nullable);
    }

    @Override
    public String toString() {
        StringJoiner list = new StringJoiner(", ", negated ? " NOT IN (" : " IN (", "))");
        values.forEach(v -> list.add(v.toString()));
        return "(" + testExpr + list;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof InExpression that
            && negated == that.negated
            && testExpr.equals(that.testExpr)
            && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(testExpr, values, negated);
    }
}
