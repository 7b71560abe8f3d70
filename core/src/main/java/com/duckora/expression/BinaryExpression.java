package com.duckora.expression;

import com.duckora.types.BooleanType;
import com.duckora.types.DataType;

import java.util.Objects;

/**
 * Two-operand filter node: a comparison, a connective or arithmetic.
 *
 * <p>Only comparisons and AND/OR have an Oracle predicate form. Arithmetic
 * and the null-safe DISTINCT FROM comparisons stay with the engine.
 */
public final class BinaryExpression implements Expression {

    /** How an operator takes part in a predicate. */
    public enum Kind {
        ARITHMETIC,
        COMPARISON,
        NULL_SAFE_COMPARISON,
        CONNECTIVE
    }

    public enum Operator {
        ADD("+", Kind.ARITHMETIC),
        SUBTRACT("-", Kind.ARITHMETIC),
        MULTIPLY("*", Kind.ARITHMETIC),
        DIVIDE("/", Kind.ARITHMETIC),
        MODULO("%", Kind.ARITHMETIC),

        EQUAL("=", Kind.COMPARISON),
        NOT_EQUAL("<>", Kind.COMPARISON),
        LESS_THAN("<", Kind.COMPARISON),
        LESS_THAN_OR_EQUAL("<=", Kind.COMPARISON),
        GREATER_THAN(">", Kind.COMPARISON),
        GREATER_THAN_OR_EQUAL(">=", Kind.COMPARISON),
        DISTINCT_FROM("IS DISTINCT FROM", Kind.NULL_SAFE_COMPARISON),
        NOT_DISTINCT_FROM("IS NOT DISTINCT FROM", Kind.NULL_SAFE_COMPARISON),

        AND("AND", Kind.CONNECTIVE),
        OR("OR", Kind.CONNECTIVE);

        private final String symbol;
        private final Kind kind;

        Operator(String symbol, Kind kind) {
            this.symbol = symbol;
            this.kind = kind;
        }

        /** SQL spelling; for comparisons and connectives it is also Oracle's. */
        public String symbol() {
            return symbol;
        }

        public Kind kind() {
            return kind;
        }

        public boolean isArithmetic() {
            return kind == Kind.ARITHMETIC;
        }

        public boolean isComparison() {
            return kind == Kind.COMPARISON;
        }

        public boolean isDistinctComparison() {
            return kind == Kind.NULL_SAFE_COMPARISON;
        }

        public boolean isLogical() {
            return kind == Kind.CONNECTIVE;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        return operator.isArithmetic() ? left.dataType() : BooleanType.get();
    }

    // DISTINCT FROM compares NULLs as values and so never yields NULL
    @Override
    public boolean nullable() {
        return !operator.isDistinctComparison() && (left.nullable() || right.nullable());
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BinaryExpression that
            && operator == that.operator
            && left.equals(that.left)
            && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    public static BinaryExpression equal(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.EQUAL, right);
    }

    public static BinaryExpression notEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.NOT_EQUAL, right);
    }

    public static BinaryExpression lessThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN, right);
    }

    public static BinaryExpression lessThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.LESS_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression greaterThan(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN, right);
    }

    public static BinaryExpression greaterThanOrEqual(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.GREATER_THAN_OR_EQUAL, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.AND, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.OR, right);
    }

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(left, Operator.ADD, right);
    }
}
