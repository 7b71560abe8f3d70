package com.duckora.expression;

import com.duckora.types.BooleanType;
import com.duckora.types.DataType;

import java.util.Objects;

/**
 * One-operand filter node: NOT, the null tests, or arithmetic negation.
 */
public final class UnaryExpression implements Expression {

    public enum Operator {
        NEGATE("-", false),
        NOT("NOT", false),
        IS_NULL("IS NULL", true),
        IS_NOT_NULL("IS NOT NULL", true);

        private final String symbol;
        private final boolean postfix;

        Operator(String symbol, boolean postfix) {
            this.symbol = symbol;
            this.postfix = postfix;
        }

        public String symbol() {
            return symbol;
        }

        /** Null tests follow their operand, e.g. {@code x IS NULL}. */
        public boolean isPostfix() {
            return postfix;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        return operator == Operator.NEGATE ? operand.dataType() : BooleanType.get();
    }

    @Override
    public boolean nullable() {
        return !operator.isPostfix() && operand.nullable();
    }

    @Override
    public String toString() {
        return operator.isPostfix()
            ? "(" + operand + " " + operator.symbol() + ")"
            : "(" + operator.symbol() + " " + operand + ")";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof UnaryExpression that
            && operator == that.operator
            && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    public static UnaryExpression negate(Expression operand) {
        return new UnaryExpression(Operator.NEGATE, operand);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }
}
