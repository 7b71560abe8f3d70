package com.duckora.expression;

import com.duckora.types.DataType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Expression representing an engine scalar function call, e.g.
 * {@code upper(name)} or {@code abs(salary)}.
 *
 * <p>Engine function semantics are not assumed to match the remote's, so
 * filters containing a function call are always evaluated by the engine.
 */
public final class FunctionCall implements Expression {

    private final String functionName;
    private final List<Expression> arguments;
    private final DataType dataType;
    private final boolean nullable;

    public FunctionCall(String functionName, List<? extends Expression> arguments,
                        DataType dataType, boolean nullable) {
        this.functionName = Objects.requireNonNull(functionName, "functionName must not be null");
        this.arguments = new ArrayList<>(Objects.requireNonNull(arguments, "arguments must not be null"));
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.nullable = nullable;
    }

    public FunctionCall(String functionName, List<? extends Expression> arguments, DataType dataType) {
        this(functionName, arguments, dataType, true);
    }

    public String functionName() {
        return functionName;
    }

    public List<Expression> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public DataType dataType() {
        return dataType;
    }

    @Override
    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toString() {
        String args = arguments.stream().map(Object::toString).collect(Collectors.joining(", "));
        return functionName + "(" + args + ")";
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FunctionCall that
            && functionName.equals(that.functionName)
            && arguments.equals(that.arguments)
            && dataType.equals(that.dataType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, arguments, dataType);
    }
}
