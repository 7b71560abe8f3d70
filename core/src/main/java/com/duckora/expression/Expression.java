package com.duckora.expression;

import com.duckora.types.DataType;

/**
 * Base interface for bound expressions handed to the bridge by the engine.
 *
 * <p>Expressions arrive already bound: column references carry the index of
 * the column in the scanned table's cached column list rather than a name.
 * The bridge only inspects these trees; it never evaluates them. A filter
 * whose tree cannot be rendered as remote SQL is left for the engine.
 *
 * <p>All concrete implementations in this package are {@code final}.
 */
public interface Expression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns whether this expression can produce null values.
     *
     * @return true if nullable, false otherwise
     */
    boolean nullable();
}
