package com.duckora.pushdown;

import com.duckora.expression.Expression;
import com.duckora.scan.ScanBindData;

import java.util.List;

/**
 * Outcome of offering filters to the remote.
 *
 * @param bindData the bind data with the translated fragments appended
 * @param pushed the fragments that were appended, in filter order
 * @param remaining the filters the engine must still apply, in original order
 */
public record PushdownResult(ScanBindData bindData, List<String> pushed, List<Expression> remaining) {

    public PushdownResult {
        pushed = List.copyOf(pushed);
        remaining = List.copyOf(remaining);
    }

    public boolean fullyPushed() {
        return remaining.isEmpty();
    }
}
