package com.duckora.scan;

/**
 * Row count estimate handed to the engine's planner.
 *
 * @param estimatedCardinality expected number of rows
 * @param maxCardinality upper bound on the number of rows
 */
public record NodeStatistics(long estimatedCardinality, long maxCardinality) {

    public static NodeStatistics of(long rows) {
        return new NodeStatistics(rows, rows);
    }
}
