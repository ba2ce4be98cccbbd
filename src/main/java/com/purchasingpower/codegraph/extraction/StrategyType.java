package com.purchasingpower.codegraph.extraction;

/**
 * Interchangeable extraction strategies producing the same entity model.
 */
public enum StrategyType {
    /** In-process syntax tree walk with exact positions. */
    NATIVE,
    /** Ingestion of an external SCIP indexer's artifact, best-effort positions. */
    SCIP
}
