package com.purchasingpower.codegraph.extraction;

/**
 * An extraction algorithm. Implementations are stateless singletons; all
 * per-run state lives in the {@link ExtractionSession} they open.
 */
public interface ExtractionStrategy {

    StrategyType type();

    /**
     * Prepare a run. Environment problems surface here, before the engine writes anything.
     *
     * @throws com.purchasingpower.codegraph.exception.IndexingException if the strategy cannot run at all
     */
    ExtractionSession open(ProjectScope scope);
}
