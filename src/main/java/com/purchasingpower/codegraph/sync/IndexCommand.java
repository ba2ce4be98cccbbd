package com.purchasingpower.codegraph.sync;

import com.purchasingpower.codegraph.extraction.StrategyType;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Parameters of one indexing run. Blank fields fall back to the configured defaults.
 */
@Data
@Builder
public class IndexCommand {

    private Path projectRoot;
    private String serviceName;
    private String serviceVersion;
    private String repositoryUrl;
    private StrategyType strategy;

    /** Treat every file as dirty. */
    private boolean force;
}
