package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.extraction.StrategyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Index project request. Only {@code projectRoot} is required.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexRequest {

    private String projectRoot;
    private String serviceName;
    private String serviceVersion;
    private String repositoryUrl;
    private StrategyType strategy;
    private boolean force;
}
