package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Data;

/**
 * Properties of the Service node for one indexed project.
 */
@Data
@Builder
public class ServiceInfo {

    private String name;
    private String language;
    private String version;
    private String repositoryUrl;
    private String lastCommit;
    private String strategy;
}
