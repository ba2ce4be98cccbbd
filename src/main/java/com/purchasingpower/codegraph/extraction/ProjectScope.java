package com.purchasingpower.codegraph.extraction;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * The project a strategy session extracts from.
 */
@Value
@Builder
public class ProjectScope {

    Path projectRoot;
    String serviceName;
    String serviceVersion;
}
