package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * External SCIP indexer invocation. {@code {output}} in the arguments is
 * replaced by the artifact path.
 */
@Data
public class ScipProperties {

    public static final String OUTPUT_PLACEHOLDER = "{output}";

    /** Binary name resolved on PATH, or an explicit path. */
    @NotBlank
    private String command = "scip-java";

    private List<String> arguments = new ArrayList<>(List.of("index", "--output", OUTPUT_PLACEHOLDER));

    @NotBlank
    private String outputFile = "index.scip";

    @NotNull
    private Duration timeout = Duration.ofMinutes(10);

    private boolean keepArtifact = false;
}
