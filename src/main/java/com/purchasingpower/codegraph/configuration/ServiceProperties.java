package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Defaults for the Service node when a request does not name them.
 */
@Data
public class ServiceProperties {

    @NotBlank
    private String name = "default-service";

    @NotBlank
    private String language = "java";

    @NotBlank
    private String version = "0.0.0";

    /** Falls back to the git {@code origin} remote when blank. */
    private String repositoryUrl;
}
