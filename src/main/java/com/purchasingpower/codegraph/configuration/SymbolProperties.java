package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Fields of the symbols minted for the indexed service. The defaults match
 * scip-java, which writes {@code semanticdb maven maven/<group>/<artifact> <version> ...}.
 */
@Data
public class SymbolProperties {

    @NotBlank
    @Pattern(regexp = "\\S+", message = "Symbol scheme must not contain spaces")
    private String scheme = "semanticdb";

    @NotBlank
    @Pattern(regexp = "\\S+", message = "Symbol manager must not contain spaces")
    private String manager = "maven";

    /**
     * Package field, e.g. {@code maven/com.example/orders}. Blank means the service name.
     */
    @Pattern(regexp = "\\S*", message = "Symbol package name must not contain spaces")
    private String packageName;

    /**
     * Package version field. Blank means the service version.
     */
    @Pattern(regexp = "\\S*", message = "Symbol package version must not contain spaces")
    private String packageVersion;
}
