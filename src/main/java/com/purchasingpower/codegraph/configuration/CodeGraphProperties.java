package com.purchasingpower.codegraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "codegraph")
public class CodeGraphProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ServiceProperties service = new ServiceProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SymbolProperties symbol = new SymbolProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SyncProperties sync = new SyncProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ScipProperties scip = new ScipProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Neo4jProperties neo4j = new Neo4jProperties();
}
