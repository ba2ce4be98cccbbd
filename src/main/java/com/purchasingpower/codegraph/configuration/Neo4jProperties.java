package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class Neo4jProperties {

    @NotBlank
    private String uri = "bolt://localhost:7687";

    @NotBlank
    private String username = "neo4j";

    private String password = "password";

    @NotBlank
    private String database = "neo4j";
}
