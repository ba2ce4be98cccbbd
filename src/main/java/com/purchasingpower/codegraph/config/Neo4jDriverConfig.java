package com.purchasingpower.codegraph.config;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.Neo4jProperties;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Neo4j driver bean. The driver connects lazily, so startup does not need a
 * reachable database.
 */
@Slf4j
@Configuration
public class Neo4jDriverConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(CodeGraphProperties properties) {
        Neo4jProperties neo4j = properties.getNeo4j();
        Config driverConfig = Config.builder()
                .withMaxConnectionPoolSize(30)
                .withConnectionAcquisitionTimeout(60, TimeUnit.SECONDS)
                .build();
        log.info("Creating Neo4j driver (uri={}, database={})", neo4j.getUri(), neo4j.getDatabase());
        String password = neo4j.getPassword() != null ? neo4j.getPassword() : "";
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), password), driverConfig);
    }
}
