package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.extraction.ExtractionStrategyRegistry;
import com.purchasingpower.codegraph.extraction.SymbolFactory;
import com.purchasingpower.codegraph.extraction.javaparser.JavaParserExtractionStrategy;
import com.purchasingpower.codegraph.knowledge.GraphWriter;
import com.purchasingpower.codegraph.service.impl.JGitMetadataService;
import com.purchasingpower.codegraph.sync.FileHasher;
import com.purchasingpower.codegraph.sync.IncrementalSyncEngine;
import com.purchasingpower.codegraph.sync.IndexCommand;
import com.purchasingpower.codegraph.sync.ProjectWalker;
import com.purchasingpower.codegraph.sync.SyncResult;
import com.purchasingpower.codegraph.sync.SyncType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.io.TempDir;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Session;
import org.testcontainers.containers.Neo4jContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Indexes a small project into a real Neo4j and checks the persisted graph.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@DisplayName("Neo4j Indexing E2E Tests")
class Neo4jIndexingE2ETest {

    @Container
    private static final Neo4jContainer<?> neo4j = new Neo4jContainer<>("neo4j:5.19.0-community")
            .withAdminPassword("testpass");

    private static final String SERVICE = "demo";
    private static final String GREETER_PATH = "src/main/java/com/example/Greeter.java";
    private static final String TEXTS_PATH = "src/main/java/com/example/util/Texts.java";

    private Driver driver;
    private Neo4jGraphStoreImpl graphStore;
    private IncrementalSyncEngine engine;

    @TempDir
    Path projectRoot;

    @BeforeAll
    void startDriver() {
        driver = GraphDatabase.driver(neo4j.getBoltUrl(), AuthTokens.basic("neo4j", neo4j.getAdminPassword()));
    }

    @AfterAll
    void closeDriver() {
        if (driver != null) {
            driver.close();
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        try (Session session = driver.session()) {
            session.run("MATCH (n) DETACH DELETE n").consume();
        }
        CodeGraphProperties properties = new CodeGraphProperties();
        graphStore = new Neo4jGraphStoreImpl(driver, properties);
        graphStore.init();
        engine = new IncrementalSyncEngine(properties, new ProjectWalker(properties), new FileHasher(),
                new ExtractionStrategyRegistry(List.of(
                        new JavaParserExtractionStrategy(new SymbolFactory(properties), properties))),
                new CypherIndexedFileRepository(graphStore), new GraphWriter(graphStore), new JGitMetadataService());

        write(GREETER_PATH, """
                package com.example;

                /** Greets people. */
                public class Greeter {
                    public String greet(String name) {
                        return "Hi " + name;
                    }
                }
                """);
        write(TEXTS_PATH, """
                package com.example.util;

                public final class Texts {
                    public static final String EMPTY = "";
                }
                """);
    }

    @Test
    @DisplayName("Should persist the code graph and leave it untouched on an unchanged re-run")
    void index_ShouldPersistGraphIdempotently() {
        // When
        SyncResult first = engine.index(command());

        // Then
        assertThat(first.getSyncType()).isEqualTo(SyncType.INITIAL_FULL_INDEX);
        assertThat(first.hasFailures()).isFalse();
        assertThat(count("MATCH (n:Service {name: $service}) RETURN count(n) AS c")).isEqualTo(1);
        assertThat(count("MATCH (n:File {service: $service}) RETURN count(n) AS c")).isEqualTo(2);
        assertThat(count("MATCH (n:Module {service: $service}) RETURN count(n) AS c")).isEqualTo(2);
        assertThat(count("MATCH (n:Definition {service: $service}) RETURN count(n) AS c")).isEqualTo(5);
        assertThat(count("MATCH (:Definition)-[r:DEFINES]->(:Symbol) RETURN count(r) AS c")).isEqualTo(5);
        assertThat(count("""
                MATCH (:Class {signature: 'com.example.Greeter'})-[:CONTAINS]->(m:Method)-[:CONTAINS]->(p:Parameter)
                WHERE m.isExported AND p.index = 0
                RETURN count(p) AS c
                """)).isEqualTo(1);
        assertThat(readString("MATCH (s:Symbol {kind: 'Type', displayName: 'Greeter'}) RETURN s.documentation AS v"))
                .isEqualTo("Greets people.");
        long nodes = count("MATCH (n) RETURN count(n) AS c");
        long relationships = count("MATCH ()-[r]->() RETURN count(r) AS c");

        // When
        SyncResult second = engine.index(command());

        // Then
        assertThat(second.getSyncType()).isEqualTo(SyncType.NO_CHANGES);
        assertThat(second.getNodesWritten()).isZero();
        assertThat(count("MATCH (n) RETURN count(n) AS c")).isEqualTo(nodes);
        assertThat(count("MATCH ()-[r]->() RETURN count(r) AS c")).isEqualTo(relationships);
    }

    @Test
    @DisplayName("Should replace changed files and remove deleted ones with their orphaned modules")
    void index_ShouldApplyChangesAndDeletions() throws IOException {
        // Given
        engine.index(command());
        write(GREETER_PATH, """
                package com.example;

                public class Greeter {
                    public String greet(String name, String greeting) {
                        return greeting + name;
                    }
                }
                """);
        Files.delete(projectRoot.resolve(TEXTS_PATH));

        // When
        SyncResult result = engine.index(command());

        // Then
        assertThat(result.getSyncType()).isEqualTo(SyncType.INCREMENTAL);
        assertThat(result.getFilesIndexed()).isEqualTo(1);
        assertThat(result.getFilesDeleted()).isEqualTo(1);
        assertThat(count("MATCH (n:File {service: $service}) RETURN count(n) AS c")).isEqualTo(1);
        assertThat(count("MATCH (n:Module {service: $service}) RETURN count(n) AS c")).isEqualTo(1);
        assertThat(count("MATCH (n:Definition {service: $service}) RETURN count(n) AS c")).isEqualTo(4);
        assertThat(count("MATCH (n:Symbol) RETURN count(n) AS c")).isEqualTo(4);
        assertThat(count("MATCH (n:Symbol) WHERE n.symbol CONTAINS 'Texts' RETURN count(n) AS c")).isZero();
        assertThat(count("MATCH (:File)-[:CONTAINS]->(m:Module {fqn: 'demo/com.example'}) RETURN count(m) AS c"))
                .isEqualTo(1);
    }

    private IndexCommand command() {
        return IndexCommand.builder()
                .projectRoot(projectRoot)
                .serviceName(SERVICE)
                .serviceVersion("1.0.0")
                .build();
    }

    private long count(String cypher) {
        try (Session session = driver.session()) {
            return session.run(cypher, Map.of("service", SERVICE)).single().get("c").asLong();
        }
    }

    private String readString(String cypher) {
        try (Session session = driver.session()) {
            return session.run(cypher).single().get("v").asString();
        }
    }

    private void write(String relative, String content) throws IOException {
        Path file = projectRoot.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
