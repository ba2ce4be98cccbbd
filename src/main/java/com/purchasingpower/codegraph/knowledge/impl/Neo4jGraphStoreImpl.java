package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.model.graph.RelationshipType;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Neo4j implementation of {@link GraphStore}.
 *
 * <p>Every primitive runs in its own write transaction, so a failure affects a
 * single entity only.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class Neo4jGraphStoreImpl implements GraphStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final List<String> INDEX_STATEMENTS = List.of(
            "CREATE INDEX service_name IF NOT EXISTS FOR (s:Service) ON (s.name)",
            "CREATE INDEX file_key IF NOT EXISTS FOR (f:File) ON (f.service, f.path)",
            "CREATE INDEX module_fqn IF NOT EXISTS FOR (m:Module) ON (m.fqn)",
            "CREATE INDEX module_service IF NOT EXISTS FOR (m:Module) ON (m.service)",
            "CREATE INDEX definition_key IF NOT EXISTS FOR (d:Definition) ON (d.service, d.filePath, d.signature)",
            "CREATE INDEX reference_file IF NOT EXISTS FOR (r:Reference) ON (r.service, r.filePath)",
            "CREATE INDEX symbol_key IF NOT EXISTS FOR (s:Symbol) ON (s.symbol)");

    private final Driver driver;
    private final String database;

    public Neo4jGraphStoreImpl(Driver driver, CodeGraphProperties properties) {
        this.driver = driver;
        this.database = properties.getNeo4j().getDatabase();
    }

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j GraphStore (database={})", database);
        createIndexes();
    }

    /**
     * Lookup indexes for the merge keys. Failures are logged, the store may be
     * down at startup and come up before the first run.
     */
    public void createIndexes() {
        try (Session session = openSession()) {
            for (String statement : INDEX_STATEMENTS) {
                session.run(statement).consume();
            }
            log.info("Neo4j indexes created");
        } catch (Exception e) {
            log.warn("Failed to create indexes (will retry on next startup): {}", e.getMessage());
        }
    }

    // =========================================================================
    // Node Operations
    // =========================================================================

    @Override
    public String mergeNode(List<String> labels, Map<String, Object> matchProperties, Map<String, Object> setProperties) {
        if (matchProperties == null || matchProperties.isEmpty()) {
            throw new IllegalArgumentException("mergeNode requires at least one match property");
        }
        Map<String, Object> params = new HashMap<>();
        StringBuilder pattern = new StringBuilder();
        int i = 0;
        for (Map.Entry<String, Object> entry : matchProperties.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Match property '" + entry.getKey() + "' must not be null");
            }
            if (i > 0) {
                pattern.append(", ");
            }
            String param = "k" + i++;
            pattern.append(identifier(entry.getKey())).append(": $").append(param);
            params.put(param, entry.getValue());
        }
        params.put("set", withoutNulls(setProperties));

        String cypher = "MERGE (n" + labelExpression(labels) + " {" + pattern + "}) "
                + "SET n += $set RETURN elementId(n) AS id";
        return writeSingleId(cypher, params, "merge " + labels);
    }

    @Override
    public String createNode(List<String> labels, Map<String, Object> properties) {
        String cypher = "CREATE (n" + labelExpression(labels) + ") SET n = $props RETURN elementId(n) AS id";
        return writeSingleId(cypher, Map.of("props", withoutNulls(properties)), "create " + labels);
    }

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    @Override
    public String createRelationship(String fromId, String toId, RelationshipType type, Map<String, Object> properties) {
        String cypher = """
                MATCH (a) WHERE elementId(a) = $from
                MATCH (b) WHERE elementId(b) = $to
                MERGE (a)-[r:%s]->(b)
                SET r += $props
                RETURN elementId(r) AS id
                """.formatted(identifier(type.name()));
        Map<String, Object> params = new HashMap<>();
        params.put("from", fromId);
        params.put("to", toId);
        params.put("props", withoutNulls(properties));
        return writeSingleId(cypher, params, type.name() + " " + fromId + " -> " + toId);
    }

    // =========================================================================
    // Queries
    // =========================================================================

    @Override
    public List<Map<String, Object>> executeQuery(String cypher, Map<String, Object> parameters) {
        log.debug("✍️  [GRAPH DB WRITE] Query: {}", cypher);
        long startTime = System.currentTimeMillis();
        try (Session session = openSession()) {
            List<Map<String, Object>> rows = session.executeWrite(tx ->
                    tx.run(cypher, parameters != null ? parameters : Map.of()).list(Record::asMap));
            log.debug("✍️  [GRAPH DB WRITE] Completed in {}ms, {} rows", System.currentTimeMillis() - startTime, rows.size());
            return rows;
        } catch (Neo4jException e) {
            throw new GraphStoreException("Cypher write failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Map<String, Object>> executeReadQuery(String cypher, Map<String, Object> parameters) {
        log.debug("📊 [GRAPH DB READ] Query: {}", cypher);
        long startTime = System.currentTimeMillis();
        try (Session session = openSession()) {
            List<Map<String, Object>> rows = session.executeRead(tx ->
                    tx.run(cypher, parameters != null ? parameters : Map.of()).list(Record::asMap));
            log.debug("📊 [GRAPH DB READ] Completed in {}ms, {} rows", System.currentTimeMillis() - startTime, rows.size());
            return rows;
        } catch (Neo4jException e) {
            throw new GraphStoreException("Cypher read failed: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private String writeSingleId(String cypher, Map<String, Object> params, String description) {
        try (Session session = openSession()) {
            List<Record> records = session.executeWrite(tx -> tx.run(cypher, params).list());
            if (records.isEmpty()) {
                throw new GraphStoreException("No result for " + description);
            }
            return records.get(0).get("id").asString();
        } catch (Neo4jException e) {
            throw new GraphStoreException("Failed to " + description + ": " + e.getMessage(), e);
        }
    }

    private Session openSession() {
        return driver.session(SessionConfig.forDatabase(database));
    }

    private static String labelExpression(List<String> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("At least one label is required");
        }
        StringBuilder expression = new StringBuilder();
        for (String label : labels) {
            expression.append(':').append(identifier(label));
        }
        return expression.toString();
    }

    private static String identifier(String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid Cypher identifier: " + value);
        }
        return value;
    }

    /**
     * Neo4j rejects null property values; absent means unknown.
     */
    private static Map<String, Object> withoutNulls(Map<String, Object> properties) {
        Map<String, Object> clean = new HashMap<>();
        if (properties != null) {
            properties.forEach((key, value) -> {
                if (value != null) {
                    clean.put(identifier(key), value);
                }
            });
        }
        return clean;
    }
}
