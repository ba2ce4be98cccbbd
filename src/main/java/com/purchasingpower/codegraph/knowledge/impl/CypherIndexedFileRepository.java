package com.purchasingpower.codegraph.knowledge.impl;

import com.purchasingpower.codegraph.exception.GraphStoreException;
import com.purchasingpower.codegraph.knowledge.GraphStore;
import com.purchasingpower.codegraph.knowledge.IndexedFileRepository;
import com.purchasingpower.codegraph.knowledge.RemovalResult;
import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link IndexedFileRepository} on top of {@link GraphStore} Cypher queries.
 *
 * <p>Removal runs as a sequence of statements rather than one transaction;
 * a failure part way leaves the file dirty, and the next run removes it again.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CypherIndexedFileRepository implements IndexedFileRepository {

    private static final String FIND_FILE_HASHES = """
            MATCH (s:Service {name: $service})-[:CONTAINS]->(f:File)
            RETURN f.path AS path, f.hash AS hash
            """;

    private static final String FIND_FILE_SYMBOLS = """
            MATCH (d:Definition {service: $service, filePath: $path})-[:DEFINES]->(s:Symbol)
            RETURN DISTINCT s.symbol AS symbol
            UNION
            MATCH (r:Reference {service: $service, filePath: $path})-[:REFERENCES]->(s:Symbol)
            RETURN DISTINCT s.symbol AS symbol
            """;

    private static final String DELETE_DEFINITIONS = """
            MATCH (d:Definition {service: $service, filePath: $path})
            DETACH DELETE d
            RETURN count(*) AS deleted
            """;

    private static final String DELETE_REFERENCES = """
            MATCH (r:Reference {service: $service, filePath: $path})
            DETACH DELETE r
            RETURN count(*) AS deleted
            """;

    private static final String DELETE_ORPHAN_SYMBOLS = """
            UNWIND $symbols AS candidate
            MATCH (s:Symbol {symbol: candidate})
            WHERE NOT (s)<-[:DEFINES|REFERENCES]-()
            DETACH DELETE s
            RETURN candidate AS symbol
            """;

    private static final String UNLINK_MODULE = """
            MATCH (:File {service: $service, path: $path})-[r:CONTAINS]->(:Module)
            DELETE r
            """;

    private static final String DELETE_FILE = """
            MATCH (f:File {service: $service, path: $path})
            DETACH DELETE f
            RETURN count(*) AS deleted
            """;

    private static final String DELETE_ORPHAN_MODULES = """
            MATCH (m:Module {service: $service})
            WHERE NOT (:File)-[:CONTAINS]->(m)
            WITH m, m.fqn AS fqn
            DETACH DELETE m
            RETURN fqn
            """;

    private final GraphStore graphStore;

    @Override
    public Map<String, String> findFileHashes(String serviceName) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.NEO4J, "FindFileHashes", log);
        callCtx.logRequest("Loading persisted file hashes", "Service", serviceName);
        try {
            List<Map<String, Object>> rows = graphStore.executeReadQuery(FIND_FILE_HASHES, Map.of("service", serviceName));
            Map<String, String> hashes = new HashMap<>();
            for (Map<String, Object> row : rows) {
                Object path = row.get("path");
                if (path != null) {
                    hashes.put(path.toString(), row.get("hash") != null ? row.get("hash").toString() : "");
                }
            }
            callCtx.logResponse("Loaded file hashes", "Files", hashes.size());
            return hashes;
        } catch (RuntimeException e) {
            callCtx.logError("Failed to load file hashes", e);
            throw new GraphStoreException("Cannot read previous file hashes for service " + serviceName, e);
        }
    }

    @Override
    public RemovalResult removeFileContents(String serviceName, String path) {
        Map<String, Object> params = Map.of("service", serviceName, "path", path);

        Set<String> candidates = new LinkedHashSet<>();
        for (Map<String, Object> row : graphStore.executeQuery(FIND_FILE_SYMBOLS, params)) {
            if (row.get("symbol") != null) {
                candidates.add(row.get("symbol").toString());
            }
        }

        int deleted = count(graphStore.executeQuery(DELETE_DEFINITIONS, params))
                + count(graphStore.executeQuery(DELETE_REFERENCES, params));

        Set<String> deletedSymbols = new LinkedHashSet<>();
        if (!candidates.isEmpty()) {
            for (Map<String, Object> row : graphStore.executeQuery(DELETE_ORPHAN_SYMBOLS,
                    Map.of("symbols", List.copyOf(candidates)))) {
                deletedSymbols.add(row.get("symbol").toString());
            }
        }
        graphStore.executeQuery(UNLINK_MODULE, params);

        log.debug("Removed contents of {}: {} nodes, {} orphaned symbols", path, deleted, deletedSymbols.size());
        return new RemovalResult(deleted + deletedSymbols.size(), deletedSymbols, Set.of());
    }

    @Override
    public RemovalResult removeFile(String serviceName, String path) {
        RemovalResult contents = removeFileContents(serviceName, path);
        int fileNodes = count(graphStore.executeQuery(DELETE_FILE, Map.of("service", serviceName, "path", path)));
        RemovalResult modules = removeOrphanModules(serviceName);

        log.debug("Removed file {} ({} orphaned modules)", path, modules.deletedModules().size());
        return new RemovalResult(contents.nodesDeleted() + fileNodes + modules.nodesDeleted(),
                contents.deletedSymbols(), modules.deletedModules());
    }

    @Override
    public RemovalResult removeOrphanModules(String serviceName) {
        Set<String> deletedModules = new LinkedHashSet<>();
        for (Map<String, Object> row : graphStore.executeQuery(DELETE_ORPHAN_MODULES, Map.of("service", serviceName))) {
            if (row.get("fqn") != null) {
                deletedModules.add(row.get("fqn").toString());
            }
        }
        if (!deletedModules.isEmpty()) {
            log.debug("Removed orphaned modules of {}: {}", serviceName, deletedModules);
        }
        return new RemovalResult(deletedModules.size(), Set.of(), deletedModules);
    }

    private static int count(List<Map<String, Object>> rows) {
        if (rows.isEmpty() || rows.get(0).get("deleted") == null) {
            return 0;
        }
        return ((Number) rows.get(0).get("deleted")).intValue();
    }
}
