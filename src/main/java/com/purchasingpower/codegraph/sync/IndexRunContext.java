package com.purchasingpower.codegraph.sync;

import com.purchasingpower.codegraph.extraction.StrategyType;
import com.purchasingpower.codegraph.model.graph.ServiceInfo;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State owned by exactly one indexing run.
 *
 * <p>The module and symbol caches map natural keys to store node ids. They only
 * save round trips; the store's merge semantics remain the source of truth, so
 * evicted or missing entries are simply merged again. Not thread-safe.
 */
@Getter
public class IndexRunContext {

    private final ServiceInfo service;
    private final Path projectRoot;
    private final StrategyType strategy;
    private final CancellationToken cancellationToken;

    private final Map<String, String> moduleIds = new HashMap<>();
    private final Map<String, String> symbolIds = new HashMap<>();
    private final List<FileFailure> failures = new ArrayList<>();

    @Setter
    private String serviceNodeId;
    @Setter
    private boolean sharedSymbolsWritten;

    private int nodesWritten;
    private int relationshipsWritten;
    private int nodesDeleted;
    private int entityFailures;

    public IndexRunContext(ServiceInfo service, Path projectRoot, StrategyType strategy,
                           CancellationToken cancellationToken) {
        this.service = service;
        this.projectRoot = projectRoot;
        this.strategy = strategy;
        this.cancellationToken = cancellationToken;
    }

    public String getServiceName() {
        return service.getName();
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public void nodeWritten() {
        nodesWritten++;
    }

    public void relationshipWritten() {
        relationshipsWritten++;
    }

    public void nodesDeleted(int count) {
        nodesDeleted += count;
    }

    public void entityFailed() {
        entityFailures++;
    }

    public void fileFailed(String path, String error) {
        failures.add(new FileFailure(path, error));
    }

    public void evictSymbols(Collection<String> symbols) {
        symbols.forEach(symbolIds::remove);
    }

    public void evictModules(Collection<String> fqns) {
        fqns.forEach(moduleIds::remove);
    }
}
