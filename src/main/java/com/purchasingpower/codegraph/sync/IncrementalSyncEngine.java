package com.purchasingpower.codegraph.sync;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.ServiceProperties;
import com.purchasingpower.codegraph.exception.ExtractionException;
import com.purchasingpower.codegraph.exception.IndexingInProgressException;
import com.purchasingpower.codegraph.exception.ProjectAccessException;
import com.purchasingpower.codegraph.extraction.ExtractionSession;
import com.purchasingpower.codegraph.extraction.ExtractionStrategy;
import com.purchasingpower.codegraph.extraction.ExtractionStrategyRegistry;
import com.purchasingpower.codegraph.extraction.ProjectScope;
import com.purchasingpower.codegraph.extraction.StrategyType;
import com.purchasingpower.codegraph.knowledge.GraphWriter;
import com.purchasingpower.codegraph.knowledge.IndexedFileRepository;
import com.purchasingpower.codegraph.knowledge.IndexingService;
import com.purchasingpower.codegraph.knowledge.RemovalResult;
import com.purchasingpower.codegraph.model.graph.FileExtraction;
import com.purchasingpower.codegraph.model.graph.ServiceInfo;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.service.GitMetadataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sequential, hash-driven synchronisation of a project into the graph.
 *
 * <p>A file is re-extracted only when its SHA-256 differs from the hash
 * persisted on its File node (or it is new). Its old subgraph is removed and
 * the fresh extraction upserted before the next file is touched. Files
 * persisted earlier but no longer on disk are removed after the walk.
 * Re-running on an unchanged tree writes nothing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IncrementalSyncEngine implements IndexingService {

    private final CodeGraphProperties properties;
    private final ProjectWalker projectWalker;
    private final FileHasher fileHasher;
    private final ExtractionStrategyRegistry strategies;
    private final IndexedFileRepository fileRepository;
    private final GraphWriter graphWriter;
    private final GitMetadataService gitMetadataService;

    private final Set<String> activeServices = ConcurrentHashMap.newKeySet();

    @Override
    public SyncResult index(IndexCommand command, CancellationToken cancellationToken) {
        Preconditions.checkNotNull(command, "command");
        Preconditions.checkNotNull(command.getProjectRoot(), "projectRoot");
        Preconditions.checkNotNull(cancellationToken, "cancellationToken");

        Path projectRoot = command.getProjectRoot().toAbsolutePath().normalize();
        StrategyType strategyType = command.getStrategy() != null
                ? command.getStrategy()
                : properties.getSync().getDefaultStrategy();
        ServiceInfo service = resolveService(command, projectRoot, strategyType);

        if (!activeServices.add(service.getName())) {
            throw new IndexingInProgressException(service.getName());
        }
        try {
            return run(command, projectRoot, strategyType, service, cancellationToken);
        } finally {
            activeServices.remove(service.getName());
        }
    }

    @Override
    public boolean isIndexing(String serviceName) {
        return activeServices.contains(serviceName);
    }

    private SyncResult run(IndexCommand command, Path projectRoot, StrategyType strategyType, ServiceInfo service,
                           CancellationToken cancellationToken) {
        long startTime = System.currentTimeMillis();
        log.info("🚀 Indexing {} from {} ({} strategy{})", service.getName(), projectRoot, strategyType,
                command.isForce() ? ", forced" : "");

        // Fatal checks come before any write.
        checkProjectRoot(projectRoot);
        Map<String, String> previousHashes = fileRepository.findFileHashes(service.getName());
        ExtractionStrategy strategy = strategies.get(strategyType);

        IndexRunContext context = new IndexRunContext(service, projectRoot, strategyType, cancellationToken);
        int visited = 0;
        int indexed = 0;
        int unchanged = 0;
        int skipped = 0;
        int deleted = 0;
        boolean cancelled = false;

        ProjectScope scope = ProjectScope.builder()
                .projectRoot(projectRoot)
                .serviceName(service.getName())
                .serviceVersion(service.getVersion())
                .build();

        try (ExtractionSession session = strategy.open(scope)) {
            List<Path> files = projectWalker.walk(projectRoot, context.getFailures());
            skipped += context.getFailures().size();
            Set<String> seen = new HashSet<>();

            for (Path file : files) {
                if (context.isCancelled()) {
                    log.info("⏹️ Indexing of {} cancelled after {} files", service.getName(), visited);
                    cancelled = true;
                    break;
                }
                String path = ProjectWalker.relativePath(projectRoot, file);
                seen.add(path);
                visited++;

                FileOutcome outcome = processFile(context, session, file, path, previousHashes.get(path), command.isForce());
                switch (outcome) {
                    case INDEXED -> indexed++;
                    case UNCHANGED -> unchanged++;
                    case SKIPPED -> skipped++;
                }
            }

            if (!cancelled) {
                for (String path : new TreeSet<>(previousHashes.keySet())) {
                    if (!seen.contains(path) && removeDeletedFile(context, path)) {
                        deleted++;
                    }
                }
            }
        }

        SyncType syncType;
        if (cancelled) {
            syncType = SyncType.CANCELLED;
        } else if (previousHashes.isEmpty()) {
            syncType = SyncType.INITIAL_FULL_INDEX;
        } else if (command.isForce()) {
            syncType = SyncType.FORCED_FULL_INDEX;
        } else if (indexed == 0 && deleted == 0) {
            syncType = SyncType.NO_CHANGES;
        } else {
            syncType = SyncType.INCREMENTAL;
        }

        SyncResult result = SyncResult.builder()
                .serviceName(service.getName())
                .strategy(strategyType)
                .syncType(syncType)
                .filesVisited(visited)
                .filesIndexed(indexed)
                .filesUnchanged(unchanged)
                .filesDeleted(deleted)
                .filesSkipped(skipped)
                .entityFailures(context.getEntityFailures())
                .nodesWritten(context.getNodesWritten())
                .relationshipsWritten(context.getRelationshipsWritten())
                .nodesDeleted(context.getNodesDeleted())
                .durationMs(System.currentTimeMillis() - startTime)
                .failures(new ArrayList<>(context.getFailures()))
                .build();
        log.info("✅ {}", result.summary());
        return result;
    }

    private enum FileOutcome { INDEXED, UNCHANGED, SKIPPED }

    /**
     * Extraction is pure and runs first, so a file that fails to parse keeps
     * its previous subgraph and its old hash, and is retried next run.
     */
    private FileOutcome processFile(IndexRunContext context, ExtractionSession session, Path file, String path,
                                    String previousHash, boolean force) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            return skip(context, path, "read failed: " + e.getMessage());
        }

        String hash = fileHasher.hash(bytes);
        if (!force && hash.equals(previousHash)) {
            log.debug("Unchanged: {}", path);
            return FileOutcome.UNCHANGED;
        }

        String content = new String(bytes, StandardCharsets.UTF_8);
        SourceFile sourceFile = SourceFile.builder()
                .path(path)
                .absolutePath(file)
                .language(properties.getService().getLanguage())
                .hash(hash)
                .lineCount(countLines(content))
                .size(bytes.length)
                .build();

        FileExtraction extraction;
        try {
            extraction = session.extract(sourceFile, content);
        } catch (ExtractionException e) {
            return skip(context, path, e.getMessage());
        } catch (RuntimeException e) {
            log.debug("Extraction of {} failed", path, e);
            return skip(context, path, "extraction failed: " + e.getMessage());
        }

        try {
            if (previousHash != null) {
                RemovalResult removal = fileRepository.removeFileContents(context.getServiceName(), path);
                applyRemoval(context, removal);
            }
            graphWriter.writeSharedSymbols(context, session.sharedSymbols());
            graphWriter.writeFile(context, sourceFile, extraction);
            if (previousHash != null) {
                applyRemoval(context, fileRepository.removeOrphanModules(context.getServiceName()));
            }
        } catch (RuntimeException e) {
            return skip(context, path, "upsert failed: " + e.getMessage());
        }
        log.debug("Indexed {} ({} definitions, {} references)", path,
                extraction.getDefinitions().size(), extraction.getReferences().size());
        return FileOutcome.INDEXED;
    }

    private boolean removeDeletedFile(IndexRunContext context, String path) {
        try {
            RemovalResult removal = fileRepository.removeFile(context.getServiceName(), path);
            applyRemoval(context, removal);
            log.info("🗑️ Removed deleted file {}", path);
            return true;
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to remove deleted file {}: {}", path, e.getMessage());
            context.fileFailed(path, "removal failed: " + e.getMessage());
            return false;
        }
    }

    private static void applyRemoval(IndexRunContext context, RemovalResult removal) {
        context.nodesDeleted(removal.nodesDeleted());
        context.evictSymbols(removal.deletedSymbols());
        context.evictModules(removal.deletedModules());
    }

    private static FileOutcome skip(IndexRunContext context, String path, String error) {
        log.warn("⚠️ Skipping {}: {}", path, error);
        context.fileFailed(path, error);
        return FileOutcome.SKIPPED;
    }

    private ServiceInfo resolveService(IndexCommand command, Path projectRoot, StrategyType strategyType) {
        ServiceProperties defaults = properties.getService();
        String name = Strings.isNullOrEmpty(command.getServiceName()) ? defaults.getName() : command.getServiceName();
        String version = Strings.isNullOrEmpty(command.getServiceVersion()) ? defaults.getVersion() : command.getServiceVersion();
        Preconditions.checkArgument(!name.isBlank() && !name.contains(" "), "Service name must be a non-empty token: '%s'", name);
        Preconditions.checkArgument(!version.isBlank() && !version.contains(" "), "Service version must be a non-empty token: '%s'", version);

        String repositoryUrl = !Strings.isNullOrEmpty(command.getRepositoryUrl())
                ? command.getRepositoryUrl()
                : defaults.getRepositoryUrl();
        String lastCommit = null;
        if (Files.isDirectory(projectRoot)) {
            if (Strings.isNullOrEmpty(repositoryUrl)) {
                repositoryUrl = gitMetadataService.findRemoteUrl(projectRoot.toFile()).orElse(null);
            }
            lastCommit = gitMetadataService.findHeadCommit(projectRoot.toFile()).orElse(null);
        }

        return ServiceInfo.builder()
                .name(name)
                .language(defaults.getLanguage())
                .version(version)
                .repositoryUrl(repositoryUrl)
                .lastCommit(lastCommit)
                .strategy(strategyType.name())
                .build();
    }

    private static void checkProjectRoot(Path projectRoot) {
        if (!Files.exists(projectRoot)) {
            throw new ProjectAccessException(projectRoot, "Project root does not exist");
        }
        if (!Files.isDirectory(projectRoot) || !Files.isReadable(projectRoot)) {
            throw new ProjectAccessException(projectRoot, "Project root is not a readable directory");
        }
    }

    static int countLines(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        return content.charAt(content.length() - 1) == '\n' ? lines : lines + 1;
    }
}
