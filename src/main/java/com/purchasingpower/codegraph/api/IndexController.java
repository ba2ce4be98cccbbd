package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.exception.IndexingException;
import com.purchasingpower.codegraph.exception.IndexingInProgressException;
import com.purchasingpower.codegraph.knowledge.IndexedFileRepository;
import com.purchasingpower.codegraph.knowledge.IndexingService;
import com.purchasingpower.codegraph.sync.IndexCommand;
import com.purchasingpower.codegraph.sync.SyncResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Paths;
import java.util.Map;
import java.util.TreeMap;

/**
 * REST controller for indexing.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class IndexController {

    private final IndexingService indexingService;
    private final IndexedFileRepository fileRepository;

    /**
     * Index a project directory.
     *
     * POST /api/v1/index
     */
    @PostMapping("/index")
    public ResponseEntity<IndexResponse> index(@RequestBody IndexRequest request) {
        if (request.getProjectRoot() == null || request.getProjectRoot().isBlank()) {
            return ResponseEntity.badRequest().body(IndexResponse.error("Project root is required"));
        }
        log.info("Indexing request for {} (service={}, strategy={})",
                request.getProjectRoot(), request.getServiceName(), request.getStrategy());

        try {
            IndexCommand command = IndexCommand.builder()
                .projectRoot(Paths.get(request.getProjectRoot()))
                .serviceName(request.getServiceName())
                .serviceVersion(request.getServiceVersion())
                .repositoryUrl(request.getRepositoryUrl())
                .strategy(request.getStrategy())
                .force(request.isForce())
                .build();
            SyncResult result = indexingService.index(command);
            return ResponseEntity.ok(IndexResponse.success(result));

        } catch (IndexingInProgressException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(IndexResponse.error(e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(IndexResponse.error(e.getMessage()));
        } catch (IndexingException e) {
            log.error("Indexing failed", e);
            return ResponseEntity.internalServerError().body(IndexResponse.error("Indexing failed: " + e.getMessage()));
        }
    }

    /**
     * Persisted file hashes of a service.
     *
     * GET /api/v1/files?service=...
     */
    @GetMapping("/files")
    public ResponseEntity<Map<String, String>> files(@RequestParam("service") String serviceName) {
        try {
            return ResponseEntity.ok(new TreeMap<>(fileRepository.findFileHashes(serviceName)));
        } catch (IndexingException e) {
            log.error("Failed to load files for {}", serviceName, e);
            return ResponseEntity.internalServerError().build();
        }
    }
}
