package com.purchasingpower.codegraph.api;

import com.purchasingpower.codegraph.sync.FileFailure;
import com.purchasingpower.codegraph.sync.SyncResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Index project response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexResponse {

    private boolean success;
    private String serviceName;
    private String strategy;
    private String syncType;
    private int filesVisited;
    private int filesIndexed;
    private int filesUnchanged;
    private int filesDeleted;
    private int filesSkipped;
    private int entityFailures;
    private int nodesWritten;
    private int relationshipsWritten;
    private long durationMs;
    private List<FileFailure> failures;
    private String error;

    public static IndexResponse success(SyncResult result) {
        return IndexResponse.builder()
            .success(true)
            .serviceName(result.getServiceName())
            .strategy(result.getStrategy().name())
            .syncType(result.getSyncType().name())
            .filesVisited(result.getFilesVisited())
            .filesIndexed(result.getFilesIndexed())
            .filesUnchanged(result.getFilesUnchanged())
            .filesDeleted(result.getFilesDeleted())
            .filesSkipped(result.getFilesSkipped())
            .entityFailures(result.getEntityFailures())
            .nodesWritten(result.getNodesWritten())
            .relationshipsWritten(result.getRelationshipsWritten())
            .durationMs(result.getDurationMs())
            .failures(result.getFailures())
            .build();
    }

    public static IndexResponse error(String error) {
        return IndexResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
