package com.purchasingpower.codegraph.sync;

import com.purchasingpower.codegraph.extraction.StrategyType;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of an indexing run.
 */
@Data
@Builder
public class SyncResult {

    private String serviceName;
    private StrategyType strategy;
    private SyncType syncType;

    private int filesVisited;
    private int filesIndexed;
    private int filesUnchanged;
    private int filesDeleted;
    private int filesSkipped;

    /** Node or relationship writes that failed without aborting their file. */
    private int entityFailures;

    private int nodesWritten;
    private int relationshipsWritten;
    private int nodesDeleted;

    private long durationMs;

    @Builder.Default
    private List<FileFailure> failures = new ArrayList<>();

    public boolean hasFailures() {
        return !failures.isEmpty() || entityFailures > 0;
    }

    public String summary() {
        return String.format("%s [%s]: %d visited, %d indexed, %d unchanged, %d deleted, %d skipped, "
                        + "%d nodes / %d relationships written, %d entity failures, %dms",
                syncType, strategy, filesVisited, filesIndexed, filesUnchanged, filesDeleted, filesSkipped,
                nodesWritten, relationshipsWritten, entityFailures, durationMs);
    }
}
