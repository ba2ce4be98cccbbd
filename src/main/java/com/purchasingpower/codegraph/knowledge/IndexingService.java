package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.sync.CancellationToken;
import com.purchasingpower.codegraph.sync.IndexCommand;
import com.purchasingpower.codegraph.sync.SyncResult;

/**
 * Runs indexing for a project.
 *
 * @since 1.0.0
 */
public interface IndexingService {

    /**
     * Index a project, re-extracting only files whose content changed.
     *
     * @throws com.purchasingpower.codegraph.exception.IndexingException on fatal errors, before any write
     */
    default SyncResult index(IndexCommand command) {
        return index(command, CancellationToken.none());
    }

    /**
     * Index a project; the token is checked between files.
     */
    SyncResult index(IndexCommand command, CancellationToken cancellationToken);

    /**
     * @return true while a run for the service is active
     */
    boolean isIndexing(String serviceName);
}
