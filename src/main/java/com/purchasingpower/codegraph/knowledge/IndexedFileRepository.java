package com.purchasingpower.codegraph.knowledge;

import java.util.Map;

/**
 * Incremental state of a service: persisted file hashes and per-file removal.
 *
 * @since 1.0.0
 */
public interface IndexedFileRepository {

    /**
     * Previously persisted {@code path -> content hash} map of a service.
     */
    Map<String, String> findFileHashes(String serviceName);

    /**
     * Remove everything extracted from a file before it is re-extracted.
     *
     * <p>Deletes the file's Definition and Reference nodes, Symbol nodes left
     * without any defining or referencing node, and the File-to-Module link.
     * The File node itself stays.
     */
    RemovalResult removeFileContents(String serviceName, String path);

    /**
     * Remove a file that disappeared from disk: its contents as in
     * {@link #removeFileContents}, the File node, and Modules no longer
     * contained by any File of the service.
     */
    RemovalResult removeFile(String serviceName, String path);

    /**
     * Delete Modules of a service that no File contains any more, for example
     * after the only file of a package moved to another package.
     */
    RemovalResult removeOrphanModules(String serviceName);
}
