package com.purchasingpower.codegraph.service;

import java.io.File;
import java.util.Optional;

/**
 * Read-only git metadata of an indexed project. Projects that are not git
 * working trees yield empty results.
 */
public interface GitMetadataService {

    /**
     * URL of the {@code origin} remote.
     *
     * @param projectRoot project directory, or a directory inside the working tree
     */
    Optional<String> findRemoteUrl(File projectRoot);

    /**
     * Get current commit hash (HEAD) of repository
     *
     * @param projectRoot project directory
     * @return Git commit SHA (40-character hex string)
     */
    Optional<String> findHeadCommit(File projectRoot);
}
