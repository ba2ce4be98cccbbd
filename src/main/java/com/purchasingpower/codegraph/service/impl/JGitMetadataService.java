package com.purchasingpower.codegraph.service.impl;

import com.purchasingpower.codegraph.model.CallContext;
import com.purchasingpower.codegraph.model.ServiceType;
import com.purchasingpower.codegraph.service.GitMetadataService;
import com.purchasingpower.codegraph.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.util.Optional;

@Slf4j
@Service
public class JGitMetadataService implements GitMetadataService {

    @Override
    public Optional<String> findRemoteUrl(File projectRoot) {
        try (Repository repository = open(projectRoot)) {
            if (repository == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(repository.getConfig().getString("remote", "origin", "url"));
        }
    }

    @Override
    public Optional<String> findHeadCommit(File projectRoot) {
        CallContext callCtx = ExternalCallLogger.startCall(ServiceType.GIT, "ResolveHead", log);
        try (Repository repository = open(projectRoot)) {
            if (repository == null) {
                return Optional.empty();
            }
            callCtx.logRequest("Resolving HEAD", "GitDir", repository.getDirectory());
            ObjectId head = repository.resolve("HEAD");
            callCtx.logResponse(head != null ? head.getName() : "No HEAD commit");
            return head != null ? Optional.of(head.getName()) : Optional.empty();
        } catch (IOException e) {
            callCtx.logError("Failed to resolve HEAD", e);
            return Optional.empty();
        }
    }

    /**
     * @return the enclosing repository, or {@code null} outside a working tree
     */
    private Repository open(File projectRoot) {
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(projectRoot);
        if (builder.getGitDir() == null) {
            log.debug("{} is not inside a git working tree", projectRoot);
            return null;
        }
        try {
            return builder.setMustExist(true).build();
        } catch (IOException e) {
            log.warn("⚠️ Cannot open git repository at {}: {}", builder.getGitDir(), e.getMessage());
            return null;
        }
    }
}
