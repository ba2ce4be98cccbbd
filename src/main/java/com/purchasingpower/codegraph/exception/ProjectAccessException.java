package com.purchasingpower.codegraph.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class ProjectAccessException extends IndexingException {

    private final Path projectRoot;

    public ProjectAccessException(Path projectRoot, String message) {
        super(message + ": " + projectRoot);
        this.projectRoot = projectRoot;
    }

    public ProjectAccessException(Path projectRoot, String message, Throwable cause) {
        super(message + ": " + projectRoot, cause);
        this.projectRoot = projectRoot;
    }
}
