package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * A run for the same service is already active in this process.
 */
@Getter
public class IndexingInProgressException extends IndexingException {

    private final String serviceName;

    public IndexingInProgressException(String serviceName) {
        super("Indexing already in progress for service: " + serviceName);
        this.serviceName = serviceName;
    }
}
