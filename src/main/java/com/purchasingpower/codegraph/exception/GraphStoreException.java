package com.purchasingpower.codegraph.exception;

public class GraphStoreException extends IndexingException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
