package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * A single file could not be extracted. The run skips the file and continues.
 */
@Getter
public class ExtractionException extends RuntimeException {

    private final String filePath;

    public ExtractionException(String filePath, String message) {
        super(message);
        this.filePath = filePath;
    }

    public ExtractionException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }
}
