package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class ExternalToolException extends IndexingException {

    private final String toolOutput;
    private final Integer exitCode;

    public ExternalToolException(String message) {
        this(message, null, null, null);
    }

    public ExternalToolException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ExternalToolException(String message, String toolOutput, Integer exitCode) {
        this(message, toolOutput, exitCode, null);
    }

    private ExternalToolException(String message, String toolOutput, Integer exitCode, Throwable cause) {
        super(message, cause);
        this.toolOutput = toolOutput;
        this.exitCode = exitCode;
    }
}
