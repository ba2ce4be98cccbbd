package com.purchasingpower.codegraph.exception;

import lombok.Getter;

@Getter
public class MalformedSymbolException extends RuntimeException {

    private final String input;

    public MalformedSymbolException(String input, String reason) {
        super("Malformed symbol '" + input + "': " + reason);
        this.input = input;
    }
}
