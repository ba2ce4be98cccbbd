package com.purchasingpower.codegraph.model.graph;

import com.purchasingpower.codegraph.model.symbol.SymbolKind;

/**
 * Closed set of definable entities. Each kind is also the node's primary label;
 * every definition additionally carries {@link NodeLabel#DEFINITION}.
 */
public enum DefinitionKind {
    /** Standalone function or static method. */
    FUNCTION("Function", SymbolKind.FUNCTION),
    METHOD("Method", SymbolKind.METHOD),
    /** Class, enum, record or annotation type. */
    CLASS("Class", SymbolKind.TYPE),
    INTERFACE("Interface", SymbolKind.INTERFACE),
    VARIABLE("Variable", SymbolKind.FIELD),
    PARAMETER("Parameter", SymbolKind.PARAMETER);

    private final String label;
    private final SymbolKind symbolKind;

    DefinitionKind(String label, SymbolKind symbolKind) {
        this.label = label;
        this.symbolKind = symbolKind;
    }

    public String getLabel() {
        return label;
    }

    public SymbolKind getSymbolKind() {
        return symbolKind;
    }
}
