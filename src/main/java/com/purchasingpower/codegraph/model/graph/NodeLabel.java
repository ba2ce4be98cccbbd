package com.purchasingpower.codegraph.model.graph;

/**
 * Labels written to the graph store.
 */
public enum NodeLabel {
    SERVICE("Service"),
    FILE("File"),
    MODULE("Module"),
    DEFINITION("Definition"),
    SYMBOL("Symbol"),
    REFERENCE("Reference");

    private final String label;

    NodeLabel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
