package com.purchasingpower.codegraph.model;

/**
 * Enumeration of external collaborators for unified logging.
 *
 * Used by ExternalCallLogger to tag calls to the graph store, the SCIP
 * indexer process and git with consistent formatting.
 *
 * @see com.purchasingpower.codegraph.util.ExternalCallLogger
 */
public enum ServiceType {
    NEO4J("🟢", "Neo4j"),
    SCIP("🧭", "SCIP"),
    GIT("🔷", "Git");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
