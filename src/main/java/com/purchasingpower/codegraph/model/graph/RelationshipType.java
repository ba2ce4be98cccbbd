package com.purchasingpower.codegraph.model.graph;

public enum RelationshipType {
    /** Structural nesting: Service, File, Module, Definition, sub-Definition. */
    CONTAINS,
    /** Definition to its Symbol, carries {@code isExported}. */
    DEFINES,
    /** Usage site to Symbol, carries {@code line}, {@code column} and {@code isDefinition}. */
    REFERENCES
}
