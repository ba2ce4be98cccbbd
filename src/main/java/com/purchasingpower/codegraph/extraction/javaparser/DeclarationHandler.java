package com.purchasingpower.codegraph.extraction.javaparser;

import com.github.javaparser.ast.Node;

@FunctionalInterface
interface DeclarationHandler {

    void handle(Node node, JavaFileState state);
}
