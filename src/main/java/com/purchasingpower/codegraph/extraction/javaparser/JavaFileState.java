package com.purchasingpower.codegraph.extraction.javaparser;

import com.github.javaparser.ast.Node;
import com.purchasingpower.codegraph.extraction.ProjectScope;
import com.purchasingpower.codegraph.extraction.SymbolFactory;
import com.purchasingpower.codegraph.model.graph.Definition;
import com.purchasingpower.codegraph.model.graph.SourcePosition;
import com.purchasingpower.codegraph.model.symbol.Descriptors;
import com.purchasingpower.codegraph.model.symbol.Symbol;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extraction state of one file: collected definitions, the types declared so
 * far and per-owner overload counters.
 */
@Getter
class JavaFileState {

    /**
     * A type declared earlier in the file.
     */
    record TypeEntry(String descriptor, String qualifiedName, String signature, boolean isInterface) {
    }

    private final String filePath;
    private final String javaPackage;
    private final ProjectScope scope;
    private final SymbolFactory symbolFactory;
    private final TokenOffsets offsets;
    private final List<Definition> definitions = new ArrayList<>();

    private final Map<Node, TypeEntry> types = new IdentityHashMap<>();
    private final Map<String, Integer> overloads = new HashMap<>();

    JavaFileState(String filePath, String javaPackage, ProjectScope scope, SymbolFactory symbolFactory,
                  TokenOffsets offsets) {
        this.filePath = filePath;
        this.javaPackage = javaPackage;
        this.scope = scope;
        this.symbolFactory = symbolFactory;
        this.offsets = offsets;
    }

    void add(Definition definition) {
        definitions.add(definition);
    }

    void registerType(Node declaration, TypeEntry entry) {
        types.put(declaration, entry);
    }

    /**
     * Type enclosing a member, when that type was registered in this file.
     */
    TypeEntry ownerOf(Node member) {
        return member.getParentNode().map(types::get).orElse(null);
    }

    String packageDescriptor() {
        return Descriptors.packagePath(javaPackage);
    }

    /**
     * 0 for the first callable of that name under the owner, then 1, 2, ...
     */
    int nextOverload(String ownerDescriptor, String name) {
        return overloads.merge(ownerDescriptor + name, 1, Integer::sum) - 1;
    }

    Symbol symbol(String descriptor) {
        return symbolFactory.build(scope, descriptor);
    }

    SourcePosition position(Node node) {
        return offsets.position(node);
    }
}
