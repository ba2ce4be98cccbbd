package com.purchasingpower.codegraph.knowledge;

import java.util.Set;

/**
 * What a subgraph removal deleted.
 *
 * @param nodesDeleted   number of nodes removed
 * @param deletedSymbols formatted symbols whose nodes were removed
 * @param deletedModules module fqns whose nodes were removed
 */
public record RemovalResult(int nodesDeleted, Set<String> deletedSymbols, Set<String> deletedModules) {

    public static RemovalResult none() {
        return new RemovalResult(0, Set.of(), Set.of());
    }
}
