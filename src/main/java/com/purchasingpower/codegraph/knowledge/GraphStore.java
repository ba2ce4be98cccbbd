package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.RelationshipType;

import java.util.List;
import java.util.Map;

/**
 * Primitive operations the indexing engine needs from the graph store.
 *
 * <p>Node and relationship ids are opaque strings handed out by the store; the
 * engine never holds object references to persisted entities. The store is
 * responsible for making concurrent merges on the same key safe.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Node Operations
    // =========================================================================

    /**
     * Create-or-update a node by its natural key.
     *
     * <p>Calling this repeatedly with the same labels and match properties never
     * creates a second node.
     *
     * @param labels          labels the node must carry, primary label first
     * @param matchProperties natural key
     * @param setProperties   properties overwritten on every call; {@code null} values are skipped
     * @return node id
     */
    String mergeNode(List<String> labels, Map<String, Object> matchProperties, Map<String, Object> setProperties);

    /**
     * Create a node that has no natural key.
     *
     * @param labels     node labels
     * @param properties node properties; {@code null} values are skipped
     * @return node id
     */
    String createNode(List<String> labels, Map<String, Object> properties);

    // =========================================================================
    // Relationship Operations
    // =========================================================================

    /**
     * Link two nodes. Linking the same pair with the same type again returns the
     * existing relationship with its properties refreshed.
     *
     * @return relationship id
     */
    String createRelationship(String fromId, String toId, RelationshipType type, Map<String, Object> properties);

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * Execute a Cypher statement in a write transaction.
     *
     * @return one map per record
     */
    List<Map<String, Object>> executeQuery(String cypher, Map<String, Object> parameters);

    /**
     * Execute a read-only Cypher statement.
     *
     * @return one map per record
     */
    List<Map<String, Object>> executeReadQuery(String cypher, Map<String, Object> parameters);
}
