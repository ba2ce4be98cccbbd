package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Data;

/**
 * A usage site of a symbol inside a file. Persisted as a Reference node with no
 * natural key, linked to the Symbol it denotes.
 */
@Data
@Builder
public class SymbolReference {

    private String filePath;
    private SymbolMetadata target;
    private SourcePosition position;
}
