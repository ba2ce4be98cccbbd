package com.purchasingpower.codegraph.extraction.scip;

import com.purchasingpower.codegraph.extraction.scip.proto.Scip;
import com.purchasingpower.codegraph.model.graph.SymbolMetadata;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Decoded SCIP index: documents by relative path and one symbol table for
 * external and document symbols.
 */
@Getter
@Builder
public class ScipIndex {

    private final String toolName;
    private final String toolVersion;
    private final String projectRoot;

    private final Map<String, Scip.Document> documents;
    private final Map<String, SymbolMetadata> symbols;
    private final List<SymbolMetadata> externalSymbols;

    /** Symbols in the symbol tables that did not decode. */
    private final int malformedSymbols;

    public Scip.Document document(String relativePath) {
        return documents.get(relativePath);
    }

    public SymbolMetadata symbol(String symbol) {
        return symbols.get(symbol);
    }
}
