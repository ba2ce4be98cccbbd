package com.purchasingpower.codegraph.model.graph;

import com.purchasingpower.codegraph.model.symbol.Descriptors;
import com.purchasingpower.codegraph.model.symbol.Symbol;
import com.purchasingpower.codegraph.model.symbol.SymbolKind;

/**
 * Properties of a Symbol node.
 *
 * @param symbol        formatted symbol string, the merge key
 * @param kind          symbol kind
 * @param displayName   short human readable name
 * @param documentation free text, may be {@code null}
 */
public record SymbolMetadata(String symbol, SymbolKind kind, String displayName, String documentation) {

    public static SymbolMetadata inferred(Symbol symbol) {
        return new SymbolMetadata(symbol.format(),
                SymbolKind.inferFromDescriptor(symbol.descriptor()),
                Descriptors.displayName(symbol.descriptor()),
                null);
    }

    /**
     * Fills the blanks of this entry from another entry for the same symbol.
     */
    public SymbolMetadata enrich(SymbolMetadata other) {
        if (other == null || !symbol.equals(other.symbol)) {
            return this;
        }
        return new SymbolMetadata(symbol,
                kind != null ? kind : other.kind,
                isBlank(displayName) ? other.displayName : displayName,
                isBlank(documentation) ? other.documentation : documentation);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
