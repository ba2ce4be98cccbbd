package com.purchasingpower.codegraph.model.graph;

import com.purchasingpower.codegraph.model.symbol.Symbol;
import com.purchasingpower.codegraph.model.symbol.SymbolKind;
import lombok.Builder;
import lombok.Data;

/**
 * One declared entity extracted from a file.
 *
 * <p>Identity is (service, filePath, signature). {@code parentSignature} names the
 * enclosing definition of the same file, or is {@code null} for module-level
 * containment.
 */
@Data
@Builder
public class Definition {

    private DefinitionKind kind;
    private String name;
    private String signature;
    private Symbol symbol;
    private String filePath;
    private String parentSignature;
    private SourcePosition position;

    /** Java type form: class, interface, enum, record, annotation, or the declared type of a variable. */
    private String type;
    private String returnType;
    private boolean exported;
    private boolean constant;
    private Integer parameterIndex;
    private String docstring;

    /**
     * Symbol kind from the definition kind, with constants singled out.
     */
    public SymbolKind getSymbolKind() {
        if (kind == DefinitionKind.VARIABLE && constant) {
            return SymbolKind.CONSTANT;
        }
        return kind.getSymbolKind();
    }

    public SymbolMetadata toSymbolMetadata() {
        return new SymbolMetadata(symbol.format(), getSymbolKind(), name, docstring);
    }
}
