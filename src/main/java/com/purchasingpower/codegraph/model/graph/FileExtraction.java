package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one extraction strategy produced for one file.
 *
 * <p>Definitions are in pre-order, so a parent always precedes its children.
 */
@Data
@Builder
public class FileExtraction {

    private String filePath;

    /** Java package of the file; empty for the default package. */
    private String moduleName;

    @Builder.Default
    private List<Definition> definitions = new ArrayList<>();

    @Builder.Default
    private List<SymbolReference> references = new ArrayList<>();

    /** Symbols the strategy dropped because they did not decode. */
    private int malformedSymbols;

    public static FileExtraction empty(String filePath, String moduleName) {
        return FileExtraction.builder()
                .filePath(filePath)
                .moduleName(moduleName)
                .build();
    }

    public String summary() {
        return String.format("%s: %d definitions, %d references", filePath, definitions.size(), references.size());
    }
}
