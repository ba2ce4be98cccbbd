package com.purchasingpower.codegraph.extraction;

import com.purchasingpower.codegraph.model.graph.FileExtraction;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SymbolMetadata;

import java.util.List;

/**
 * One run of a strategy over one project.
 */
public interface ExtractionSession extends AutoCloseable {

    /**
     * Extract one file. Pure: nothing is written.
     *
     * @param file    walked file
     * @param content file text, decoded from the bytes that were hashed
     * @throws com.purchasingpower.codegraph.exception.ExtractionException if the file cannot be processed
     */
    FileExtraction extract(SourceFile file, String content);

    /**
     * Symbols known to the run that belong to no file, e.g. external dependencies.
     */
    default List<SymbolMetadata> sharedSymbols() {
        return List.of();
    }

    @Override
    default void close() {
    }
}
