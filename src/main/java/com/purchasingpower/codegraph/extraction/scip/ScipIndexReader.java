package com.purchasingpower.codegraph.extraction.scip;

import com.purchasingpower.codegraph.exception.ExternalToolException;
import com.purchasingpower.codegraph.exception.MalformedSymbolException;
import com.purchasingpower.codegraph.extraction.scip.proto.Scip;
import com.purchasingpower.codegraph.model.graph.SymbolMetadata;
import com.purchasingpower.codegraph.model.symbol.Descriptors;
import com.purchasingpower.codegraph.model.symbol.Symbol;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes a protobuf SCIP artifact into a {@link ScipIndex}.
 */
@Slf4j
@Component
public class ScipIndexReader {

    public ScipIndex read(Path artifact) {
        try (InputStream in = Files.newInputStream(artifact)) {
            return toIndex(Scip.Index.parseFrom(in));
        } catch (IOException e) {
            throw new ExternalToolException("Cannot decode SCIP index " + artifact + ": " + e.getMessage(), e);
        }
    }

    /**
     * External symbols are entered first; document symbols enrich an existing
     * entry instead of replacing it.
     */
    ScipIndex toIndex(Scip.Index index) {
        Map<String, SymbolMetadata> symbols = new LinkedHashMap<>();
        List<SymbolMetadata> externals = new ArrayList<>();
        int malformed = 0;

        for (Scip.SymbolInformation info : index.getExternalSymbolsList()) {
            SymbolMetadata metadata = toMetadata(info);
            if (metadata == null) {
                malformed++;
                continue;
            }
            symbols.merge(metadata.symbol(), metadata, SymbolMetadata::enrich);
            externals.add(metadata);
        }

        Map<String, Scip.Document> documents = new HashMap<>();
        for (Scip.Document document : index.getDocumentsList()) {
            documents.put(normalize(document.getRelativePath()), document);
            for (Scip.SymbolInformation info : document.getSymbolsList()) {
                if (Symbol.isLocal(info.getSymbol())) {
                    continue;
                }
                SymbolMetadata metadata = toMetadata(info);
                if (metadata == null) {
                    malformed++;
                    continue;
                }
                symbols.merge(metadata.symbol(), metadata, SymbolMetadata::enrich);
            }
        }

        Scip.Metadata metadata = index.getMetadata();
        log.info("🧭 SCIP index from {} {}: {} documents, {} symbols ({} external, {} malformed)",
                metadata.getToolInfo().getName(), metadata.getToolInfo().getVersion(),
                documents.size(), symbols.size(), externals.size(), malformed);

        return ScipIndex.builder()
                .toolName(metadata.getToolInfo().getName())
                .toolVersion(metadata.getToolInfo().getVersion())
                .projectRoot(metadata.getProjectRoot())
                .documents(documents)
                .symbols(symbols)
                .externalSymbols(externals)
                .malformedSymbols(malformed)
                .build();
    }

    /**
     * @return metadata, or {@code null} when the symbol does not decode
     */
    static SymbolMetadata toMetadata(Scip.SymbolInformation info) {
        Symbol symbol;
        try {
            symbol = Symbol.parse(info.getSymbol());
        } catch (MalformedSymbolException e) {
            log.debug("Skipping malformed SCIP symbol: {}", e.getMessage());
            return null;
        }
        String displayName = info.getDisplayName().isEmpty()
                ? Descriptors.displayName(symbol.descriptor())
                : info.getDisplayName();
        String documentation = info.getDocumentationCount() == 0 ? null : String.join("\n", info.getDocumentationList());
        return new SymbolMetadata(symbol.format(),
                ScipKindMapper.symbolKind(info.getKind(), symbol.descriptor()),
                displayName,
                documentation);
    }

    private static String normalize(String relativePath) {
        String path = relativePath.replace('\\', '/');
        return path.startsWith("./") ? path.substring(2) : path;
    }
}
