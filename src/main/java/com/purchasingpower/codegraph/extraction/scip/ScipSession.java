package com.purchasingpower.codegraph.extraction.scip;

import com.purchasingpower.codegraph.exception.ExtractionException;
import com.purchasingpower.codegraph.exception.MalformedSymbolException;
import com.purchasingpower.codegraph.extraction.ExtractionSession;
import com.purchasingpower.codegraph.extraction.scip.proto.Scip;
import com.purchasingpower.codegraph.model.graph.Definition;
import com.purchasingpower.codegraph.model.graph.DefinitionKind;
import com.purchasingpower.codegraph.model.graph.FileExtraction;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SourcePosition;
import com.purchasingpower.codegraph.model.graph.SymbolMetadata;
import com.purchasingpower.codegraph.model.graph.SymbolReference;
import com.purchasingpower.codegraph.model.symbol.Descriptors;
import com.purchasingpower.codegraph.model.symbol.Symbol;
import com.purchasingpower.codegraph.model.symbol.SymbolKind;
import com.purchasingpower.codegraph.sync.ByteOffsetCalculator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-run view of a decoded SCIP index.
 *
 * <p>Byte offsets are recomputed from the tool's line/character ranges against
 * the file text; they are {@link SourcePosition#UNKNOWN} when a range does not
 * fit the file.
 */
@Slf4j
class ScipSession implements ExtractionSession {

    private static final int DEFINITION_ROLE = Scip.SymbolRole.Definition_VALUE;
    private static final Pattern PACKAGE_DECLARATION = Pattern.compile("^\\s*package\\s+([\\w.]+)\\s*;", Pattern.MULTILINE);
    private static final Pattern PUBLIC_MODIFIER = Pattern.compile("\\bpublic\\b");

    private final ScipIndex index;
    private final Path artifact;
    private final boolean keepArtifact;

    ScipSession(ScipIndex index, Path artifact, boolean keepArtifact) {
        this.index = index;
        this.artifact = artifact;
        this.keepArtifact = keepArtifact;
    }

    @Override
    public FileExtraction extract(SourceFile file, String content) {
        Scip.Document document = index.document(file.getPath());
        if (document == null) {
            log.debug("No SCIP document for {}", file.getPath());
            return FileExtraction.empty(file.getPath(), packageFromSource(content));
        }

        ByteOffsetCalculator offsets = ByteOffsetCalculator.of(content);
        Map<String, Definition> definitions = new LinkedHashMap<>();
        List<SymbolReference> references = new ArrayList<>();
        int malformed = 0;

        for (Scip.Occurrence occurrence : document.getOccurrencesList()) {
            String value = occurrence.getSymbol();
            if (value.isEmpty() || Symbol.isLocal(value)) {
                continue;
            }
            Symbol symbol;
            try {
                symbol = Symbol.parse(value);
            } catch (MalformedSymbolException e) {
                malformed++;
                continue;
            }
            SymbolMetadata metadata = Optional.ofNullable(index.symbol(value)).orElseGet(() -> SymbolMetadata.inferred(symbol));
            SourcePosition position = position(occurrence.getRangeList(), offsets, file.getPath());

            if ((occurrence.getSymbolRoles() & DEFINITION_ROLE) != 0) {
                if (!definitions.containsKey(value)) {
                    toDefinition(file, symbol, metadata, occurrence, position, offsets)
                            .ifPresent(definition -> definitions.put(value, definition));
                }
            } else {
                references.add(SymbolReference.builder()
                        .filePath(file.getPath())
                        .target(metadata)
                        .position(position)
                        .build());
            }
        }

        linkParents(definitions);
        List<Definition> ordered = new ArrayList<>(definitions.values());
        ordered.sort(Comparator.comparingInt(definition -> depth(definition, definitions)));

        String moduleName = ordered.stream()
                .map(definition -> Descriptors.javaPackage(definition.getSymbol().descriptor()))
                .filter(name -> !name.isEmpty())
                .findFirst()
                .orElseGet(() -> packageFromSource(content));

        return FileExtraction.builder()
                .filePath(file.getPath())
                .moduleName(moduleName)
                .definitions(ordered)
                .references(references)
                .malformedSymbols(malformed)
                .build();
    }

    @Override
    public List<SymbolMetadata> sharedSymbols() {
        return index.getExternalSymbols();
    }

    @Override
    public void close() {
        if (keepArtifact) {
            log.info("🧭 Keeping SCIP artifact {}", artifact);
            return;
        }
        deleteArtifact(artifact);
    }

    static void deleteArtifact(Path artifact) {
        Path directory = artifact.getParent();
        try {
            Files.deleteIfExists(artifact);
            if (directory != null) {
                Files.deleteIfExists(directory.resolve("indexer.log"));
                Files.deleteIfExists(directory);
            }
        } catch (IOException e) {
            log.warn("⚠️ Could not delete SCIP artifact {}: {}", artifact, e.getMessage());
        }
    }

    private Optional<Definition> toDefinition(SourceFile file, Symbol symbol, SymbolMetadata metadata,
                                              Scip.Occurrence occurrence, SourcePosition namePosition,
                                              ByteOffsetCalculator offsets) {
        Optional<DefinitionKind> kind = ScipKindMapper.definitionKind(metadata.kind());
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        SourcePosition span = occurrence.getEnclosingRangeCount() > 0
                ? position(occurrence.getEnclosingRangeList(), offsets, file.getPath())
                : namePosition;
        boolean exported = kind.get() != DefinitionKind.PARAMETER
                && PUBLIC_MODIFIER.matcher(offsets.line(namePosition.startLine())).find();
        return Optional.of(Definition.builder()
                .kind(kind.get())
                .name(metadata.displayName())
                .signature(symbol.format())
                .symbol(symbol)
                .filePath(file.getPath())
                .position(span)
                .exported(exported)
                .constant(metadata.kind() == SymbolKind.CONSTANT)
                .docstring(metadata.documentation())
                .build());
    }

    /**
     * A definition is nested under the definition of its owner descriptor when
     * the owner is defined in the same file.
     */
    private static void linkParents(Map<String, Definition> definitions) {
        for (Definition definition : definitions.values()) {
            String owner = Descriptors.owner(definition.getSymbol().descriptor());
            if (owner == null) {
                continue;
            }
            String ownerSymbol = definition.getSymbol().withDescriptor(owner).format();
            if (definitions.containsKey(ownerSymbol)) {
                definition.setParentSignature(ownerSymbol);
            }
        }
    }

    private static int depth(Definition definition, Map<String, Definition> definitions) {
        int depth = 0;
        Definition current = definition;
        while (current.getParentSignature() != null && depth < definitions.size()) {
            current = definitions.get(current.getParentSignature());
            depth++;
        }
        return depth;
    }

    /**
     * SCIP ranges are 0-based {@code [startLine, startChar, endLine, endChar]}, or
     * three elements when start and end share a line.
     */
    private static SourcePosition position(List<Integer> range, ByteOffsetCalculator offsets, String path) {
        if (range.size() != 3 && range.size() != 4) {
            throw new ExtractionException(path, "Invalid SCIP range " + range);
        }
        int startLine = range.get(0) + 1;
        int startColumn = range.get(1) + 1;
        int endLine = range.size() == 4 ? range.get(2) + 1 : startLine;
        int endColumn = (range.size() == 4 ? range.get(3) : range.get(2)) + 1;
        return offsets.position(startLine, startColumn, endLine, endColumn);
    }

    private static String packageFromSource(String content) {
        Matcher matcher = PACKAGE_DECLARATION.matcher(content);
        return matcher.find() ? matcher.group(1) : "";
    }
}
