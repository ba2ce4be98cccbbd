package com.purchasingpower.codegraph.knowledge;

import com.purchasingpower.codegraph.model.graph.Definition;
import com.purchasingpower.codegraph.model.graph.FileExtraction;
import com.purchasingpower.codegraph.model.graph.NodeLabel;
import com.purchasingpower.codegraph.model.graph.RelationshipType;
import com.purchasingpower.codegraph.model.graph.ServiceInfo;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SourcePosition;
import com.purchasingpower.codegraph.model.graph.SymbolMetadata;
import com.purchasingpower.codegraph.model.graph.SymbolReference;
import com.purchasingpower.codegraph.sync.IndexRunContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts one file's extraction into the graph store.
 *
 * <p>Order per file: File node, Module, Definitions in pre-order with their
 * containment and {@code DEFINES} edges, then References. A failing entity is
 * logged and counted; earlier writes of the file are kept and the next entity
 * is attempted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GraphWriter {

    static final String DEFAULT_PACKAGE = "(default)";

    private final GraphStore graphStore;

    /**
     * Write the file node and everything extracted from it.
     *
     * @throws RuntimeException if the File node itself cannot be written; nothing of the file was persisted then
     */
    public void writeFile(IndexRunContext context, SourceFile file, FileExtraction extraction) {
        String serviceId = ensureService(context);
        String fileId = graphStore.mergeNode(List.of(NodeLabel.FILE.getLabel()),
                Map.of("service", context.getServiceName(), "path", file.getPath()),
                fileProperties(file));
        context.nodeWritten();
        link(context, serviceId, fileId, RelationshipType.CONTAINS, Map.of(), file.getPath());

        String moduleId = ensureModule(context, fileId, extraction.getModuleName());
        String defaultParent = moduleId != null ? moduleId : fileId;

        Map<String, String> written = new HashMap<>();
        for (Definition definition : extraction.getDefinitions()) {
            writeDefinition(context, definition, written, defaultParent);
        }
        for (SymbolReference reference : extraction.getReferences()) {
            writeReference(context, reference, fileId);
        }
    }

    /**
     * Merge symbols that belong to no file, once per run.
     */
    public void writeSharedSymbols(IndexRunContext context, List<SymbolMetadata> symbols) {
        if (context.isSharedSymbolsWritten()) {
            return;
        }
        context.setSharedSymbolsWritten(true);
        for (SymbolMetadata symbol : symbols) {
            try {
                ensureSymbol(context, symbol);
            } catch (RuntimeException e) {
                entityFailed(context, "symbol " + symbol.symbol(), e);
            }
        }
        log.debug("Merged {} shared symbols", symbols.size());
    }

    // =========================================================================
    // Entities
    // =========================================================================

    private String ensureService(IndexRunContext context) {
        if (context.getServiceNodeId() != null) {
            return context.getServiceNodeId();
        }
        ServiceInfo service = context.getService();
        Map<String, Object> properties = new HashMap<>();
        properties.put("language", service.getLanguage());
        properties.put("version", service.getVersion());
        properties.put("repositoryUrl", service.getRepositoryUrl());
        properties.put("lastCommit", service.getLastCommit());
        properties.put("strategy", service.getStrategy());
        String id = graphStore.mergeNode(List.of(NodeLabel.SERVICE.getLabel()), Map.of("name", service.getName()), properties);
        context.nodeWritten();
        context.setServiceNodeId(id);
        return id;
    }

    private String ensureModule(IndexRunContext context, String fileId, String moduleName) {
        String name = moduleName == null || moduleName.isEmpty() ? DEFAULT_PACKAGE : moduleName;
        String fqn = context.getServiceName() + "/" + name;
        String moduleId = context.getModuleIds().get(fqn);
        if (moduleId == null) {
            try {
                Map<String, Object> properties = new HashMap<>();
                properties.put("name", name);
                properties.put("service", context.getServiceName());
                properties.put("type", "package");
                properties.put("isExported", true);
                moduleId = graphStore.mergeNode(List.of(NodeLabel.MODULE.getLabel()), Map.of("fqn", fqn), properties);
                context.nodeWritten();
                context.getModuleIds().put(fqn, moduleId);
            } catch (RuntimeException e) {
                entityFailed(context, "module " + fqn, e);
                return null;
            }
        }
        link(context, fileId, moduleId, RelationshipType.CONTAINS, Map.of(), fqn);
        return moduleId;
    }

    private void writeDefinition(IndexRunContext context, Definition definition, Map<String, String> written,
                                 String defaultParent) {
        String nodeId;
        try {
            nodeId = graphStore.mergeNode(
                    List.of(definition.getKind().getLabel(), NodeLabel.DEFINITION.getLabel()),
                    Map.of("service", context.getServiceName(),
                            "filePath", definition.getFilePath(),
                            "signature", definition.getSignature()),
                    definitionProperties(definition));
            context.nodeWritten();
            written.put(definition.getSignature(), nodeId);
        } catch (RuntimeException e) {
            entityFailed(context, "definition " + definition.getSignature(), e);
            return;
        }

        String parentId = definition.getParentSignature() != null ? written.get(definition.getParentSignature()) : null;
        if (parentId == null && definition.getParentSignature() != null) {
            log.debug("Owner {} not written, linking {} to its module", definition.getParentSignature(), definition.getName());
        }
        link(context, parentId != null ? parentId : defaultParent, nodeId, RelationshipType.CONTAINS, Map.of(),
                definition.getSignature());

        try {
            String symbolId = ensureSymbol(context, definition.toSymbolMetadata());
            link(context, nodeId, symbolId, RelationshipType.DEFINES, Map.of("isExported", definition.isExported()),
                    definition.getSignature());
        } catch (RuntimeException e) {
            entityFailed(context, "symbol " + definition.getSymbol(), e);
        }
    }

    private void writeReference(IndexRunContext context, SymbolReference reference, String fileId) {
        SourcePosition position = reference.getPosition();
        String nodeId;
        try {
            Map<String, Object> properties = positionProperties(position);
            properties.put("service", context.getServiceName());
            properties.put("filePath", reference.getFilePath());
            properties.put("symbol", reference.getTarget().symbol());
            nodeId = graphStore.createNode(List.of(NodeLabel.REFERENCE.getLabel()), properties);
            context.nodeWritten();
        } catch (RuntimeException e) {
            entityFailed(context, "reference to " + reference.getTarget().symbol(), e);
            return;
        }
        link(context, fileId, nodeId, RelationshipType.CONTAINS, Map.of(), reference.getTarget().symbol());
        try {
            String symbolId = ensureSymbol(context, reference.getTarget());
            link(context, nodeId, symbolId, RelationshipType.REFERENCES,
                    Map.of("isDefinition", false, "line", position.startLine(), "column", position.startColumn()),
                    reference.getTarget().symbol());
        } catch (RuntimeException e) {
            entityFailed(context, "symbol " + reference.getTarget().symbol(), e);
        }
    }

    private String ensureSymbol(IndexRunContext context, SymbolMetadata symbol) {
        String cached = context.getSymbolIds().get(symbol.symbol());
        if (cached != null) {
            return cached;
        }
        Map<String, Object> properties = new HashMap<>();
        properties.put("kind", symbol.kind() != null ? symbol.kind().getValue() : null);
        properties.put("displayName", symbol.displayName());
        properties.put("documentation", symbol.documentation());
        String id = graphStore.mergeNode(List.of(NodeLabel.SYMBOL.getLabel()), Map.of("symbol", symbol.symbol()), properties);
        context.nodeWritten();
        context.getSymbolIds().put(symbol.symbol(), id);
        return id;
    }

    private void link(IndexRunContext context, String fromId, String toId, RelationshipType type,
                      Map<String, Object> properties, String subject) {
        try {
            graphStore.createRelationship(fromId, toId, type, properties);
            context.relationshipWritten();
        } catch (RuntimeException e) {
            entityFailed(context, type + " for " + subject, e);
        }
    }

    private static void entityFailed(IndexRunContext context, String entity, RuntimeException e) {
        log.warn("⚠️ Failed to write {}: {}", entity, e.getMessage());
        context.entityFailed();
    }

    // =========================================================================
    // Properties
    // =========================================================================

    private static Map<String, Object> fileProperties(SourceFile file) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("absolutePath", file.getAbsolutePath() != null ? file.getAbsolutePath().toString() : null);
        properties.put("language", file.getLanguage());
        properties.put("hash", file.getHash());
        properties.put("lineCount", file.getLineCount());
        properties.put("size", file.getSize());
        return properties;
    }

    private static Map<String, Object> definitionProperties(Definition definition) {
        Map<String, Object> properties = positionProperties(definition.getPosition());
        properties.put("name", definition.getName());
        properties.put("symbol", definition.getSymbol().format());
        properties.put("type", definition.getType());
        properties.put("returnType", definition.getReturnType());
        properties.put("isExported", definition.isExported());
        properties.put("isConstant", definition.isConstant());
        properties.put("index", definition.getParameterIndex());
        properties.put("docstring", definition.getDocstring());
        properties.put("linesOfCode", definition.getPosition().lineCount());
        return properties;
    }

    private static Map<String, Object> positionProperties(SourcePosition position) {
        Map<String, Object> properties = new HashMap<>();
        properties.put("startLine", position.startLine());
        properties.put("endLine", position.endLine());
        properties.put("startColumn", position.startColumn());
        properties.put("endColumn", position.endColumn());
        properties.put("startByte", position.startByte());
        properties.put("endByte", position.endByte());
        return properties;
    }
}
