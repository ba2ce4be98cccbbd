package com.purchasingpower.codegraph.extraction.javaparser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.purchasingpower.codegraph.exception.ExtractionException;
import com.purchasingpower.codegraph.extraction.ExtractionSession;
import com.purchasingpower.codegraph.extraction.ProjectScope;
import com.purchasingpower.codegraph.extraction.SymbolFactory;
import com.purchasingpower.codegraph.model.graph.FileExtraction;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.sync.ByteOffsetCalculator;
import lombok.extern.slf4j.Slf4j;

import java.util.stream.Collectors;

/**
 * Per-run native extraction. The parser instance is not shared between runs.
 *
 * <p>Traversal is pre-order over type members only: bodies of methods,
 * initializers, anonymous classes and enum constants are local scope and are
 * not indexed.
 */
@Slf4j
class JavaParserSession implements ExtractionSession {

    private final ProjectScope scope;
    private final SymbolFactory symbolFactory;
    private final JavaParser parser;
    private final JavaDeclarationHandlers handlers = new JavaDeclarationHandlers();

    JavaParserSession(ProjectScope scope, SymbolFactory symbolFactory, ParserConfiguration.LanguageLevel languageLevel) {
        this.scope = scope;
        this.symbolFactory = symbolFactory;
        this.parser = new JavaParser(new ParserConfiguration().setLanguageLevel(languageLevel));
    }

    @Override
    public FileExtraction extract(SourceFile file, String content) {
        ParseResult<CompilationUnit> result = parser.parse(content);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(Problem::getVerboseMessage)
                    .collect(Collectors.joining("; "));
            throw new ExtractionException(file.getPath(), "Parse failed: " + problems);
        }
        CompilationUnit cu = result.getResult().get();
        String javaPackage = cu.getPackageDeclaration().map(PackageDeclaration::getNameAsString).orElse("");

        JavaFileState state = new JavaFileState(file.getPath(), javaPackage, scope, symbolFactory,
                TokenOffsets.index(cu, ByteOffsetCalculator.of(content)));
        for (TypeDeclaration<?> type : cu.getTypes()) {
            visit(type, state);
        }

        FileExtraction extraction = FileExtraction.builder()
                .filePath(file.getPath())
                .moduleName(javaPackage)
                .definitions(state.getDefinitions())
                .build();
        log.debug("🌳 {}", extraction.summary());
        return extraction;
    }

    private void visit(Node node, JavaFileState state) {
        DeclarationKind.classify(node).ifPresent(kind -> handlers.dispatch(kind, node, state));
        if (node instanceof EnumDeclaration) {
            for (EnumConstantDeclaration constant : ((EnumDeclaration) node).getEntries()) {
                visit(constant, state);
            }
        }
        if (node instanceof TypeDeclaration) {
            for (BodyDeclaration<?> member : ((TypeDeclaration<?>) node).getMembers()) {
                visit(member, state);
            }
        }
    }
}
