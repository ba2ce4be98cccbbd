package com.purchasingpower.codegraph.extraction.scip;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.extraction.ExtractionSession;
import com.purchasingpower.codegraph.extraction.ProjectScope;
import com.purchasingpower.codegraph.extraction.SymbolFactory;
import com.purchasingpower.codegraph.extraction.javaparser.JavaParserExtractionStrategy;
import com.purchasingpower.codegraph.model.graph.FileExtraction;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Both strategies must name the same declarations with the same symbol, so a
 * project can switch strategy without orphaning Symbol nodes.
 */
@DisplayName("Cross-Strategy Symbol Identity Tests")
class CrossStrategySymbolIdentityTest {

    @Test
    @DisplayName("Should produce identical symbols for types and methods from both strategies")
    void symbols_ShouldMatchAcrossStrategies(@TempDir Path tempDir) throws IOException {
        // Given
        CodeGraphProperties properties = new CodeGraphProperties();
        properties.getSymbol().setPackageName(ScipIndexFixtures.PACKAGE_NAME);
        ProjectScope scope = ProjectScope.builder()
                .projectRoot(tempDir)
                .serviceName("demo")
                .serviceVersion("1.0.0")
                .build();
        SourceFile file = SourceFile.builder().path(ScipIndexFixtures.GREETER_PATH).language("java").build();

        ScipToolRunner toolRunner = mock(ScipToolRunner.class);
        when(toolRunner.run(any())).thenReturn(
                ScipIndexFixtures.write(ScipIndexFixtures.greeterIndex(), tempDir.resolve("scip")));
        ScipExtractionStrategy scip = new ScipExtractionStrategy(toolRunner, new ScipIndexReader(), properties);
        JavaParserExtractionStrategy nativeStrategy =
                new JavaParserExtractionStrategy(new SymbolFactory(properties), properties);

        // When
        FileExtraction fromScip;
        try (ExtractionSession session = scip.open(scope)) {
            fromScip = session.extract(file, ScipIndexFixtures.GREETER);
        }
        FileExtraction fromNative;
        try (ExtractionSession session = nativeStrategy.open(scope)) {
            fromNative = session.extract(file, ScipIndexFixtures.GREETER);
        }

        // Then
        List<String> scipSymbols = fromScip.getDefinitions().stream()
                .map(definition -> definition.getSymbol().format())
                .toList();
        assertThat(scipSymbols).contains(ScipIndexFixtures.GREETER_SYMBOL, ScipIndexFixtures.GREET_SYMBOL);
        assertThat(fromNative.getDefinitions()).extracting(definition -> definition.getSymbol().format())
                .containsAll(scipSymbols);
        assertThat(fromNative.getModuleName()).isEqualTo(fromScip.getModuleName());
    }
}
