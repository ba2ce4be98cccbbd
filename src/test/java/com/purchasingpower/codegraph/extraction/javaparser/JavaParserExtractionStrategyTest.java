package com.purchasingpower.codegraph.extraction.javaparser;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.exception.ExtractionException;
import com.purchasingpower.codegraph.extraction.ExtractionSession;
import com.purchasingpower.codegraph.extraction.ProjectScope;
import com.purchasingpower.codegraph.extraction.StrategyType;
import com.purchasingpower.codegraph.extraction.SymbolFactory;
import com.purchasingpower.codegraph.model.graph.Definition;
import com.purchasingpower.codegraph.model.graph.DefinitionKind;
import com.purchasingpower.codegraph.model.graph.FileExtraction;
import com.purchasingpower.codegraph.model.graph.SourceFile;
import com.purchasingpower.codegraph.model.graph.SourcePosition;
import com.purchasingpower.codegraph.model.symbol.SymbolKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Native Java Extraction Tests")
class JavaParserExtractionStrategyTest {

    private static final String GREETER = """
            package com.example;

            /** Greets people. */
            public class Greeter {
                public static final String PREFIX = "Hi ";
                private int count;

                public Greeter() {
                }

                // café € résumé
                public String greet(String name) {
                    return PREFIX + name;
                }

                public String greet(String name, int times) {
                    return greet(name).repeat(times);
                }

                static int total() { return 0; }

                interface Listener {
                    void onGreet(String name);
                }

                enum Mood { HAPPY, SAD }
            }
            """;

    private JavaParserExtractionStrategy strategy;

    @BeforeEach
    void setUp() {
        CodeGraphProperties properties = new CodeGraphProperties();
        strategy = new JavaParserExtractionStrategy(new SymbolFactory(properties), properties);
    }

    @Test
    @DisplayName("Should emit definitions in pre-order with kinds, signatures and symbols")
    void extract_ShouldEmitDefinitionsInPreOrder() {
        // When
        FileExtraction extraction = extract(GREETER);

        // Then
        assertThat(strategy.type()).isEqualTo(StrategyType.NATIVE);
        assertThat(extraction.getModuleName()).isEqualTo("com.example");
        assertThat(extraction.getReferences()).isEmpty();
        assertThat(extraction.getDefinitions()).extracting(Definition::getSignature).containsExactly(
                "com.example.Greeter",
                "com.example.Greeter#PREFIX",
                "com.example.Greeter#count",
                "com.example.Greeter.<init>()",
                "com.example.Greeter.greet(String) String",
                "com.example.Greeter.greet(String) String#name",
                "com.example.Greeter.greet(String, int) String",
                "com.example.Greeter.greet(String, int) String#name",
                "com.example.Greeter.greet(String, int) String#times",
                "com.example.Greeter.total() int",
                "com.example.Greeter.Listener",
                "com.example.Greeter.Listener.onGreet(String) void",
                "com.example.Greeter.Listener.onGreet(String) void#name",
                "com.example.Greeter.Mood",
                "com.example.Greeter.Mood#HAPPY",
                "com.example.Greeter.Mood#SAD");
    }

    @Test
    @DisplayName("Should describe the class with its docstring and export flag")
    void extract_ShouldDescribeTypes() {
        FileExtraction extraction = extract(GREETER);

        Definition greeter = find(extraction, "com.example.Greeter");
        assertThat(greeter.getKind()).isEqualTo(DefinitionKind.CLASS);
        assertThat(greeter.getName()).isEqualTo("Greeter");
        assertThat(greeter.getType()).isEqualTo("class");
        assertThat(greeter.isExported()).isTrue();
        assertThat(greeter.getDocstring()).isEqualTo("Greets people.");
        assertThat(greeter.getParentSignature()).isNull();
        assertThat(greeter.getSymbol().format()).isEqualTo("semanticdb maven demo 1.0.0 com/example/Greeter#");

        Definition listener = find(extraction, "com.example.Greeter.Listener");
        assertThat(listener.getKind()).isEqualTo(DefinitionKind.INTERFACE);
        assertThat(listener.getParentSignature()).isEqualTo("com.example.Greeter");
        assertThat(listener.isExported()).isFalse();
        assertThat(listener.getSymbol().descriptor()).isEqualTo("com/example/Greeter#Listener#");

        Definition mood = find(extraction, "com.example.Greeter.Mood");
        assertThat(mood.getType()).isEqualTo("enum");
    }

    @Test
    @DisplayName("Should number overloads and separate static functions from methods")
    void extract_ShouldDescribeCallables() {
        FileExtraction extraction = extract(GREETER);

        Definition first = find(extraction, "com.example.Greeter.greet(String) String");
        Definition second = find(extraction, "com.example.Greeter.greet(String, int) String");
        assertThat(first.getKind()).isEqualTo(DefinitionKind.METHOD);
        assertThat(first.getReturnType()).isEqualTo("String");
        assertThat(first.getSymbol().descriptor()).isEqualTo("com/example/Greeter#greet().");
        assertThat(second.getSymbol().descriptor()).isEqualTo("com/example/Greeter#greet(+1).");

        Definition constructor = find(extraction, "com.example.Greeter.<init>()");
        assertThat(constructor.getName()).isEqualTo("Greeter");
        assertThat(constructor.getType()).isEqualTo("constructor");
        assertThat(constructor.getSymbol().descriptor()).isEqualTo("com/example/Greeter#`<init>`().");

        Definition total = find(extraction, "com.example.Greeter.total() int");
        assertThat(total.getKind()).isEqualTo(DefinitionKind.FUNCTION);
        assertThat(total.isExported()).isFalse();

        Definition onGreet = find(extraction, "com.example.Greeter.Listener.onGreet(String) void");
        assertThat(onGreet.isExported()).isTrue();
        assertThat(onGreet.getParentSignature()).isEqualTo("com.example.Greeter.Listener");
    }

    @Test
    @DisplayName("Should emit parameters under their callable with index and type")
    void extract_ShouldDescribeParameters() {
        FileExtraction extraction = extract(GREETER);

        Definition times = find(extraction, "com.example.Greeter.greet(String, int) String#times");
        assertThat(times.getKind()).isEqualTo(DefinitionKind.PARAMETER);
        assertThat(times.getParameterIndex()).isEqualTo(1);
        assertThat(times.getType()).isEqualTo("int");
        assertThat(times.getParentSignature()).isEqualTo("com.example.Greeter.greet(String, int) String");
        assertThat(times.getSymbol().descriptor()).isEqualTo("param com/example/Greeter#greet(+1).(times)");
    }

    @Test
    @DisplayName("Should flag static finals and enum constants as constants")
    void extract_ShouldDescribeVariables() {
        FileExtraction extraction = extract(GREETER);

        Definition prefix = find(extraction, "com.example.Greeter#PREFIX");
        assertThat(prefix.getKind()).isEqualTo(DefinitionKind.VARIABLE);
        assertThat(prefix.isConstant()).isTrue();
        assertThat(prefix.isExported()).isTrue();
        assertThat(prefix.getSymbolKind()).isEqualTo(SymbolKind.CONSTANT);

        Definition count = find(extraction, "com.example.Greeter#count");
        assertThat(count.isConstant()).isFalse();
        assertThat(count.isExported()).isFalse();
        assertThat(count.getType()).isEqualTo("int");
        assertThat(count.getSymbolKind()).isEqualTo(SymbolKind.FIELD);

        Definition happy = find(extraction, "com.example.Greeter.Mood#HAPPY");
        assertThat(happy.isConstant()).isTrue();
        assertThat(happy.getParentSignature()).isEqualTo("com.example.Greeter.Mood");
    }

    @Test
    @DisplayName("Should keep a field and a nested type with the same name apart")
    void extract_FieldAndNestedTypeSharingName_ShouldHaveDistinctSignatures() {
        // Given
        String content = """
                package com.example;

                class Holder {
                    int value;

                    class value {
                        int size;
                    }
                }
                """;

        // When
        FileExtraction extraction = extract(content);

        // Then
        assertThat(extraction.getDefinitions()).extracting(Definition::getSignature)
                .containsExactly("com.example.Holder", "com.example.Holder#value",
                        "com.example.Holder.value", "com.example.Holder.value#size")
                .doesNotHaveDuplicates();
        assertThat(find(extraction, "com.example.Holder#value").getKind()).isEqualTo(DefinitionKind.VARIABLE);
        assertThat(find(extraction, "com.example.Holder.value").getKind()).isEqualTo(DefinitionKind.CLASS);
        assertThat(find(extraction, "com.example.Holder.value#size").getParentSignature())
                .isEqualTo("com.example.Holder.value");
    }

    @Test
    @DisplayName("Should record byte offsets that slice the declaration out of the UTF-8 content")
    void extract_ShouldRecordByteOffsets() {
        FileExtraction extraction = extract(GREETER);
        byte[] bytes = GREETER.getBytes(StandardCharsets.UTF_8);

        // The multi-byte comment precedes greet, so character and byte offsets differ from here on
        assertThat(slice(bytes, find(extraction, "com.example.Greeter#count").getPosition()))
                .isEqualTo("private int count;");
        assertThat(slice(bytes, find(extraction, "com.example.Greeter.greet(String, int) String").getPosition()))
                .startsWith("public String greet(String name, int times) {")
                .endsWith("}");
        assertThat(slice(bytes, find(extraction, "com.example.Greeter.greet(String) String#name").getPosition()))
                .isEqualTo("String name");

        SourcePosition greet = find(extraction, "com.example.Greeter.greet(String) String").getPosition();
        assertThat(greet.startLine()).isEqualTo(12);
        assertThat(greet.endLine()).isEqualTo(14);
        assertThat(greet.startColumn()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should use an empty module for the default package")
    void extract_ShouldHandleDefaultPackage() {
        FileExtraction extraction = extract("class Main { void run() {} }\n");

        assertThat(extraction.getModuleName()).isEmpty();
        assertThat(find(extraction, "Main").getSymbol().descriptor()).isEqualTo("Main#");
        assertThat(find(extraction, "Main.run() void").getSymbol().descriptor()).isEqualTo("Main#run().");
    }

    @Test
    @DisplayName("Should reject files that do not parse")
    void extract_ShouldFailOnSyntaxErrors() {
        assertThatThrownBy(() -> extract("public class Broken {\n  void x( {\n"))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("Parse failed");
    }

    private FileExtraction extract(String content) {
        ProjectScope scope = ProjectScope.builder()
                .projectRoot(Path.of("/tmp/demo"))
                .serviceName("demo")
                .serviceVersion("1.0.0")
                .build();
        SourceFile file = SourceFile.builder()
                .path("src/main/java/com/example/Greeter.java")
                .language("java")
                .build();
        try (ExtractionSession session = strategy.open(scope)) {
            return session.extract(file, content);
        }
    }

    private static Definition find(FileExtraction extraction, String signature) {
        return extraction.getDefinitions().stream()
                .filter(d -> d.getSignature().equals(signature))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No definition " + signature));
    }

    private static String slice(byte[] bytes, SourcePosition position) {
        return new String(Arrays.copyOfRange(bytes, position.startByte(), position.endByte()), StandardCharsets.UTF_8);
    }
}
