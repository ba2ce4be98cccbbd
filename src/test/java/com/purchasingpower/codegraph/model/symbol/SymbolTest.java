package com.purchasingpower.codegraph.model.symbol;

import com.purchasingpower.codegraph.exception.MalformedSymbolException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Symbol Tests")
class SymbolTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "scip-java maven demo 1.0.0 com/example/Greeter#",
            "scip-java maven demo 1.0.0 com/example/Greeter#greet().",
            "scip-java maven demo 1.0.0 com/example/Greeter#greet(+1).",
            "scip-java maven demo 1.0.0 com/example/Greeter#count.",
            "scip-java maven demo 1.0.0 param com/example/Greeter#greet().(name)",
            "scip-java maven demo 1.0.0 local x",
            "semanticdb maven maven/org.slf4j/slf4j-api 2.0.9 org/slf4j/Logger#info(+3)."
    })
    @DisplayName("Should format a parsed symbol back to the same string")
    void parseThenFormat_ShouldRoundTrip(String value) {
        assertEquals(value, Symbol.parse(value).format());
    }

    @Test
    @DisplayName("Should split the five fields and keep spaces inside the descriptor")
    void parse_ShouldKeepDescriptorSpaces() {
        Symbol symbol = Symbol.parse("scip-java maven demo 1.0.0 local x");

        assertThat(symbol.scheme()).isEqualTo("scip-java");
        assertThat(symbol.manager()).isEqualTo("maven");
        assertThat(symbol.packageName()).isEqualTo("demo");
        assertThat(symbol.version()).isEqualTo("1.0.0");
        assertThat(symbol.descriptor()).isEqualTo("local x");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "local 3",
            "scip-java maven demo com/example/Greeter#",
            "scip-java  maven demo 1.0.0 com/example/Greeter#",
            "scip-java maven demo 1.0.0 "
    })
    @DisplayName("Should reject strings that are not five space-separated fields")
    void parse_ShouldRejectMalformedInput(String value) {
        assertThatThrownBy(() -> Symbol.parse(value))
                .isInstanceOf(MalformedSymbolException.class)
                .hasMessageContaining("Malformed symbol");
    }

    @Test
    @DisplayName("Should reject null input as malformed")
    void parse_ShouldRejectNull() {
        assertThatThrownBy(() -> Symbol.parse(null)).isInstanceOf(MalformedSymbolException.class);
    }

    @Test
    @DisplayName("Should not build a symbol whose fields would not parse back")
    void of_ShouldRejectSpacesInFields() {
        assertThatThrownBy(() -> Symbol.of("scip-java", "maven", "my service", "1.0.0", "Foo#"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should derive the display name from the descriptor")
    void displayName_ShouldStripDescriptorSuffix() {
        assertThat(Symbol.parse("scip-java maven demo 1.0.0 com/example/Greeter#greet(+1).").displayName())
                .isEqualTo("greet");
        assertThat(Symbol.parse("scip-java maven demo 1.0.0 com/example/Greeter#`<init>`().").displayName())
                .isEqualTo("<init>");
    }

    @Test
    @DisplayName("Should recognize document-scoped local symbols")
    void isLocal_ShouldMatchLocalPrefix() {
        assertThat(Symbol.isLocal("local 12")).isTrue();
        assertThat(Symbol.isLocal("scip-java maven demo 1.0.0 com/example/Greeter#")).isFalse();
    }
}
