package com.purchasingpower.codegraph.extraction.javaparser;

import com.github.javaparser.ParserConfiguration;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.extraction.ExtractionSession;
import com.purchasingpower.codegraph.extraction.ExtractionStrategy;
import com.purchasingpower.codegraph.extraction.ProjectScope;
import com.purchasingpower.codegraph.extraction.StrategyType;
import com.purchasingpower.codegraph.extraction.SymbolFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Native strategy: parses Java sources with JavaParser and emits definitions
 * with exact positions.
 */
@Slf4j
@Component
public class JavaParserExtractionStrategy implements ExtractionStrategy {

    private final SymbolFactory symbolFactory;
    private final ParserConfiguration.LanguageLevel languageLevel;

    public JavaParserExtractionStrategy(SymbolFactory symbolFactory, CodeGraphProperties properties) {
        this.symbolFactory = symbolFactory;
        this.languageLevel = ParserConfiguration.LanguageLevel.valueOf(properties.getSync().getLanguageLevel());
    }

    @Override
    public StrategyType type() {
        return StrategyType.NATIVE;
    }

    @Override
    public ExtractionSession open(ProjectScope scope) {
        log.info("🌳 Native extraction for {} (language level {})", scope.getServiceName(), languageLevel);
        return new JavaParserSession(scope, symbolFactory, languageLevel);
    }
}
