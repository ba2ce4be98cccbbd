package com.purchasingpower.codegraph.extraction;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ExtractionStrategyRegistry {

    private final Map<StrategyType, ExtractionStrategy> strategies = new EnumMap<>(StrategyType.class);

    public ExtractionStrategyRegistry(List<ExtractionStrategy> available) {
        for (ExtractionStrategy strategy : available) {
            ExtractionStrategy previous = strategies.put(strategy.type(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Two strategies registered for " + strategy.type());
            }
        }
    }

    public ExtractionStrategy get(StrategyType type) {
        ExtractionStrategy strategy = strategies.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("No extraction strategy registered for " + type);
        }
        return strategy;
    }
}
