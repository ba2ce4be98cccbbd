package com.purchasingpower.codegraph.extraction;

import com.google.common.base.Strings;
import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.SymbolProperties;
import com.purchasingpower.codegraph.model.symbol.Symbol;
import org.springframework.stereotype.Component;

/**
 * Builds symbols for entities of the indexed service from the configured
 * scheme, manager and package. Without a configured package name and version
 * the service name and version stand in for them.
 */
@Component
public class SymbolFactory {

    private final SymbolProperties symbolProperties;

    public SymbolFactory(CodeGraphProperties properties) {
        this.symbolProperties = properties.getSymbol();
    }

    public Symbol build(ProjectScope scope, String descriptor) {
        String packageName = Strings.isNullOrEmpty(symbolProperties.getPackageName())
                ? scope.getServiceName()
                : symbolProperties.getPackageName();
        String version = Strings.isNullOrEmpty(symbolProperties.getPackageVersion())
                ? scope.getServiceVersion()
                : symbolProperties.getPackageVersion();
        return build(packageName, version, descriptor);
    }

    public Symbol build(String packageName, String version, String descriptor) {
        return Symbol.of(symbolProperties.getScheme(), symbolProperties.getManager(), packageName, version, descriptor);
    }
}
