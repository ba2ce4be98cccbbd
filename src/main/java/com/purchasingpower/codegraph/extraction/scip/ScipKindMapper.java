package com.purchasingpower.codegraph.extraction.scip;

import com.purchasingpower.codegraph.extraction.scip.proto.Scip;
import com.purchasingpower.codegraph.model.graph.DefinitionKind;
import com.purchasingpower.codegraph.model.symbol.SymbolKind;

import java.util.Optional;

/**
 * Maps SCIP symbol kinds onto the entity model.
 */
final class ScipKindMapper {

    private ScipKindMapper() {
    }

    /**
     * Unrecognized kinds become {@link SymbolKind#VARIABLE}; an unspecified kind
     * is inferred from the descriptor.
     */
    static SymbolKind symbolKind(Scip.SymbolInformation.Kind kind, String descriptor) {
        return switch (kind) {
            case UnspecifiedKind -> SymbolKind.inferFromDescriptor(descriptor);
            case Class, Struct, Enum, Type -> SymbolKind.TYPE;
            case Interface -> SymbolKind.INTERFACE;
            case Function, StaticMethod -> SymbolKind.FUNCTION;
            case Method, Constructor, AbstractMethod -> SymbolKind.METHOD;
            case Field, StaticField, EnumMember -> SymbolKind.FIELD;
            case Constant -> SymbolKind.CONSTANT;
            case Parameter -> SymbolKind.PARAMETER;
            case Namespace, Package -> SymbolKind.PACKAGE;
            default -> SymbolKind.VARIABLE;
        };
    }

    /**
     * Definition kind for a symbol kind; packages and locals have no Definition node.
     */
    static Optional<DefinitionKind> definitionKind(SymbolKind kind) {
        return switch (kind) {
            case TYPE -> Optional.of(DefinitionKind.CLASS);
            case INTERFACE -> Optional.of(DefinitionKind.INTERFACE);
            case FUNCTION -> Optional.of(DefinitionKind.FUNCTION);
            case METHOD -> Optional.of(DefinitionKind.METHOD);
            case PARAMETER -> Optional.of(DefinitionKind.PARAMETER);
            case FIELD, VARIABLE, CONSTANT -> Optional.of(DefinitionKind.VARIABLE);
            case PACKAGE, LOCAL -> Optional.empty();
        };
    }
}
