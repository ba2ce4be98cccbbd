package com.purchasingpower.codegraph.model.symbol;

/**
 * Kind recorded on Symbol nodes.
 */
public enum SymbolKind {
    PACKAGE("Package"),
    TYPE("Type"),
    INTERFACE("Interface"),
    METHOD("Method"),
    FUNCTION("Function"),
    FIELD("Field"),
    VARIABLE("Variable"),
    CONSTANT("Constant"),
    PARAMETER("Parameter"),
    LOCAL("Local");

    private final String value;

    SymbolKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Best-effort kind for a descriptor seen without any symbol information.
     */
    public static SymbolKind inferFromDescriptor(String descriptor) {
        if (descriptor == null || descriptor.isEmpty()) {
            return VARIABLE;
        }
        if (descriptor.startsWith(Descriptors.LOCAL_PREFIX)) {
            return LOCAL;
        }
        if (descriptor.startsWith(Descriptors.PARAM_PREFIX)) {
            return PARAMETER;
        }
        boolean hasType = descriptor.indexOf('#') >= 0;
        boolean callable = descriptor.endsWith(").");
        if (callable) {
            return hasType ? METHOD : FUNCTION;
        }
        if (descriptor.endsWith("#")) {
            return TYPE;
        }
        if (descriptor.endsWith("/")) {
            return PACKAGE;
        }
        return hasType ? FIELD : VARIABLE;
    }
}
