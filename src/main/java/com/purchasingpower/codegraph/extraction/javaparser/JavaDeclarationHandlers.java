package com.purchasingpower.codegraph.extraction.javaparser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.purchasingpower.codegraph.extraction.javaparser.JavaFileState.TypeEntry;
import com.purchasingpower.codegraph.model.graph.Definition;
import com.purchasingpower.codegraph.model.graph.DefinitionKind;
import com.purchasingpower.codegraph.model.symbol.Descriptors;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Dispatch table from {@link DeclarationKind} to the function emitting its definitions.
 */
class JavaDeclarationHandlers {

    private final Map<DeclarationKind, DeclarationHandler> handlers = new EnumMap<>(DeclarationKind.class);

    JavaDeclarationHandlers() {
        handlers.put(DeclarationKind.CLASS, this::onType);
        handlers.put(DeclarationKind.INTERFACE, this::onType);
        handlers.put(DeclarationKind.CALLABLE, this::onCallable);
        handlers.put(DeclarationKind.FIELD, this::onField);
    }

    void dispatch(DeclarationKind kind, Node node, JavaFileState state) {
        handlers.get(kind).handle(node, state);
    }

    // =========================================================================
    // Types
    // =========================================================================

    private void onType(Node node, JavaFileState state) {
        TypeDeclaration<?> type = (TypeDeclaration<?>) node;
        TypeEntry owner = state.ownerOf(type);
        String name = type.getNameAsString();
        String ownerDescriptor = owner != null ? owner.descriptor() : state.packageDescriptor();
        String descriptor = Descriptors.type(ownerDescriptor, name);
        String qualifiedName = type.getFullyQualifiedName().orElse(name);
        boolean isInterface = type instanceof ClassOrInterfaceDeclaration
                && ((ClassOrInterfaceDeclaration) type).isInterface();

        Definition definition = Definition.builder()
                .kind(isInterface ? DefinitionKind.INTERFACE : DefinitionKind.CLASS)
                .name(name)
                .signature(qualifiedName)
                .symbol(state.symbol(descriptor))
                .filePath(state.getFilePath())
                .parentSignature(owner != null ? owner.signature() : null)
                .position(state.position(type))
                .type(typeForm(type))
                .exported(type.isPublic() || (owner != null && owner.isInterface() && !type.isPrivate()))
                .docstring(javadoc(type))
                .build();
        state.add(definition);
        state.registerType(type, new TypeEntry(descriptor, qualifiedName, definition.getSignature(), isInterface));
    }

    private static String typeForm(TypeDeclaration<?> type) {
        if (type instanceof EnumDeclaration) {
            return "enum";
        }
        if (type instanceof RecordDeclaration) {
            return "record";
        }
        if (type instanceof AnnotationDeclaration) {
            return "annotation";
        }
        return ((ClassOrInterfaceDeclaration) type).isInterface() ? "interface" : "class";
    }

    // =========================================================================
    // Methods and constructors
    // =========================================================================

    private void onCallable(Node node, JavaFileState state) {
        CallableDeclaration<?> callable = (CallableDeclaration<?>) node;
        TypeEntry owner = state.ownerOf(callable);
        boolean constructor = !(callable instanceof MethodDeclaration);
        String name = constructor ? Descriptors.CONSTRUCTOR_NAME : callable.getNameAsString();

        String ownerDescriptor = owner != null ? owner.descriptor() : state.packageDescriptor();
        String descriptor = Descriptors.callable(ownerDescriptor, name, state.nextOverload(ownerDescriptor, name));
        String returnType = constructor ? null : ((MethodDeclaration) callable).getType().asString();

        List<Parameter> parameters = callable.getParameters();
        String parameterTypes = parameters.stream()
                .map(JavaDeclarationHandlers::parameterType)
                .collect(Collectors.joining(", "));
        String qualifier = owner != null ? owner.qualifiedName() + "." : "";
        String signature = qualifier + name + "(" + parameterTypes + ")" + (returnType != null ? " " + returnType : "");

        boolean inInterface = owner != null && owner.isInterface();
        Definition definition = Definition.builder()
                .kind(callable.isStatic() ? DefinitionKind.FUNCTION : DefinitionKind.METHOD)
                .name(constructor ? callable.getNameAsString() : name)
                .signature(signature)
                .symbol(state.symbol(descriptor))
                .filePath(state.getFilePath())
                .parentSignature(owner != null ? owner.signature() : null)
                .position(state.position(callable))
                .type(constructor ? "constructor" : "method")
                .returnType(returnType)
                .exported(callable.isPublic() || (inInterface && !callable.isPrivate()))
                .docstring(javadoc(callable))
                .build();
        state.add(definition);

        for (int i = 0; i < parameters.size(); i++) {
            Parameter parameter = parameters.get(i);
            String parameterName = parameter.getNameAsString();
            state.add(Definition.builder()
                    .kind(DefinitionKind.PARAMETER)
                    .name(parameterName)
                    .signature(signature + "#" + parameterName)
                    .symbol(state.symbol(Descriptors.parameter(descriptor, parameterName)))
                    .filePath(state.getFilePath())
                    .parentSignature(signature)
                    .position(state.position(parameter))
                    .type(parameterType(parameter))
                    .parameterIndex(i)
                    .build());
        }
    }

    private static String parameterType(Parameter parameter) {
        String type = parameter.getType().asString();
        return parameter.isVarArgs() ? type + "..." : type;
    }

    // =========================================================================
    // Fields and enum constants
    // =========================================================================

    private void onField(Node node, JavaFileState state) {
        TypeEntry owner = state.ownerOf(node);
        if (node instanceof EnumConstantDeclaration) {
            EnumConstantDeclaration constant = (EnumConstantDeclaration) node;
            addVariable(state, owner, constant.getNameAsString(), owner != null ? owner.qualifiedName() : null,
                    true, true, constant, javadoc(constant));
            return;
        }

        FieldDeclaration field = (FieldDeclaration) node;
        boolean inInterface = owner != null && owner.isInterface();
        boolean exported = field.isPublic() || (inInterface && !field.isPrivate());
        boolean constant = (field.isStatic() && field.isFinal()) || inInterface;
        List<VariableDeclarator> variables = field.getVariables();
        for (VariableDeclarator variable : variables) {
            Node span = variables.size() == 1 ? field : variable;
            addVariable(state, owner, variable.getNameAsString(), variable.getType().asString(),
                    exported, constant, span, javadoc(field));
        }
    }

    private void addVariable(JavaFileState state, TypeEntry owner, String name, String type,
                             boolean exported, boolean constant, Node span, String docstring) {
        String ownerDescriptor = owner != null ? owner.descriptor() : state.packageDescriptor();
        // '#' keeps a field apart from a nested type of the same name
        String qualifier = owner != null ? owner.qualifiedName() + "#" : "";
        state.add(Definition.builder()
                .kind(DefinitionKind.VARIABLE)
                .name(name)
                .signature(qualifier + name)
                .symbol(state.symbol(Descriptors.field(ownerDescriptor, name)))
                .filePath(state.getFilePath())
                .parentSignature(owner != null ? owner.signature() : null)
                .position(state.position(span))
                .type(type)
                .exported(exported)
                .constant(constant)
                .docstring(docstring)
                .build());
    }

    private static String javadoc(Node node) {
        if (!(node instanceof NodeWithJavadoc)) {
            return null;
        }
        return ((NodeWithJavadoc<?>) node).getJavadoc()
                .map(doc -> doc.getDescription().toText().trim())
                .filter(text -> !text.isEmpty())
                .orElse(null);
    }
}
