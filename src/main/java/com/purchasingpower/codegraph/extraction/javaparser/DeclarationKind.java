package com.purchasingpower.codegraph.extraction.javaparser;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;

import java.util.Optional;

/**
 * Closed set of declaration node kinds the native strategy indexes.
 */
enum DeclarationKind {
    /** Class, enum, record or annotation type. */
    CLASS,
    INTERFACE,
    /** Method or constructor, together with its parameters. */
    CALLABLE,
    /** Field declaration or enum constant. */
    FIELD;

    static Optional<DeclarationKind> classify(Node node) {
        if (node instanceof ClassOrInterfaceDeclaration) {
            return Optional.of(((ClassOrInterfaceDeclaration) node).isInterface() ? INTERFACE : CLASS);
        }
        if (node instanceof EnumDeclaration || node instanceof RecordDeclaration || node instanceof AnnotationDeclaration) {
            return Optional.of(CLASS);
        }
        if (node instanceof CallableDeclaration) {
            return Optional.of(CALLABLE);
        }
        if (node instanceof FieldDeclaration || node instanceof EnumConstantDeclaration) {
            return Optional.of(FIELD);
        }
        return Optional.empty();
    }
}
