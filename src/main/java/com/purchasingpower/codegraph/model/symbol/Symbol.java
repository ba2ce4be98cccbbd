package com.purchasingpower.codegraph.model.symbol;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.exception.MalformedSymbolException;

/**
 * Canonical five-field identifier of a code entity.
 *
 * <p>The formatted form {@code scheme manager package version descriptor} is the
 * natural key of Symbol nodes and the only identity shared by the native and the
 * SCIP extraction strategies. Only the descriptor may contain spaces
 * (e.g. {@code local x}), so parsing splits on the first four spaces.
 *
 * @param scheme      extraction tool identifier, e.g. {@code semanticdb}
 * @param manager     package manager namespace, e.g. {@code maven}
 * @param packageName package the entity belongs to
 * @param version     package version
 * @param descriptor  path of the entity inside the package
 */
public record Symbol(String scheme, String manager, String packageName, String version, String descriptor) {

    private static final int FIELD_COUNT = 5;

    public Symbol {
        Preconditions.checkArgument(isToken(scheme), "scheme must be a non-empty token: %s", scheme);
        Preconditions.checkArgument(isToken(manager), "manager must be a non-empty token: %s", manager);
        Preconditions.checkArgument(isToken(packageName), "packageName must be a non-empty token: %s", packageName);
        Preconditions.checkArgument(isToken(version), "version must be a non-empty token: %s", version);
        Preconditions.checkArgument(descriptor != null && !descriptor.isEmpty(), "descriptor must not be empty");
    }

    public static Symbol of(String scheme, String manager, String packageName, String version, String descriptor) {
        return new Symbol(scheme, manager, packageName, version, descriptor);
    }

    /**
     * Decodes a formatted symbol.
     *
     * @throws MalformedSymbolException if the input does not split into exactly five non-empty fields
     */
    public static Symbol parse(String value) {
        if (value == null || value.isEmpty()) {
            throw new MalformedSymbolException(String.valueOf(value), "empty input");
        }
        String[] parts = value.split(" ", FIELD_COUNT);
        if (parts.length != FIELD_COUNT) {
            throw new MalformedSymbolException(value,
                    "expected " + FIELD_COUNT + " space-separated fields, found " + parts.length);
        }
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                throw new MalformedSymbolException(value, "field " + (i + 1) + " is empty");
            }
        }
        return new Symbol(parts[0], parts[1], parts[2], parts[3], parts[4]);
    }

    /**
     * Document-scoped symbols such as {@code local 3} have no package and never parse.
     */
    public static boolean isLocal(String value) {
        return value != null && value.startsWith(Descriptors.LOCAL_PREFIX);
    }

    public String format() {
        return String.join(" ", scheme, manager, packageName, version, descriptor);
    }

    public Symbol withDescriptor(String newDescriptor) {
        return new Symbol(scheme, manager, packageName, version, newDescriptor);
    }

    public String displayName() {
        return Descriptors.displayName(descriptor);
    }

    @Override
    public String toString() {
        return format();
    }

    private static boolean isToken(String value) {
        return value != null && !value.isEmpty() && value.indexOf(' ') < 0;
    }
}
