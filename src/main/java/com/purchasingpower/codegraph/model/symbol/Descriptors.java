package com.purchasingpower.codegraph.model.symbol;

import com.google.common.base.Strings;

import java.util.regex.Pattern;

/**
 * Builds and inspects symbol descriptors.
 *
 * <p>Grammar, following the SCIP conventions:
 * <ul>
 *   <li>package: {@code com/example/}</li>
 *   <li>type: {@code com/example/Foo#}, nested {@code com/example/Foo#Inner#}</li>
 *   <li>callable: {@code com/example/Foo#bar().}, overloads {@code bar(+1).}, constructors {@code `<init>`().}</li>
 *   <li>field: {@code com/example/Foo#count.}</li>
 *   <li>parameter: {@code param com/example/Foo#bar().(x)}</li>
 *   <li>local: {@code local x}</li>
 * </ul>
 * Names that are not plain identifiers are wrapped in backticks.
 */
public final class Descriptors {

    public static final String LOCAL_PREFIX = "local ";
    public static final String PARAM_PREFIX = "param ";
    public static final String CONSTRUCTOR_NAME = "<init>";

    private static final Pattern SIMPLE_NAME = Pattern.compile("[A-Za-z0-9_$]+");

    private Descriptors() {
    }

    /**
     * {@code com.example} becomes {@code com/example/}; the default package is the empty string.
     */
    public static String packagePath(String javaPackage) {
        if (Strings.isNullOrEmpty(javaPackage)) {
            return "";
        }
        return javaPackage.replace('.', '/') + "/";
    }

    public static String type(String owner, String name) {
        return Strings.nullToEmpty(owner) + escape(name) + "#";
    }

    public static String callable(String owner, String name, int overload) {
        String disambiguator = overload == 0 ? "" : "+" + overload;
        return Strings.nullToEmpty(owner) + escape(name) + "(" + disambiguator + ").";
    }

    public static String field(String owner, String name) {
        return Strings.nullToEmpty(owner) + escape(name) + ".";
    }

    public static String parameter(String callableDescriptor, String name) {
        return PARAM_PREFIX + callableDescriptor + "(" + name + ")";
    }

    /**
     * Last descriptor segment with its suffix stripped: {@code com/example/Foo#bar(+1).} gives {@code bar}.
     */
    public static String displayName(String descriptor) {
        if (Strings.isNullOrEmpty(descriptor)) {
            return "";
        }
        if (descriptor.startsWith(LOCAL_PREFIX)) {
            return descriptor.substring(LOCAL_PREFIX.length());
        }
        if (descriptor.startsWith(PARAM_PREFIX)) {
            int open = descriptor.lastIndexOf('(');
            return descriptor.substring(open + 1, descriptor.length() - 1);
        }
        String trimmed = stripSuffix(descriptor);
        if (trimmed.endsWith("`")) {
            int open = trimmed.lastIndexOf('`', trimmed.length() - 2);
            return trimmed.substring(open + 1, trimmed.length() - 1);
        }
        int start = Math.max(Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('#')), trimmed.lastIndexOf('.'));
        return trimmed.substring(start + 1);
    }

    /**
     * Descriptor of the enclosing entity, or {@code null} when the owner is a package.
     */
    public static String owner(String descriptor) {
        if (Strings.isNullOrEmpty(descriptor) || descriptor.startsWith(LOCAL_PREFIX)) {
            return null;
        }
        if (descriptor.startsWith(PARAM_PREFIX)) {
            String rest = descriptor.substring(PARAM_PREFIX.length());
            return rest.substring(0, rest.lastIndexOf('('));
        }
        String trimmed = stripSuffix(descriptor);
        int hash = trimmed.lastIndexOf('#');
        if (hash < 0) {
            return null;
        }
        return trimmed.substring(0, hash + 1);
    }

    /**
     * Java package of a descriptor: {@code com/example/Foo#bar().} gives {@code com.example}.
     */
    public static String javaPackage(String descriptor) {
        if (Strings.isNullOrEmpty(descriptor)) {
            return "";
        }
        String path = descriptor.startsWith(PARAM_PREFIX) ? descriptor.substring(PARAM_PREFIX.length()) : descriptor;
        int end = path.length();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '#' || c == '(' || c == '.') {
                end = i;
                break;
            }
        }
        int slash = path.lastIndexOf('/', end - 1);
        if (slash < 0) {
            return "";
        }
        return path.substring(0, slash).replace('/', '.');
    }

    static String escape(String name) {
        return SIMPLE_NAME.matcher(name).matches() ? name : "`" + name + "`";
    }

    private static String stripSuffix(String descriptor) {
        if (descriptor.endsWith(").")) {
            return descriptor.substring(0, descriptor.lastIndexOf('('));
        }
        if (descriptor.endsWith("#") || descriptor.endsWith("/") || descriptor.endsWith(".")) {
            return descriptor.substring(0, descriptor.length() - 1);
        }
        return descriptor;
    }
}
