package org.gts3.atlantis.stuckpoint.program;

import java.util.List;
import java.util.Objects;

/**
 * Fully specified method signature: declaring class, name, return type and parameter types.
 *
 * Types use Java source notation ({@code int}, {@code byte[]}, {@code java.lang.String}). The
 * string form follows Soot, e.g. {@code <com.example.Fuzzer: void fuzzerTestOneInput(byte[])>}.
 */
public final class MethodSignature implements Comparable<MethodSignature> {
    private final String declaringClass;
    private final String name;
    private final String returnType;
    private final List<String> parameterTypes;

    public MethodSignature(String declaringClass, String name, String returnType, List<String> parameterTypes) {
        this.declaringClass = Objects.requireNonNull(declaringClass, "declaringClass");
        this.name = Objects.requireNonNull(name, "name");
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        this.parameterTypes = List.copyOf(parameterTypes);
    }

    /**
     * Parses a signature in Soot notation.
     *
     * @param signature e.g. {@code <a.B: int foo(int,java.lang.String)>}
     * @throws IllegalArgumentException If the string is not a Soot method signature
     */
    public static MethodSignature parse(String signature) {
        String s = signature.trim();
        if (!s.startsWith("<") || !s.endsWith(">")) {
            throw new IllegalArgumentException("Method signature must be enclosed in angle brackets: " + signature);
        }
        s = s.substring(1, s.length() - 1);
        int colon = s.indexOf(':');
        int open = s.indexOf('(');
        int close = s.lastIndexOf(')');
        if (colon <= 0 || open < colon || close < open || close != s.length() - 1) {
            throw new IllegalArgumentException("Malformed method signature: " + signature);
        }
        String declaringClass = s.substring(0, colon).trim();
        String[] returnAndName = s.substring(colon + 1, open).trim().split("\\s+");
        if (returnAndName.length != 2) {
            throw new IllegalArgumentException("Malformed method signature: " + signature);
        }
        return new MethodSignature(declaringClass, returnAndName[1], returnAndName[0],
                splitParameterList(s.substring(open + 1, close)));
    }

    /**
     * Splits a comma separated parameter list, ignoring whitespace. An empty list yields no parameters.
     */
    public static List<String> splitParameterList(String parameters) {
        String trimmed = parameters.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        String[] parts = trimmed.split(",", -1);
        String[] result = new String[parts.length];
        for (int i = 0; i < parts.length; i++) {
            result[i] = parts[i].trim();
            if (result[i].isEmpty()) {
                throw new IllegalArgumentException("Empty parameter type in: (" + parameters + ")");
            }
        }
        return List.of(result);
    }

    public String getDeclaringClass() {
        return declaringClass;
    }

    public String getName() {
        return name;
    }

    public String getReturnType() {
        return returnType;
    }

    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    /**
     * The signature without declaring class, e.g. {@code void foo(int)}. Overriding methods share it.
     */
    public String getSubSignature() {
        return returnType + " " + name + "(" + String.join(",", parameterTypes) + ")";
    }

    @Override
    public int compareTo(MethodSignature other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MethodSignature)) return false;
        MethodSignature that = (MethodSignature) o;
        return declaringClass.equals(that.declaringClass) && name.equals(that.name)
                && returnType.equals(that.returnType) && parameterTypes.equals(that.parameterTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(declaringClass, name, returnType, parameterTypes);
    }

    @Override
    public String toString() {
        return "<" + declaringClass + ": " + getSubSignature() + ">";
    }
}
