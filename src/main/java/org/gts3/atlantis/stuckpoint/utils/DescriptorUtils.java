package org.gts3.atlantis.stuckpoint.utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between JVM method descriptors and the Java type names used in method signatures.
 *
 * A descriptor such as {@code ([BLjava/lang/String;I)V} becomes the parameter list
 * {@code [byte[], java.lang.String, int]} and the return type {@code void}.
 */
public class DescriptorUtils {

    private DescriptorUtils() {
    }

    /**
     * Checks whether a string has the shape of a method descriptor, i.e. {@code (...)R}.
     */
    public static boolean isMethodDescriptor(String descriptor) {
        int close = descriptor.indexOf(')');
        return descriptor.startsWith("(") && close > 0 && close < descriptor.length() - 1;
    }

    /**
     * Returns the Java type names of the parameters of a method descriptor.
     *
     * @param descriptor A method descriptor, e.g. {@code ([BI)V}
     * @return The parameter types in declaration order
     * @throws IllegalArgumentException If the descriptor is malformed
     */
    public static List<String> parameterTypes(String descriptor) {
        if (!isMethodDescriptor(descriptor)) {
            throw new IllegalArgumentException("Not a method descriptor: " + descriptor);
        }
        List<String> result = new ArrayList<>();
        int end = descriptor.indexOf(')');
        int pos = 1;
        while (pos < end) {
            int next = endOfFieldType(descriptor, pos);
            result.add(toJavaType(descriptor.substring(pos, next)));
            pos = next;
        }
        return result;
    }

    /**
     * Returns the Java type name of the return type of a method descriptor.
     *
     * @throws IllegalArgumentException If the descriptor is malformed
     */
    public static String returnType(String descriptor) {
        if (!isMethodDescriptor(descriptor)) {
            throw new IllegalArgumentException("Not a method descriptor: " + descriptor);
        }
        return toJavaType(descriptor.substring(descriptor.indexOf(')') + 1));
    }

    /**
     * Converts one field descriptor ({@code I}, {@code [B}, {@code Ljava/lang/String;}) to a Java type name.
     *
     * @throws IllegalArgumentException If the descriptor is malformed
     */
    public static String toJavaType(String fieldDescriptor) {
        int dimensions = 0;
        while (dimensions < fieldDescriptor.length() && fieldDescriptor.charAt(dimensions) == '[') {
            dimensions++;
        }
        String element = fieldDescriptor.substring(dimensions);
        String base;
        switch (element) {
            case "B": base = "byte"; break;
            case "C": base = "char"; break;
            case "D": base = "double"; break;
            case "F": base = "float"; break;
            case "I": base = "int"; break;
            case "J": base = "long"; break;
            case "S": base = "short"; break;
            case "Z": base = "boolean"; break;
            case "V": base = "void"; break;
            default:
                if (element.length() > 2 && element.startsWith("L") && element.endsWith(";")) {
                    base = element.substring(1, element.length() - 1).replace('/', '.');
                } else {
                    throw new IllegalArgumentException("Malformed type descriptor: " + fieldDescriptor);
                }
        }
        return base + "[]".repeat(dimensions);
    }

    private static int endOfFieldType(String descriptor, int start) {
        int pos = start;
        while (pos < descriptor.length() && descriptor.charAt(pos) == '[') {
            pos++;
        }
        if (pos >= descriptor.length()) {
            throw new IllegalArgumentException("Malformed method descriptor: " + descriptor);
        }
        if (descriptor.charAt(pos) == 'L') {
            int semicolon = descriptor.indexOf(';', pos);
            if (semicolon < 0) {
                throw new IllegalArgumentException("Malformed method descriptor: " + descriptor);
            }
            return semicolon + 1;
        }
        return pos + 1;
    }
}
