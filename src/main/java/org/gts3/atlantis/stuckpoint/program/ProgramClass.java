package org.gts3.atlantis.stuckpoint.program;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An application class of the analysed program and the methods it declares.
 */
public final class ProgramClass {
    private final String name;
    private final List<ProgramMethod> methods;
    private final Map<String, ProgramMethod> methodsBySubSignature;

    ProgramClass(String name, List<ProgramMethod> methods) {
        this.name = name;
        this.methods = Collections.unmodifiableList(new ArrayList<>(methods));

        Map<String, ProgramMethod> bySubSignature = new LinkedHashMap<>();
        for (ProgramMethod method : methods) {
            bySubSignature.put(method.getSignature().getSubSignature(), method);
        }
        this.methodsBySubSignature = Collections.unmodifiableMap(bySubSignature);
    }

    public String getName() {
        return name;
    }

    public List<ProgramMethod> getMethods() {
        return methods;
    }

    /**
     * Looks up a method declared by this class.
     *
     * @param subSignature e.g. {@code void foo(int)}
     * @return The method, or null if this class does not declare it
     */
    public ProgramMethod getMethod(String subSignature) {
        return methodsBySubSignature.get(subSignature);
    }

    public List<ProgramMethod> getMethodsNamed(String methodName) {
        List<ProgramMethod> result = new ArrayList<>();
        for (ProgramMethod method : methods) {
            if (method.getName().equals(methodName)) {
                result.add(method);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return name;
    }
}
