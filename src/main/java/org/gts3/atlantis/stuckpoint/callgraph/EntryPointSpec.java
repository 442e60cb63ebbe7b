package org.gts3.atlantis.stuckpoint.callgraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.gts3.atlantis.stuckpoint.program.MethodSignature;
import org.gts3.atlantis.stuckpoint.program.ProgramClass;
import org.gts3.atlantis.stuckpoint.program.ProgramMethod;
import org.gts3.atlantis.stuckpoint.program.ProgramView;
import org.gts3.atlantis.stuckpoint.utils.DescriptorUtils;

/**
 * A user supplied description of the method the fuzzer enters the program through.
 *
 * The declaring class and method name are always given. Return type and parameter types are
 * optional; a spec that leaves them out must still match exactly one method. Accepted forms:
 * <ul>
 *   <li>{@code <com.example.Fuzzer: void fuzzerTestOneInput(byte[])>}</li>
 *   <li>{@code com.example.Fuzzer.fuzzerTestOneInput(byte[])}</li>
 *   <li>{@code com.example.Fuzzer.fuzzerTestOneInput([B)V}</li>
 *   <li>{@code com.example.Fuzzer.fuzzerTestOneInput}</li>
 * </ul>
 */
public final class EntryPointSpec {
    private final String className;
    private final String methodName;
    private final String returnType;
    private final List<String> parameterTypes;

    /**
     * @param returnType The return type, or null to accept any
     * @param parameterTypes The parameter types, or null to accept any
     */
    public EntryPointSpec(String className, String methodName, String returnType, List<String> parameterTypes) {
        if (className == null || className.isEmpty() || methodName == null || methodName.isEmpty()) {
            throw new IllegalArgumentException("Entry point needs a class and a method name");
        }
        this.className = className;
        this.methodName = methodName;
        this.returnType = returnType;
        this.parameterTypes = parameterTypes == null ? null : List.copyOf(parameterTypes);
    }

    public static EntryPointSpec of(MethodSignature signature) {
        return new EntryPointSpec(signature.getDeclaringClass(), signature.getName(),
                signature.getReturnType(), signature.getParameterTypes());
    }

    /**
     * Parses an entry point in one of the accepted forms.
     *
     * @throws IllegalArgumentException If the string matches none of them
     */
    public static EntryPointSpec parse(String spec) {
        String s = spec.trim();
        if (s.startsWith("<")) {
            return of(MethodSignature.parse(s));
        }

        int open = s.indexOf('(');
        String qualifiedName = open < 0 ? s : s.substring(0, open).trim();
        int dot = qualifiedName.lastIndexOf('.');
        if (dot <= 0 || dot == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("Entry point must be <class>.<method>, got: " + spec);
        }
        String cls = qualifiedName.substring(0, dot);
        String name = qualifiedName.substring(dot + 1);
        if (open < 0) {
            return new EntryPointSpec(cls, name, null, null);
        }

        String rest = s.substring(open).trim();
        if (DescriptorUtils.isMethodDescriptor(rest)) {
            return new EntryPointSpec(cls, name, DescriptorUtils.returnType(rest), DescriptorUtils.parameterTypes(rest));
        }
        if (!rest.endsWith(")")) {
            throw new IllegalArgumentException("Unbalanced parameter list in entry point: " + spec);
        }
        return new EntryPointSpec(cls, name, null, MethodSignature.splitParameterList(rest.substring(1, rest.length() - 1)));
    }

    public String getClassName() {
        return className;
    }

    public String getMethodName() {
        return methodName;
    }

    public String getReturnType() {
        return returnType;
    }

    public List<String> getParameterTypes() {
        return parameterTypes;
    }

    public boolean isFullySpecified() {
        return returnType != null && parameterTypes != null;
    }

    public boolean matches(MethodSignature signature) {
        return signature.getDeclaringClass().equals(className)
                && signature.getName().equals(methodName)
                && (returnType == null || returnType.equals(signature.getReturnType()))
                && (parameterTypes == null || parameterTypes.equals(signature.getParameterTypes()));
    }

    /**
     * Finds the single method of the view this spec describes.
     *
     * @throws EntryPointNotFoundException If the class is unknown, nothing matches, or the match is abstract or native
     * @throws AmbiguousEntryPointException If more than one method matches
     */
    public ProgramMethod resolve(ProgramView view) throws EntryPointNotFoundException, AmbiguousEntryPointException {
        ProgramClass programClass = view.findClass(className);
        if (programClass == null) {
            throw new EntryPointNotFoundException(this, "class " + className + " is not part of the program");
        }

        List<ProgramMethod> candidates = new ArrayList<>();
        List<MethodSignature> sameName = new ArrayList<>();
        for (ProgramMethod method : programClass.getMethodsNamed(methodName)) {
            sameName.add(method.getSignature());
            if (matches(method.getSignature())) {
                candidates.add(method);
            }
        }

        if (candidates.isEmpty()) {
            throw new EntryPointNotFoundException(this, sameName.isEmpty()
                    ? "class " + className + " has no method named " + methodName
                    : "no overload matches, available: " + sameName);
        }
        if (candidates.size() > 1) {
            List<MethodSignature> signatures = new ArrayList<>();
            for (ProgramMethod candidate : candidates) {
                signatures.add(candidate.getSignature());
            }
            throw new AmbiguousEntryPointException(this, signatures);
        }

        ProgramMethod method = candidates.get(0);
        if (method.isAbstract()) {
            throw new EntryPointNotFoundException(this, method.getSignature() + " has no body");
        }
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntryPointSpec)) return false;
        EntryPointSpec that = (EntryPointSpec) o;
        return className.equals(that.className) && methodName.equals(that.methodName)
                && Objects.equals(returnType, that.returnType) && Objects.equals(parameterTypes, that.parameterTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, methodName, returnType, parameterTypes);
    }

    @Override
    public String toString() {
        if (isFullySpecified()) {
            return new MethodSignature(className, methodName, returnType, parameterTypes).toString();
        }
        String result = className + "." + methodName;
        if (parameterTypes != null) {
            result += "(" + String.join(",", parameterTypes) + ")";
        }
        return result;
    }
}
