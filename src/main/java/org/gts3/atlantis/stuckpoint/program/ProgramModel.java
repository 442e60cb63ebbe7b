package org.gts3.atlantis.stuckpoint.program;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable in-memory {@link ProgramView}.
 *
 * Program loaders populate a {@link Builder}; once built, the model no longer refers to the
 * framework it was loaded with and can be shared freely between threads.
 */
public final class ProgramModel implements ProgramView {
    private final Map<String, ProgramClass> classes;

    private ProgramModel(Map<String, ProgramClass> classes) {
        this.classes = classes;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public ProgramClass findClass(String className) {
        return classes.get(className);
    }

    @Override
    public Collection<ProgramClass> getClasses() {
        return classes.values();
    }

    public int methodCount() {
        int count = 0;
        for (ProgramClass programClass : classes.values()) {
            count += programClass.getMethods().size();
        }
        return count;
    }

    public static final class Builder {
        private final Map<String, ClassBuilder> classes = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Starts a new class. Adding the same class twice replaces the earlier definition.
         */
        public ClassBuilder addClass(String className) {
            ClassBuilder classBuilder = new ClassBuilder(className);
            classes.put(className, classBuilder);
            return classBuilder;
        }

        public ProgramModel build() {
            Map<String, ProgramClass> built = new TreeMap<>();
            for (ClassBuilder classBuilder : classes.values()) {
                built.put(classBuilder.name, classBuilder.build());
            }
            return new ProgramModel(Collections.unmodifiableMap(built));
        }
    }

    public static final class ClassBuilder {
        private final String name;
        private final List<MethodBuilder> methods = new ArrayList<>();

        private ClassBuilder(String name) {
            this.name = name;
        }

        /**
         * Adds a method declared by this class.
         *
         * @throws IllegalArgumentException If the signature names a different declaring class
         */
        public MethodBuilder addMethod(MethodSignature signature) {
            if (!signature.getDeclaringClass().equals(name)) {
                throw new IllegalArgumentException("Method " + signature + " is not declared in " + name);
            }
            MethodBuilder methodBuilder = new MethodBuilder(signature);
            methods.add(methodBuilder);
            return methodBuilder;
        }

        private ProgramClass build() {
            List<ProgramMethod> builtMethods = new ArrayList<>(methods.size());
            for (MethodBuilder methodBuilder : methods) {
                builtMethods.add(methodBuilder.build());
            }
            return new ProgramClass(name, builtMethods);
        }
    }

    /**
     * Describes a method body as a list of statements plus control-flow edges between their indices.
     * Without explicit entries the first statement is the entry. Call sites carry the signatures of
     * their already resolved callees.
     */
    public static final class MethodBuilder {
        private final MethodSignature signature;
        private boolean isStatic;
        private boolean isAbstract;
        final List<LineSpan> spans = new ArrayList<>();
        final List<Boolean> callSites = new ArrayList<>();
        final List<List<MethodSignature>> callees = new ArrayList<>();
        final List<String> texts = new ArrayList<>();
        final List<List<Integer>> successors = new ArrayList<>();
        final List<Integer> entries = new ArrayList<>();

        private MethodBuilder(MethodSignature signature) {
            this.signature = signature;
        }

        public MethodBuilder setStatic(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        public MethodBuilder setAbstract(boolean isAbstract) {
            this.isAbstract = isAbstract;
            return this;
        }

        /**
         * Appends a statement.
         *
         * @param callSite Whether the statement invokes a method, even one without a known callee
         * @param callees The methods control may enter from this statement, in the order given
         * @return The index of the new statement
         */
        public int addStatement(LineSpan span, boolean callSite, List<MethodSignature> callees, String text) {
            spans.add(span);
            callSites.add(callSite || !callees.isEmpty());
            this.callees.add(List.copyOf(callees));
            texts.add(text);
            successors.add(new ArrayList<>());
            return spans.size() - 1;
        }

        /**
         * Adds a control-flow edge. Duplicate edges are ignored.
         *
         * @throws IndexOutOfBoundsException If either index does not name a statement
         */
        public MethodBuilder addEdge(int from, int to) {
            if (from < 0 || from >= spans.size() || to < 0 || to >= spans.size()) {
                throw new IndexOutOfBoundsException("Edge " + from + " -> " + to + " outside of " + spans.size() + " statements");
            }
            List<Integer> targets = successors.get(from);
            if (!targets.contains(to)) {
                targets.add(to);
            }
            return this;
        }

        public MethodBuilder addEntry(int index) {
            if (index < 0 || index >= spans.size()) {
                throw new IndexOutOfBoundsException("Entry " + index + " outside of " + spans.size() + " statements");
            }
            if (!entries.contains(index)) {
                entries.add(index);
            }
            return this;
        }

        public int statementCount() {
            return spans.size();
        }

        private ProgramMethod build() {
            return new ProgramMethod(signature, isStatic, isAbstract, this);
        }
    }
}
