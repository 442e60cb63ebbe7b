package org.gts3.atlantis.stuckpoint.callgraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.gts3.atlantis.stuckpoint.program.MethodSignature;
import org.gts3.atlantis.stuckpoint.program.ProgramMethod;
import org.gts3.atlantis.stuckpoint.program.ProgramView;
import org.gts3.atlantis.stuckpoint.program.StmtRef;

/**
 * Call graph rooted at one or more entry methods. Only call sites of reachable methods have edges.
 *
 * Immutable once built.
 */
public final class CallGraph {
    private final List<ProgramMethod> entryMethods;
    private final Set<ProgramMethod> reachableMethods;
    private final Map<StmtRef, List<ProgramMethod>> callees;
    private final int edgeCount;

    private CallGraph(List<ProgramMethod> entryMethods, Set<ProgramMethod> reachableMethods, Map<StmtRef, List<ProgramMethod>> callees) {
        this.entryMethods = List.copyOf(entryMethods);
        this.reachableMethods = Collections.unmodifiableSet(new LinkedHashSet<>(reachableMethods));
        this.callees = Collections.unmodifiableMap(new IdentityHashMap<>(callees));
        int edges = 0;
        for (List<ProgramMethod> targets : callees.values()) {
            edges += targets.size();
        }
        this.edgeCount = edges;
    }

    /**
     * Links the callees recorded on the statements of {@code view} into a graph, starting from the
     * entry methods. Callees the view has no method for are dropped.
     *
     * @throws IllegalArgumentException If no entry method is given
     */
    public static CallGraph of(ProgramView view, List<ProgramMethod> entryMethods) {
        if (entryMethods.isEmpty()) {
            throw new IllegalArgumentException("At least one entry method is required");
        }
        Map<StmtRef, List<ProgramMethod>> callees = new IdentityHashMap<>();
        List<ProgramMethod> entries = new ArrayList<>(new LinkedHashSet<>(entryMethods));
        Set<ProgramMethod> reachable = new LinkedHashSet<>(entries);
        Deque<ProgramMethod> worklist = new ArrayDeque<>(entries);

        while (!worklist.isEmpty()) {
            ProgramMethod method = worklist.poll();
            for (StmtRef stmt : method.getStatements()) {
                List<ProgramMethod> targets = new ArrayList<>();
                for (MethodSignature signature : stmt.getCallees()) {
                    ProgramMethod callee = view.findMethod(signature);
                    if (callee != null && !targets.contains(callee)) {
                        targets.add(callee);
                    }
                }
                if (targets.isEmpty()) {
                    continue;
                }
                callees.put(stmt, List.copyOf(targets));
                for (ProgramMethod callee : targets) {
                    if (reachable.add(callee)) {
                        worklist.add(callee);
                    }
                }
            }
        }
        return new CallGraph(entries, reachable, callees);
    }

    /**
     * @return The possible callees of a call site, empty if the site is not part of the graph
     */
    public List<ProgramMethod> calleesOf(StmtRef callSite) {
        return callees.getOrDefault(callSite, List.of());
    }

    public List<ProgramMethod> entryMethods() {
        return entryMethods;
    }

    public Set<ProgramMethod> reachableMethods() {
        return reachableMethods;
    }

    public boolean isReachable(ProgramMethod method) {
        return reachableMethods.contains(method);
    }

    public int edgeCount() {
        return edgeCount;
    }

    @Override
    public String toString() {
        return "CallGraph{entries=" + entryMethods + ", reachableMethods=" + reachableMethods.size() + ", edges=" + edgeCount + "}";
    }
}
