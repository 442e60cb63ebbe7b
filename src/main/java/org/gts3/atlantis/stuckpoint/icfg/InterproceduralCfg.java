package org.gts3.atlantis.stuckpoint.icfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.gts3.atlantis.stuckpoint.callgraph.AmbiguousEntryPointException;
import org.gts3.atlantis.stuckpoint.callgraph.CallGraph;
import org.gts3.atlantis.stuckpoint.callgraph.EntryPointNotFoundException;
import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;
import org.gts3.atlantis.stuckpoint.program.LineSpan;
import org.gts3.atlantis.stuckpoint.program.ProgramClass;
import org.gts3.atlantis.stuckpoint.program.ProgramMethod;
import org.gts3.atlantis.stuckpoint.program.ProgramView;
import org.gts3.atlantis.stuckpoint.program.StmtRef;

/**
 * Interprocedural control-flow graph over a program view and its call graph.
 *
 * The graph answers from a snapshot: {@link InterproceduralCfgFactory} implementations copy
 * successors, entry statements and callees out of the framework that computed them. Call sites
 * lead into the entry statements of their callees. There are no return edges from a callee back
 * to the caller, and exceptional control flow is not modelled. All queries are read-only, so one
 * instance serves every scoring thread.
 */
public final class InterproceduralCfg {
    private final CallGraph callGraph;
    private final Map<String, Map<Integer, List<StmtRef>>> lineIndex;

    private InterproceduralCfg(ProgramView view, CallGraph callGraph) {
        this.callGraph = callGraph;
        this.lineIndex = buildLineIndex(view);
    }

    /**
     * Resolves the entry point in {@code view} and links the call graph reachable from it.
     *
     * @throws EntryPointNotFoundException If the entry point names no executable method
     * @throws AmbiguousEntryPointException If the entry point matches several methods
     */
    public static InterproceduralCfg of(ProgramView view, EntryPointSpec entryPoint)
            throws EntryPointNotFoundException, AmbiguousEntryPointException {
        ProgramMethod entryMethod = entryPoint.resolve(view);
        return new InterproceduralCfg(view, CallGraph.of(view, List.of(entryMethod)));
    }

    private static Map<String, Map<Integer, List<StmtRef>>> buildLineIndex(ProgramView view) {
        Map<String, Map<Integer, List<StmtRef>>> index = new HashMap<>();
        for (ProgramClass programClass : view.getClasses()) {
            Map<Integer, List<StmtRef>> byLine = new HashMap<>();
            for (ProgramMethod method : programClass.getMethods()) {
                for (StmtRef stmt : method.getStatements()) {
                    LineSpan span = stmt.getSpan();
                    if (!span.hasPosition()) {
                        continue;
                    }
                    for (int line = span.getFirstLine(); line <= span.getLastLine(); line++) {
                        byLine.computeIfAbsent(line, k -> new ArrayList<>()).add(stmt);
                    }
                }
            }
            if (!byLine.isEmpty()) {
                Map<Integer, List<StmtRef>> frozen = new HashMap<>();
                for (Map.Entry<Integer, List<StmtRef>> entry : byLine.entrySet()) {
                    frozen.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
                }
                index.put(programClass.getName(), Collections.unmodifiableMap(frozen));
            }
        }
        return Collections.unmodifiableMap(index);
    }

    public List<StmtRef> successorsOf(StmtRef stmt) {
        return stmt.getOwner().successorsOf(stmt);
    }

    public boolean isCallSite(StmtRef stmt) {
        return stmt.isCallSite();
    }

    public List<ProgramMethod> calleesOf(StmtRef stmt) {
        return callGraph.calleesOf(stmt);
    }

    public List<StmtRef> entryStatementsOf(ProgramMethod method) {
        return method.getEntryStatements();
    }

    public ProgramMethod ownerOf(StmtRef stmt) {
        return stmt.getOwner();
    }

    /**
     * Returns every statement of the class whose line span contains {@code line}, across all of
     * the class's methods.
     *
     * @return The statements, empty if the class is unknown or has no code on that line
     */
    public List<StmtRef> statementsAt(String classFqn, int line) {
        Map<Integer, List<StmtRef>> byLine = lineIndex.get(classFqn);
        if (byLine == null) {
            return List.of();
        }
        return byLine.getOrDefault(line, List.of());
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }
}
