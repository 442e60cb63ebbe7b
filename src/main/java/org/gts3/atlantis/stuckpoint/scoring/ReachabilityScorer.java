package org.gts3.atlantis.stuckpoint.scoring;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;
import org.gts3.atlantis.stuckpoint.coverage.CoverageTable;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfg;
import org.gts3.atlantis.stuckpoint.program.LineSpan;
import org.gts3.atlantis.stuckpoint.program.ProgramMethod;
import org.gts3.atlantis.stuckpoint.program.StmtRef;

/**
 * Scores a stuck point by the number of statements reachable from it that the fuzzer has not yet covered.
 *
 * Reachability follows intraprocedural successors and descends into every callee at call sites.
 * A statement counts as covered when any line of its span is fully covered in its class. The
 * scorer only reads shared immutable state, so one instance can score from many threads.
 *
 * With memoization enabled, the closed reachable set of each callee is computed once and reused.
 * The closure of a set of statements equals their intraprocedural closure joined with the
 * closures of the callees it calls, so reuse does not change any score.
 */
public class ReachabilityScorer {
    private final InterproceduralCfg icfg;
    private final CoverageTable coverage;
    private final boolean memoize;
    private final boolean verbose;
    private final Map<ProgramMethod, Set<StmtRef>> calleeReach = new ConcurrentHashMap<>();

    public ReachabilityScorer(InterproceduralCfg icfg, CoverageTable coverage, boolean memoize, boolean verbose) {
        this.icfg = icfg;
        this.coverage = coverage;
        this.memoize = memoize;
        this.verbose = verbose;
    }

    /**
     * Computes the score of a stuck point. A line without statements scores 0.
     *
     * @return The number of reachable, not yet covered statements, never negative
     */
    public int score(CoverageLine stuckPoint) {
        List<StmtRef> seeds = icfg.statementsAt(stuckPoint.getClassFqn(), stuckPoint.getLineNumber());
        if (seeds.isEmpty()) {
            if (verbose) {
                System.out.println("No statements found for " + stuckPoint.getClassFqn() + ":" + stuckPoint.getLineNumber());
            }
            return 0;
        }

        int uncovered = 0;
        for (StmtRef stmt : reachableFrom(seeds)) {
            if (!isCovered(stmt)) {
                uncovered++;
            }
        }
        return uncovered;
    }

    /**
     * Returns the seeds and every statement reachable from them.
     */
    Set<StmtRef> reachableFrom(Collection<StmtRef> seeds) {
        return memoize ? traverseWithCalleeReach(seeds) : traverse(seeds);
    }

    /**
     * Whether a statement already executed according to the coverage snapshot.
     */
    boolean isCovered(StmtRef stmt) {
        LineSpan span = stmt.getSpan();
        if (!span.hasPosition()) {
            return false;
        }
        String classFqn = icfg.ownerOf(stmt).getDeclaringClassName();
        for (int line = span.getFirstLine(); line <= span.getLastLine(); line++) {
            if (coverage.isFullyCovered(classFqn, line)) {
                return true;
            }
        }
        return false;
    }

    private Set<StmtRef> traverse(Collection<StmtRef> seeds) {
        Set<StmtRef> visited = new HashSet<>(seeds);
        Deque<StmtRef> worklist = new ArrayDeque<>(visited);
        while (!worklist.isEmpty()) {
            StmtRef stmt = worklist.poll();
            for (StmtRef successor : icfg.successorsOf(stmt)) {
                if (visited.add(successor)) {
                    worklist.add(successor);
                }
            }
            if (icfg.isCallSite(stmt)) {
                for (ProgramMethod callee : icfg.calleesOf(stmt)) {
                    for (StmtRef entry : icfg.entryStatementsOf(callee)) {
                        if (visited.add(entry)) {
                            worklist.add(entry);
                        }
                    }
                }
            }
        }
        return visited;
    }

    private Set<StmtRef> traverseWithCalleeReach(Collection<StmtRef> seeds) {
        Set<StmtRef> visited = new HashSet<>(seeds);
        Set<ProgramMethod> enteredCallees = new HashSet<>();
        Deque<StmtRef> worklist = new ArrayDeque<>(visited);
        while (!worklist.isEmpty()) {
            StmtRef stmt = worklist.poll();
            for (StmtRef successor : icfg.successorsOf(stmt)) {
                if (visited.add(successor)) {
                    worklist.add(successor);
                }
            }
            if (icfg.isCallSite(stmt)) {
                for (ProgramMethod callee : icfg.calleesOf(stmt)) {
                    if (enteredCallees.add(callee)) {
                        // The callee's reach set is closed, so its statements need no further traversal
                        visited.addAll(reachOf(callee));
                    }
                }
            }
        }
        return visited;
    }

    private Set<StmtRef> reachOf(ProgramMethod method) {
        Set<StmtRef> cached = calleeReach.get(method);
        if (cached != null) {
            return cached;
        }
        Set<StmtRef> reach = Collections.unmodifiableSet(traverse(icfg.entryStatementsOf(method)));
        Set<StmtRef> previous = calleeReach.putIfAbsent(method, reach);
        return previous != null ? previous : reach;
    }

    int cachedCalleeCount() {
        return calleeReach.size();
    }
}
