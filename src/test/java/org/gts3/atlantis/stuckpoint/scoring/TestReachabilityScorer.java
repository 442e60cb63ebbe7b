package org.gts3.atlantis.stuckpoint.scoring;

import java.util.List;
import java.util.Set;

import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;
import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;
import org.gts3.atlantis.stuckpoint.coverage.CoverageTable;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfg;
import org.gts3.atlantis.stuckpoint.program.LineSpan;
import org.gts3.atlantis.stuckpoint.program.MethodSignature;
import org.gts3.atlantis.stuckpoint.program.ProgramModel;
import org.gts3.atlantis.stuckpoint.program.StmtRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.gts3.atlantis.stuckpoint.program.ProgramFixtures.body;
import static org.gts3.atlantis.stuckpoint.program.ProgramFixtures.voidMethod;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestReachabilityScorer {
    private static final String A = "demo.A";
    private static final String B = "demo.B";
    private static final String R = "demo.Recursive";

    private InterproceduralCfg icfg;

    /**
     * A.run: line 9 (covered), line 10 calls B.work (stuck point), lines 11-12.
     * B.work: five statements on lines 20-24.
     * Recursive.ping and Recursive.pong call each other.
     */
    @BeforeEach
    public void setUp() throws Exception {
        ProgramModel.Builder program = ProgramModel.builder();
        body(program.addClass(A).addMethod(voidMethod(A, "run")).setStatic(true))
                .stmt(9).call(10, voidMethod(B, "work")).stmt(11).stmt(12);
        body(program.addClass(B).addMethod(voidMethod(B, "work")).setStatic(true))
                .stmt(20).stmt(21).stmt(22).stmt(23).stmt(24);

        ProgramModel.ClassBuilder recursive = program.addClass(R);
        body(recursive.addMethod(voidMethod(R, "ping")).setStatic(true))
                .call(30, voidMethod(R, "pong")).stmt(31);
        body(recursive.addMethod(voidMethod(R, "pong")).setStatic(true))
                .call(40, voidMethod(R, "ping")).stmt(41);
        body(recursive.addMethod(voidMethod(R, "entry")).setStatic(true))
                .call(50, voidMethod(R, "ping")).call(51, voidMethod(A, "run"));

        ProgramModel model = program.build();
        icfg = InterproceduralCfg.of(model, EntryPointSpec.parse(R + ".entry"));
    }

    private static CoverageLine full(String cls, int line) {
        return new CoverageLine(cls, cls + ".java", line, 3, 3, 0, 0);
    }

    private static CoverageLine partly(String cls, int line) {
        return new CoverageLine(cls, cls + ".java", line, 4, 2, 2, 1);
    }

    private static CoverageLine none(String cls, int line) {
        return new CoverageLine(cls, cls + ".java", line, 2, 0, 0, 0);
    }

    private static CoverageTable table(CoverageLine... lines) {
        CoverageTable.Builder builder = CoverageTable.builder();
        for (CoverageLine line : lines) {
            builder.add(line);
        }
        return builder.build();
    }

    private CoverageTable baseline() {
        return table(full(A, 9), partly(A, 10), none(A, 11), none(A, 12),
                none(B, 20), none(B, 21), none(B, 22), none(B, 23), none(B, 24));
    }

    @Test
    public void testCalleeStatementsAddToScore() {
        ReachabilityScorer scorer = new ReachabilityScorer(icfg, baseline(), false, false);

        // Lines 10, 11 and 12 of A plus all five statements of B
        assertEquals(3 + 5, scorer.score(partly(A, 10)));
    }

    @Test
    public void testMemoizedScoresMatchPlainTraversal() {
        CoverageTable coverage = baseline();
        ReachabilityScorer plain = new ReachabilityScorer(icfg, coverage, false, false);
        ReachabilityScorer memoized = new ReachabilityScorer(icfg, coverage, true, false);

        int[][] locations = {{9}, {10}, {11}, {12}, {20}, {24}};
        for (int[] location : locations) {
            String cls = location[0] < 20 ? A : B;
            CoverageLine line = partly(cls, location[0]);
            assertEquals(plain.score(line), memoized.score(line), "line " + location[0]);
        }
        for (int line : new int[] {30, 31, 40, 41, 50, 51}) {
            assertEquals(plain.score(partly(R, line)), memoized.score(partly(R, line)), "line " + line);
        }
        assertTrue(memoized.cachedCalleeCount() > 0);
    }

    @Test
    public void testScoringIsIdempotent() {
        ReachabilityScorer scorer = new ReachabilityScorer(icfg, baseline(), true, false);
        int first = scorer.score(partly(A, 10));
        int second = scorer.score(partly(A, 10));
        assertEquals(first, second);
    }

    @Test
    public void testCoveringMoreLinesNeverIncreasesScore() {
        CoverageTable before = baseline();
        CoverageTable after = table(full(A, 9), partly(A, 10), none(A, 11), none(A, 12),
                full(B, 20), none(B, 21), full(B, 22), none(B, 23), none(B, 24));

        int scoreBefore = new ReachabilityScorer(icfg, before, true, false).score(partly(A, 10));
        int scoreAfter = new ReachabilityScorer(icfg, after, true, false).score(partly(A, 10));

        assertThat(scoreAfter, lessThanOrEqualTo(scoreBefore));
        assertEquals(scoreBefore - 2, scoreAfter);
    }

    @Test
    public void testMutualRecursionTerminatesAndVisitsEachStatementOnce() {
        ReachabilityScorer scorer = new ReachabilityScorer(icfg, CoverageTable.empty(), false, false);

        Set<StmtRef> reached = scorer.reachableFrom(icfg.statementsAt(R, 30));
        assertEquals(4, reached.size());
        assertEquals(4, scorer.score(partly(R, 30)));
    }

    @Test
    public void testLineWithoutStatementsScoresZero() {
        ReachabilityScorer scorer = new ReachabilityScorer(icfg, baseline(), true, false);
        assertEquals(0, scorer.score(partly(A, 99)));
        assertEquals(0, scorer.score(partly("demo.Unknown", 10)));
    }

    @Test
    public void testStatementIsCoveredWhenAnyLineOfItsSpanIsFullyCovered() throws Exception {
        ProgramModel.Builder program = ProgramModel.builder();
        ProgramModel.MethodBuilder method = program.addClass("demo.Span").addMethod(voidMethod("demo.Span", "m"));
        body(method).stmt(LineSpan.of(5, 6)).stmt(7);
        method.addStatement(LineSpan.NO_POSITION, false, List.of(), "nop");
        method.addEdge(1, 2);
        ProgramModel model = program.build();
        InterproceduralCfg spanCfg = InterproceduralCfg.of(model, EntryPointSpec.parse("demo.Span.m"));
        List<StmtRef> stmts = model.findMethod(voidMethod("demo.Span", "m")).getStatements();

        ReachabilityScorer scorer = new ReachabilityScorer(spanCfg, table(none("demo.Span", 5), full("demo.Span", 6)), false, false);

        assertTrue(scorer.isCovered(stmts.get(0)));
        assertFalse(scorer.isCovered(stmts.get(1)));
        assertFalse(scorer.isCovered(stmts.get(2)));
        // The multi-line statement is covered, line 7 and the statement without position are not
        assertEquals(2, scorer.score(partly("demo.Span", 5)));
    }

    @Test
    public void testStaticInitializerRunByAllocationAddsToScore() throws Exception {
        MethodSignature clinit = new MethodSignature("demo.Config", "<clinit>", "void", List.of());
        ProgramModel.Builder program = ProgramModel.builder();
        ProgramModel.MethodBuilder entry = program.addClass("demo.Init").addMethod(voidMethod("demo.Init", "entry"));
        body(entry).stmt(3);
        int allocation = entry.addStatement(LineSpan.single(4), false, List.of(clinit), "new demo.Config");
        entry.addEdge(0, allocation);
        body(program.addClass("demo.Config").addMethod(clinit).setStatic(true)).stmt(1).stmt(2).stmt(3);
        InterproceduralCfg initCfg = InterproceduralCfg.of(program.build(), EntryPointSpec.parse("demo.Init.entry"));

        ReachabilityScorer scorer = new ReachabilityScorer(initCfg, CoverageTable.empty(), false, false);

        // Both statements of the entry plus the three of the initializer
        assertEquals(2 + 3, scorer.score(partly("demo.Init", 3)));
        assertEquals(2, initCfg.getCallGraph().reachableMethods().size());
    }

    @Test
    public void testCallWithoutKnownCalleeIsALeaf() throws Exception {
        ProgramModel.Builder program = ProgramModel.builder();
        body(program.addClass("demo.Lib").addMethod(voidMethod("demo.Lib", "m"))).stmt(1).call(2).stmt(3);
        InterproceduralCfg libCfg = InterproceduralCfg.of(program.build(), EntryPointSpec.parse("demo.Lib.m"));

        ReachabilityScorer scorer = new ReachabilityScorer(libCfg, CoverageTable.empty(), true, false);

        assertEquals(3, scorer.score(partly("demo.Lib", 1)));
    }
}
