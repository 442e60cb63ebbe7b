package org.gts3.atlantis.stuckpoint;

import java.util.List;

import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;
import org.gts3.atlantis.stuckpoint.coverage.CoverageTable;
import org.gts3.atlantis.stuckpoint.coverage.IngestResult;
import org.gts3.atlantis.stuckpoint.coverage.IngestSummary;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfg;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfgFactory;
import org.gts3.atlantis.stuckpoint.program.ProgramModel;

import static org.gts3.atlantis.stuckpoint.program.ProgramFixtures.body;
import static org.gts3.atlantis.stuckpoint.program.ProgramFixtures.voidMethod;

/**
 * A two-method program with matching coverage: {@code demo.A.run} calls {@code demo.B.work} on line 10.
 *
 * Stuck points are A:10 (score 6) and B:22 (score 3).
 */
public final class SamplePrograms {
    public static final String A = "demo.A";
    public static final String B = "demo.B";
    public static final String ENTRY = A + ".run";

    private SamplePrograms() {
    }

    public static ProgramModel callerAndCallee() {
        ProgramModel.Builder program = ProgramModel.builder();
        body(program.addClass(A).addMethod(voidMethod(A, "run")).setStatic(true))
                .stmt(9).call(10, voidMethod(B, "work")).stmt(11).stmt(12);
        body(program.addClass(B).addMethod(voidMethod(B, "work")).setStatic(true))
                .stmt(20).stmt(21).stmt(22).stmt(23).stmt(24);
        return program.build();
    }

    /**
     * Serves {@link #callerAndCallee()} for any binaries.
     */
    public static InterproceduralCfgFactory icfgFactory() {
        return (binaries, entryPoint) -> InterproceduralCfg.of(callerAndCallee(), entryPoint);
    }

    public static CoverageLine full(String cls, int line) {
        return new CoverageLine(cls, fileOf(cls), line, 3, 3, 0, 0);
    }

    public static CoverageLine partly(String cls, int line) {
        return new CoverageLine(cls, fileOf(cls), line, 4, 2, 2, 1);
    }

    public static CoverageLine none(String cls, int line) {
        return new CoverageLine(cls, fileOf(cls), line, 2, 0, 0, 0);
    }

    public static CoverageTable coverage() {
        CoverageTable.Builder builder = CoverageTable.builder();
        for (CoverageLine line : List.of(full(A, 9), partly(A, 10), none(A, 11), none(A, 12),
                full(B, 20), full(B, 21), partly(B, 22), none(B, 23), none(B, 24))) {
            builder.add(line);
        }
        return builder.build();
    }

    public static IngestResult ingested(CoverageTable table) {
        return new IngestResult(table, new IngestSummary(1, List.of()));
    }

    private static String fileOf(String cls) {
        return cls.substring(cls.lastIndexOf('.') + 1) + ".java";
    }
}
