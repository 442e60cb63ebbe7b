package org.gts3.atlantis.stuckpoint.scoring;

import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;
import org.gts3.atlantis.stuckpoint.coverage.CoverageStatus;

/**
 * A stuck point together with the number of still uncovered statements that become reachable from it.
 *
 * Field names double as the report's JSON keys.
 */
public final class ScoredStuckPoint {
    private final String classFqn;
    private final String fileName;
    private final int lineNumber;
    private final CoverageStatus coverageStatus;
    private final CoverageStats instructionCoverage;
    private final CoverageStats branchCoverage;
    private final int stuckPointScore;

    /**
     * @throws IllegalArgumentException If the score is negative
     */
    public ScoredStuckPoint(CoverageLine line, int score) {
        if (score < 0) {
            throw new IllegalArgumentException("Score must not be negative: " + score);
        }
        this.classFqn = line.getClassFqn();
        this.fileName = line.getFileName();
        this.lineNumber = line.getLineNumber();
        this.coverageStatus = line.getStatus();
        this.instructionCoverage = new CoverageStats(line.getInstructionsTotal(), line.getInstructionsCovered());
        this.branchCoverage = new CoverageStats(line.getBranchesTotal(), line.getBranchesCovered());
        this.stuckPointScore = score;
    }

    public String getClassFqn() {
        return classFqn;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public CoverageStatus getCoverageStatus() {
        return coverageStatus;
    }

    public CoverageStats getInstructionCoverage() {
        return instructionCoverage;
    }

    public CoverageStats getBranchCoverage() {
        return branchCoverage;
    }

    public int getScore() {
        return stuckPointScore;
    }

    /**
     * Location in {@code com.example.Foo:42} form.
     */
    public String getLocation() {
        return classFqn + ":" + lineNumber;
    }

    @Override
    public String toString() {
        return getLocation() + " (score " + stuckPointScore + ")";
    }
}
