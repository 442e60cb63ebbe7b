package org.gts3.atlantis.stuckpoint.coverage;

import java.util.Objects;

/**
 * Coverage counters of one source line of one class.
 *
 * A line is identified by its class and line number. The status is always derived from the
 * instruction counters and cannot disagree with them.
 */
public final class CoverageLine {
    private final String classFqn;
    private final String fileName;
    private final int lineNumber;
    private final CoverageStatus status;
    private final int instructionsTotal;
    private final int instructionsCovered;
    private final int branchesTotal;
    private final int branchesCovered;

    /**
     * Creates a new coverage line.
     *
     * @param classFqn The fully qualified, dot separated name of the class
     * @param fileName The source file the line belongs to
     * @param lineNumber The 1-based line number
     * @param instructionsTotal Number of bytecode instructions on the line
     * @param instructionsCovered Number of those instructions that executed
     * @param branchesTotal Number of branches on the line
     * @param branchesCovered Number of those branches that executed
     * @throws IllegalArgumentException If a counter is negative or covered exceeds total
     */
    public CoverageLine(String classFqn, String fileName, int lineNumber,
                        int instructionsTotal, int instructionsCovered,
                        int branchesTotal, int branchesCovered) {
        this.classFqn = Objects.requireNonNull(classFqn, "classFqn");
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        checkCounters("instruction", instructionsTotal, instructionsCovered);
        checkCounters("branch", branchesTotal, branchesCovered);
        if (lineNumber <= 0) {
            throw new IllegalArgumentException("Line number must be positive: " + lineNumber);
        }
        this.lineNumber = lineNumber;
        this.instructionsTotal = instructionsTotal;
        this.instructionsCovered = instructionsCovered;
        this.branchesTotal = branchesTotal;
        this.branchesCovered = branchesCovered;
        this.status = CoverageStatus.classify(instructionsCovered, instructionsTotal);
    }

    private static void checkCounters(String kind, int total, int covered) {
        if (covered < 0 || total < covered) {
            throw new IllegalArgumentException("Invalid " + kind + " counters: covered=" + covered + ", total=" + total);
        }
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

    public CoverageStatus getStatus() {
        return status;
    }

    public int getInstructionsTotal() {
        return instructionsTotal;
    }

    public int getInstructionsCovered() {
        return instructionsCovered;
    }

    public int getInstructionsMissed() {
        return instructionsTotal - instructionsCovered;
    }

    public int getBranchesTotal() {
        return branchesTotal;
    }

    public int getBranchesCovered() {
        return branchesCovered;
    }

    public int getBranchesMissed() {
        return branchesTotal - branchesCovered;
    }

    public double getInstructionCoverageRatio() {
        return instructionsTotal == 0 ? 0.0 : (double) instructionsCovered / instructionsTotal;
    }

    public double getBranchCoverageRatio() {
        return branchesTotal == 0 ? 0.0 : (double) branchesCovered / branchesTotal;
    }

    public boolean isStuckPoint() {
        return status == CoverageStatus.PARTLY_COVERED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoverageLine)) return false;
        CoverageLine that = (CoverageLine) o;
        return lineNumber == that.lineNumber && classFqn.equals(that.classFqn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classFqn, lineNumber);
    }

    @Override
    public String toString() {
        return classFqn + ":" + lineNumber + " [" + status + ", " + instructionsCovered + "/" + instructionsTotal
                + " instructions, " + branchesCovered + "/" + branchesTotal + " branches]";
    }
}
