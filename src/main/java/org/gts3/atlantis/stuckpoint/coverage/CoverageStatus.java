package org.gts3.atlantis.stuckpoint.coverage;

/**
 * Coverage state of a single source line.
 */
public enum CoverageStatus {
    NOT_COVERED,
    PARTLY_COVERED,
    FULLY_COVERED;

    /**
     * Classifies a line by its instruction counters.
     *
     * A line is fully covered when it has instructions and all of them ran, not covered when none
     * of them ran, and partly covered otherwise. A line without instructions is never covered.
     *
     * @param covered Number of executed instructions
     * @param total Number of instructions on the line
     * @return The status of the line
     */
    public static CoverageStatus classify(int covered, int total) {
        if (total > 0 && covered == total) {
            return FULLY_COVERED;
        }
        if (covered == 0) {
            return NOT_COVERED;
        }
        return PARTLY_COVERED;
    }
}
