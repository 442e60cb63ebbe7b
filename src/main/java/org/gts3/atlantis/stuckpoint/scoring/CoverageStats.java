package org.gts3.atlantis.stuckpoint.scoring;

/**
 * Counter summary of one kind (instructions or branches) on a line, as written to the report.
 */
public final class CoverageStats {
    private final int total;
    private final int covered;
    private final int missed;
    private final double ratio;

    public CoverageStats(int total, int covered) {
        this.total = total;
        this.covered = covered;
        this.missed = total - covered;
        this.ratio = total == 0 ? 0.0 : (double) covered / total;
    }

    public int getTotal() {
        return total;
    }

    public int getCovered() {
        return covered;
    }

    public int getMissed() {
        return missed;
    }

    public double getRatio() {
        return ratio;
    }
}
