package org.gts3.atlantis.stuckpoint.coverage;

/**
 * The coverage table produced by ingestion together with its per-binary summary.
 */
public final class IngestResult {
    private final CoverageTable table;
    private final IngestSummary summary;

    public IngestResult(CoverageTable table, IngestSummary summary) {
        this.table = table;
        this.summary = summary;
    }

    public CoverageTable getTable() {
        return table;
    }

    public IngestSummary getSummary() {
        return summary;
    }
}
