package org.gts3.atlantis.stuckpoint.coverage;

import java.util.List;

/**
 * Outcome of coverage ingestion across all binaries. Every binary is counted either as a success or
 * as a failure, so {@code successCount + failureCount == totalBinaries}.
 */
public final class IngestSummary {
    private final int successCount;
    private final int failureCount;
    private final int totalBinaries;
    private final List<BinaryFailure> failures;

    public IngestSummary(int successCount, List<BinaryFailure> failures) {
        this.successCount = successCount;
        this.failures = List.copyOf(failures);
        this.failureCount = this.failures.size();
        this.totalBinaries = successCount + failureCount;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getTotalBinaries() {
        return totalBinaries;
    }

    public List<BinaryFailure> getFailures() {
        return failures;
    }

    @Override
    public String toString() {
        return successCount + " successful, " + failureCount + " failed, " + totalBinaries + " total";
    }

    /**
     * A binary that could not be analysed, with the reason.
     */
    public static final class BinaryFailure {
        private final String path;
        private final String message;

        public BinaryFailure(String path, String message) {
            this.path = path;
            this.message = message;
        }

        public String getPath() {
            return path;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return path + ": " + message;
        }
    }
}
