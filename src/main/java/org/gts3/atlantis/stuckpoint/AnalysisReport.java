package org.gts3.atlantis.stuckpoint;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.gts3.atlantis.stuckpoint.callgraph.CallGraph;
import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;
import org.gts3.atlantis.stuckpoint.coverage.IngestSummary;
import org.gts3.atlantis.stuckpoint.scoring.ScoredStuckPoint;

/**
 * Typed result of an analysis run. {@link ReportSerializer} turns it into JSON using the field names.
 */
public final class AnalysisReport {
    public static final String TOOL_NAME = "stuck-point-analyzer";
    public static final String TOOL_VERSION = "1.0.0";

    public enum Status {
        OK,
        NO_STUCK_POINTS
    }

    private final Status status;
    private final Metadata metadata;
    private final Summary summary;
    private final IngestSummary ingestion;
    private final CallGraphStats callGraph;
    private final List<ScoredStuckPoint> stuckPoints;

    private AnalysisReport(Status status, Metadata metadata, Summary summary, IngestSummary ingestion,
                           CallGraphStats callGraph, List<ScoredStuckPoint> stuckPoints) {
        this.status = status;
        this.metadata = metadata;
        this.summary = summary;
        this.ingestion = ingestion;
        this.callGraph = callGraph;
        this.stuckPoints = List.copyOf(stuckPoints);
    }

    /**
     * Report of a run that found no partly covered line, so nothing was scored.
     */
    public static AnalysisReport noStuckPoints(Metadata metadata, int totalCoverageLines, IngestSummary ingestion) {
        return new AnalysisReport(Status.NO_STUCK_POINTS, metadata,
                Summary.of(totalCoverageLines, 0, List.of(), 0), ingestion, null, List.of());
    }

    /**
     * Report of a completed scoring run.
     *
     * @param ranked The scored stuck points in rank order
     */
    public static AnalysisReport scored(Metadata metadata, int totalCoverageLines, int stuckPointsFound,
                                        IngestSummary ingestion, CallGraph callGraph,
                                        List<ScoredStuckPoint> ranked, int scoringFailures) {
        return new AnalysisReport(Status.OK, metadata,
                Summary.of(totalCoverageLines, stuckPointsFound, ranked, scoringFailures), ingestion,
                CallGraphStats.of(callGraph), ranked);
    }

    public Status getStatus() {
        return status;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Summary getSummary() {
        return summary;
    }

    public IngestSummary getIngestion() {
        return ingestion;
    }

    /**
     * @return Call graph statistics, or null if static analysis was skipped
     */
    public CallGraphStats getCallGraph() {
        return callGraph;
    }

    public List<ScoredStuckPoint> getStuckPoints() {
        return stuckPoints;
    }

    public static final class Metadata {
        private final String tool;
        private final String version;
        private final String analysisTimestamp;
        private final String execFile;
        private final String entryPoint;
        private final List<String> binaries;

        public Metadata(String analysisTimestamp, String execFile, String entryPoint, List<String> binaries) {
            this.tool = TOOL_NAME;
            this.version = TOOL_VERSION;
            this.analysisTimestamp = analysisTimestamp;
            this.execFile = execFile;
            this.entryPoint = entryPoint;
            this.binaries = List.copyOf(binaries);
        }

        public static Metadata of(Path execFile, List<Path> binaries, EntryPointSpec entryPoint) {
            List<String> binaryNames = new ArrayList<>();
            for (Path binary : binaries) {
                binaryNames.add(binary.toString());
            }
            return new Metadata(Instant.now().toString(), String.valueOf(execFile), entryPoint.toString(), binaryNames);
        }

        public String getTool() {
            return tool;
        }

        public String getVersion() {
            return version;
        }

        public String getAnalysisTimestamp() {
            return analysisTimestamp;
        }

        public String getExecFile() {
            return execFile;
        }

        public String getEntryPoint() {
            return entryPoint;
        }

        public List<String> getBinaries() {
            return binaries;
        }
    }

    /**
     * Run statistics. The score fields are null when nothing was scored.
     */
    public static final class Summary {
        private final int totalCoverageLines;
        private final int stuckPointsFound;
        private final int scoredStuckPoints;
        private final int scoringFailures;
        private final int zeroScoreStuckPoints;
        private final Integer highestScore;
        private final Integer lowestScore;
        private final Double averageScore;
        private final String analysisType;

        private Summary(int totalCoverageLines, int stuckPointsFound, int scoredStuckPoints, int scoringFailures,
                        int zeroScoreStuckPoints, Integer highestScore, Integer lowestScore, Double averageScore) {
            this.totalCoverageLines = totalCoverageLines;
            this.stuckPointsFound = stuckPointsFound;
            this.scoredStuckPoints = scoredStuckPoints;
            this.scoringFailures = scoringFailures;
            this.zeroScoreStuckPoints = zeroScoreStuckPoints;
            this.highestScore = highestScore;
            this.lowestScore = lowestScore;
            this.averageScore = averageScore;
            this.analysisType = "reachability-based";
        }

        static Summary of(int totalCoverageLines, int stuckPointsFound, List<ScoredStuckPoint> scored, int scoringFailures) {
            if (scored.isEmpty()) {
                return new Summary(totalCoverageLines, stuckPointsFound, 0, scoringFailures, 0, null, null, null);
            }
            int highest = Integer.MIN_VALUE;
            int lowest = Integer.MAX_VALUE;
            long sum = 0;
            int zeros = 0;
            for (ScoredStuckPoint point : scored) {
                highest = Math.max(highest, point.getScore());
                lowest = Math.min(lowest, point.getScore());
                sum += point.getScore();
                if (point.getScore() == 0) {
                    zeros++;
                }
            }
            return new Summary(totalCoverageLines, stuckPointsFound, scored.size(), scoringFailures, zeros,
                    highest, lowest, (double) sum / scored.size());
        }

        public int getTotalCoverageLines() {
            return totalCoverageLines;
        }

        public int getStuckPointsFound() {
            return stuckPointsFound;
        }

        public int getScoredStuckPoints() {
            return scoredStuckPoints;
        }

        public int getScoringFailures() {
            return scoringFailures;
        }

        public int getZeroScoreStuckPoints() {
            return zeroScoreStuckPoints;
        }

        public Integer getHighestScore() {
            return highestScore;
        }

        public Integer getLowestScore() {
            return lowestScore;
        }

        public Double getAverageScore() {
            return averageScore;
        }

        public String getAnalysisType() {
            return analysisType;
        }
    }

    public static final class CallGraphStats {
        private final List<String> entryMethods;
        private final int reachableMethods;
        private final int callEdges;

        private CallGraphStats(List<String> entryMethods, int reachableMethods, int callEdges) {
            this.entryMethods = List.copyOf(entryMethods);
            this.reachableMethods = reachableMethods;
            this.callEdges = callEdges;
        }

        static CallGraphStats of(CallGraph callGraph) {
            List<String> entries = new ArrayList<>();
            callGraph.entryMethods().forEach(method -> entries.add(method.getSignature().toString()));
            return new CallGraphStats(entries, callGraph.reachableMethods().size(), callGraph.edgeCount());
        }

        public List<String> getEntryMethods() {
            return entryMethods;
        }

        public int getReachableMethods() {
            return reachableMethods;
        }

        public int getCallEdges() {
            return callEdges;
        }
    }
}
