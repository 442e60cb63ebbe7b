package org.gts3.atlantis.stuckpoint;

import java.nio.file.Path;
import java.util.List;

import org.gts3.atlantis.stuckpoint.callgraph.CallGraph;
import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;
import org.gts3.atlantis.stuckpoint.coverage.CoverageIngestor;
import org.gts3.atlantis.stuckpoint.coverage.CoverageLine;
import org.gts3.atlantis.stuckpoint.coverage.CoverageTable;
import org.gts3.atlantis.stuckpoint.coverage.IngestResult;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfg;
import org.gts3.atlantis.stuckpoint.icfg.InterproceduralCfgFactory;
import org.gts3.atlantis.stuckpoint.program.soot.SootProgramLoader;
import org.gts3.atlantis.stuckpoint.scoring.ReachabilityScorer;
import org.gts3.atlantis.stuckpoint.scoring.ResultRanker;
import org.gts3.atlantis.stuckpoint.scoring.ScoredStuckPoint;
import org.gts3.atlantis.stuckpoint.scoring.StuckPointScoringService;
import org.gts3.atlantis.stuckpoint.scoring.StuckPointSelector;

/**
 * The analysis pipeline: ingest coverage, select stuck points, build the call graph and ICFG from
 * the entry point, score every stuck point by reachability and rank the results.
 *
 * Static analysis is skipped entirely when the coverage has no stuck points.
 */
public class StuckPointAnalysis {
    private final AnalyzerConfig config;
    private final CoverageIngestor ingestor;
    private final InterproceduralCfgFactory icfgFactory;
    private final StuckPointSelector selector = new StuckPointSelector();
    private final ResultRanker ranker = new ResultRanker();

    public StuckPointAnalysis(AnalyzerConfig config) {
        this(config, new CoverageIngestor(config), new SootProgramLoader(config));
    }

    public StuckPointAnalysis(AnalyzerConfig config, CoverageIngestor ingestor, InterproceduralCfgFactory icfgFactory) {
        this.config = config;
        this.ingestor = ingestor;
        this.icfgFactory = icfgFactory;
    }

    /**
     * Runs the full pipeline.
     *
     * @param execFile The JaCoCo execution data file
     * @param binaries The jars and class directories of the fuzzed program
     * @param entryPoint The fuzzer entry point
     * @return The report, which is empty but well formed if there are no stuck points
     * @throws AnalysisException If the execution data, the program or the entry point cannot be loaded
     */
    public AnalysisReport run(Path execFile, List<Path> binaries, EntryPointSpec entryPoint) throws AnalysisException {
        System.out.println("Step 1: Analyzing JaCoCo coverage data...");
        IngestResult ingestResult = ingestor.ingest(execFile, binaries);
        return analyze(ingestResult, binaries, AnalysisReport.Metadata.of(execFile, binaries, entryPoint), entryPoint);
    }

    /**
     * Runs everything after coverage ingestion.
     *
     * @throws AnalysisException If the program or the entry point cannot be loaded
     */
    public AnalysisReport analyze(IngestResult ingestResult, List<Path> binaries, AnalysisReport.Metadata metadata,
                                  EntryPointSpec entryPoint) throws AnalysisException {
        CoverageTable table = ingestResult.getTable();
        System.out.println("Found " + table.size() + " total coverage lines");

        System.out.println("Step 2: Identifying stuck points (partly covered lines)...");
        List<CoverageLine> stuckPoints = selector.select(table);
        System.out.println("Found " + stuckPoints.size() + " stuck points");

        if (stuckPoints.isEmpty()) {
            System.out.println("No stuck points found, skipping static analysis");
            return AnalysisReport.noStuckPoints(metadata, table.size(), ingestResult.getSummary());
        }

        System.out.println("Step 3: Building ICFG from entry point " + entryPoint + "...");
        InterproceduralCfg icfg = icfgFactory.load(binaries, entryPoint);
        CallGraph callGraph = icfg.getCallGraph();
        System.out.println("Call graph: " + callGraph.reachableMethods().size() + " reachable methods, "
                + callGraph.edgeCount() + " edges");

        System.out.println("Step 4: Calculating reachability scores...");
        ReachabilityScorer scorer = new ReachabilityScorer(icfg, table, config.isMemoizeCalleeReach(), config.isVerbose());
        StuckPointScoringService.Outcome outcome = new StuckPointScoringService(config, scorer).scoreAll(stuckPoints);

        System.out.println("Step 5: Ranking stuck points...");
        List<ScoredStuckPoint> ranked = ranker.rank(outcome.getScored());

        return AnalysisReport.scored(metadata, table.size(), stuckPoints.size(), ingestResult.getSummary(),
                callGraph, ranked, outcome.getFailures());
    }
}
