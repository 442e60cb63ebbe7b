package org.gts3.atlantis.stuckpoint;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.gts3.atlantis.stuckpoint.scoring.ScoredStuckPoint;

import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_ERROR;

/**
 * Command-line entry point. Ranks the stuck points of a fuzzing campaign and writes them as JSON.
 *
 * Exit status is 0 on success (also when no stuck point was found), 1 on a fatal analysis error
 * and 2 on invalid arguments.
 */
public class Main {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs the analyzer and returns the process exit status.
     */
    static int run(String[] args) {
        Instant startTime = Instant.now();

        ArgumentParser argumentParser;
        try {
            argumentParser = new ArgumentParser(args);
        } catch (IllegalArgumentException e) {
            System.err.println(LOG_ERROR + "Argument error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (argumentParser.isHelpRequested()) {
            return EXIT_OK;
        }

        AnalyzerConfig config = argumentParser.getConfig();
        System.out.println("Stuck Point Analyzer");
        System.out.println("Execution data: " + argumentParser.getExecFile());
        System.out.println("Binaries: " + argumentParser.getBinaries());
        System.out.println("Entry point: " + argumentParser.getEntryPoint());
        if (config.isVerbose()) {
            System.out.println("Configuration: " + config);
        }

        AnalysisReport report;
        try {
            report = new StuckPointAnalysis(config).run(argumentParser.getExecFile(),
                    argumentParser.getBinaries(), argumentParser.getEntryPoint());
        } catch (AnalysisException e) {
            System.err.println(LOG_ERROR + e.getMessage());
            if (config.isVerbose()) {
                e.printStackTrace();
            }
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            System.err.println(LOG_ERROR + "Unexpected error during analysis: " + e);
            e.printStackTrace();
            return EXIT_FAILURE;
        }

        try {
            ReportSerializer.write(argumentParser.getOutputFile(), report);
        } catch (IOException e) {
            return EXIT_FAILURE;
        }

        printSummary(System.out, report, argumentParser.getTopCount());
        System.out.println("Results written to: " + argumentParser.getOutputFile());
        Duration elapsed = Duration.between(startTime, Instant.now());
        System.out.println("Analysis completed in " + (elapsed.toMillis() / 1000.0) + " seconds");
        return EXIT_OK;
    }

    /**
     * Prints the top {@code topCount} stuck points as a table.
     */
    static void printSummary(PrintStream out, AnalysisReport report, int topCount) {
        List<ScoredStuckPoint> stuckPoints = report.getStuckPoints();
        if (report.getStatus() == AnalysisReport.Status.NO_STUCK_POINTS) {
            out.println("No stuck points found: every reached line is either fully covered or not covered at all");
            return;
        }

        out.println();
        out.println("Top " + Math.min(topCount, stuckPoints.size()) + " stuck points by reachability score:");
        out.println(String.format("%-6s %-8s %s", "Rank", "Score", "Location"));
        for (int i = 0; i < Math.min(topCount, stuckPoints.size()); i++) {
            ScoredStuckPoint point = stuckPoints.get(i);
            out.println(String.format("%-6d %-8d %s (%s)", i + 1, point.getScore(), point.getLocation(), point.getFileName()));
        }
        if (stuckPoints.size() > topCount) {
            out.println("... and " + (stuckPoints.size() - topCount) + " more");
        }

        AnalysisReport.Summary summary = report.getSummary();
        if (summary.getScoringFailures() > 0) {
            out.println(summary.getScoringFailures() + " stuck points could not be scored");
        }
    }
}
