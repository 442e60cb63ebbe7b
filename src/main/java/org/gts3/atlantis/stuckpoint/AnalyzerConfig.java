package org.gts3.atlantis.stuckpoint;

import java.nio.file.Path;
import java.util.List;

/**
 * Settings shared by all stages of an analysis run.
 *
 * Every component receives its configuration through its constructor; there is no global state.
 */
public final class AnalyzerConfig {
    private final boolean verbose;
    private final int workerThreads;
    private final boolean memoizeCalleeReach;
    private final List<Path> libraryClasspath;

    /**
     * @param verbose Print detailed progress to stdout
     * @param workerThreads Size of the worker pools used for ingestion and scoring, at least 1
     * @param memoizeCalleeReach Cache the reachable set of each callee during scoring
     * @param libraryClasspath Jars and directories that resolve library references but are not analysed
     * @throws IllegalArgumentException If {@code workerThreads} is smaller than 1
     */
    public AnalyzerConfig(boolean verbose, int workerThreads, boolean memoizeCalleeReach, List<Path> libraryClasspath) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker thread count must be at least 1, got " + workerThreads);
        }
        this.verbose = verbose;
        this.workerThreads = workerThreads;
        this.memoizeCalleeReach = memoizeCalleeReach;
        this.libraryClasspath = List.copyOf(libraryClasspath);
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(false, defaultWorkerThreads(), true, List.of());
    }

    public static int defaultWorkerThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public boolean isMemoizeCalleeReach() {
        return memoizeCalleeReach;
    }

    public List<Path> getLibraryClasspath() {
        return libraryClasspath;
    }

    @Override
    public String toString() {
        return "AnalyzerConfig{verbose=" + verbose + ", workerThreads=" + workerThreads
                + ", memoizeCalleeReach=" + memoizeCalleeReach + ", libraryClasspath=" + libraryClasspath + "}";
    }
}
