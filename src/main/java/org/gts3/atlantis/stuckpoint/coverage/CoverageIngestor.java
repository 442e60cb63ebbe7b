package org.gts3.atlantis.stuckpoint.coverage;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.gts3.atlantis.stuckpoint.AnalyzerConfig;
import org.jacoco.core.analysis.Analyzer;
import org.jacoco.core.analysis.CoverageBuilder;
import org.jacoco.core.analysis.IClassCoverage;
import org.jacoco.core.analysis.ICounter;
import org.jacoco.core.analysis.ILine;
import org.jacoco.core.analysis.ISourceNode;
import org.jacoco.core.data.ExecutionDataStore;
import org.jacoco.core.tools.ExecFileLoader;

import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_ERROR;
import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_WARN;

/**
 * Turns a JaCoCo execution data file and the binaries it was recorded against into a {@link CoverageTable}.
 *
 * Every binary is analysed on its own against the shared execution data, so a corrupt or
 * incompatible binary only removes its own classes from the table. Binaries are analysed on a
 * worker pool and merged in input order, which makes the table independent of the thread count.
 */
public class CoverageIngestor {
    private final AnalyzerConfig config;

    public CoverageIngestor(AnalyzerConfig config) {
        this.config = config;
    }

    /**
     * Ingests coverage for the given binaries.
     *
     * @param execFile The JaCoCo execution data file
     * @param binaries Jars, class directories or class files the execution data belongs to
     * @return The coverage table and a summary of which binaries could be analysed
     * @throws NoExecutionDataException If the execution data file cannot be read
     */
    public IngestResult ingest(Path execFile, List<Path> binaries) throws NoExecutionDataException {
        ExecutionDataStore executionData = loadExecutionData(execFile);

        List<BinaryOutcome> outcomes = analyzeBinaries(executionData, binaries);

        CoverageTable.Builder tableBuilder = CoverageTable.builder();
        List<IngestSummary.BinaryFailure> failures = new ArrayList<>();
        Set<String> duplicateClasses = new HashSet<>();
        int successCount = 0;

        for (BinaryOutcome outcome : outcomes) {
            if (outcome.failure != null) {
                failures.add(outcome.failure);
                continue;
            }
            successCount++;
            for (CoverageLine line : outcome.lines) {
                if (!tableBuilder.add(line) && duplicateClasses.add(line.getClassFqn())) {
                    System.err.println(LOG_WARN + "Class " + line.getClassFqn() + " appears in more than one binary, keeping the first");
                }
            }
        }

        IngestSummary summary = new IngestSummary(successCount, failures);
        CoverageTable table = tableBuilder.build();
        System.out.println("Class file analysis summary: " + summary);
        if (config.isVerbose() || !failures.isEmpty()) {
            System.out.println("Found coverage data for " + table.classCount() + " classes, " + table.size() + " total lines");
        }
        return new IngestResult(table, summary);
    }

    private ExecutionDataStore loadExecutionData(Path execFile) throws NoExecutionDataException {
        if (config.isVerbose()) {
            System.out.println("Loading JaCoCo execution data from: " + execFile);
        }
        if (!Files.isRegularFile(execFile)) {
            throw new NoExecutionDataException(execFile, "file does not exist", null);
        }
        ExecFileLoader loader = new ExecFileLoader();
        try {
            loader.load(execFile.toFile());
        } catch (IOException e) {
            throw new NoExecutionDataException(execFile, e.getMessage(), e);
        }
        if (config.isVerbose()) {
            System.out.println("Loaded execution data for " + loader.getExecutionDataStore().getContents().size()
                    + " classes from " + loader.getSessionInfoStore().getInfos().size() + " sessions");
        }
        return loader.getExecutionDataStore();
    }

    private List<BinaryOutcome> analyzeBinaries(ExecutionDataStore executionData, List<Path> binaries) {
        int threads = Math.min(config.getWorkerThreads(), Math.max(1, binaries.size()));
        if (threads == 1) {
            List<BinaryOutcome> outcomes = new ArrayList<>();
            for (Path binary : binaries) {
                outcomes.add(analyzeBinary(executionData, binary));
            }
            return outcomes;
        }

        List<Callable<BinaryOutcome>> tasks = new ArrayList<>();
        for (Path binary : binaries) {
            tasks.add(() -> analyzeBinary(executionData, binary));
        }
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<BinaryOutcome>> futures = executor.invokeAll(tasks);
            List<BinaryOutcome> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(collect(futures.get(i), binaries.get(i)));
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analysing binaries", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static BinaryOutcome collect(Future<BinaryOutcome> future, Path binary) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // analyzeBinary reports its own failures, so this is an unexpected error
            System.err.println(LOG_ERROR + "Unexpected error while analysing " + binary + ": " + e.getCause());
            return BinaryOutcome.failed(binary, String.valueOf(e.getCause()));
        }
    }

    private BinaryOutcome analyzeBinary(ExecutionDataStore executionData, Path binary) {
        if (config.isVerbose()) {
            System.out.println("Analyzing classes from: " + binary);
        }
        File file = binary.toFile();
        if (!file.exists()) {
            System.err.println(LOG_WARN + "File or directory does not exist: " + binary);
            return BinaryOutcome.failed(binary, "file or directory does not exist");
        }

        CoverageBuilder coverageBuilder = new CoverageBuilder();
        Analyzer analyzer = new Analyzer(executionData, coverageBuilder);
        try {
            analyzer.analyzeAll(file);
        } catch (IOException | RuntimeException e) {
            System.err.println(LOG_WARN + "Failed to analyze " + binary + ", skipping it: " + e.getMessage());
            if (e.getCause() != null) {
                System.err.println(LOG_WARN + "  Reason: " + e.getCause());
            }
            return BinaryOutcome.failed(binary, String.valueOf(e.getMessage()));
        }

        List<CoverageLine> lines = new ArrayList<>();
        for (IClassCoverage classCoverage : coverageBuilder.getClasses()) {
            lines.addAll(extractLines(classCoverage));
        }
        if (config.isVerbose()) {
            System.out.println("Successfully analyzed " + binary + ": " + coverageBuilder.getClasses().size()
                    + " classes, " + lines.size() + " lines");
        }
        return BinaryOutcome.succeeded(lines);
    }

    /**
     * Extracts the lines of a class that carry at least one instruction.
     */
    static List<CoverageLine> extractLines(IClassCoverage classCoverage) {
        List<CoverageLine> lines = new ArrayList<>();
        String classFqn = classCoverage.getName().replace('/', '.');
        String fileName = sourceFileName(classCoverage);

        int firstLine = classCoverage.getFirstLine();
        int lastLine = classCoverage.getLastLine();
        if (firstLine == ISourceNode.UNKNOWN_LINE) {
            return lines;
        }

        for (int lineNumber = firstLine; lineNumber <= lastLine; lineNumber++) {
            ILine line = classCoverage.getLine(lineNumber);
            ICounter instructions = line.getInstructionCounter();
            if (instructions.getTotalCount() == 0) {
                continue;
            }
            ICounter branches = line.getBranchCounter();
            lines.add(new CoverageLine(classFqn, fileName, lineNumber,
                    instructions.getTotalCount(), instructions.getCoveredCount(),
                    branches.getTotalCount(), branches.getCoveredCount()));
        }
        return lines;
    }

    private static String sourceFileName(IClassCoverage classCoverage) {
        String sourceFile = classCoverage.getSourceFileName();
        if (sourceFile != null && !sourceFile.isEmpty()) {
            return sourceFile;
        }
        String simpleName = classCoverage.getName().substring(classCoverage.getName().lastIndexOf('/') + 1);
        int nested = simpleName.indexOf('$');
        if (nested > 0) {
            simpleName = simpleName.substring(0, nested);
        }
        return simpleName + ".java";
    }

    private static final class BinaryOutcome {
        private final Collection<CoverageLine> lines;
        private final IngestSummary.BinaryFailure failure;

        private BinaryOutcome(Collection<CoverageLine> lines, IngestSummary.BinaryFailure failure) {
            this.lines = lines;
            this.failure = failure;
        }

        static BinaryOutcome succeeded(Collection<CoverageLine> lines) {
            return new BinaryOutcome(lines, null);
        }

        static BinaryOutcome failed(Path binary, String message) {
            return new BinaryOutcome(List.of(), new IngestSummary.BinaryFailure(binary.toString(), message));
        }
    }
}
