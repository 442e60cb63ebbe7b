package org.gts3.atlantis.stuckpoint.coverage;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.gts3.atlantis.stuckpoint.AnalyzerConfig;
import org.gts3.atlantis.stuckpoint.FixtureClasses;
import org.jacoco.core.data.ExecutionDataWriter;
import org.jacoco.core.internal.analysis.ClassCoverageImpl;
import org.jacoco.core.internal.analysis.CounterImpl;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TestCoverageIngestor {
    private static final String SQUARE = "org.gts3.atlantis.stuckpoint.fixtures.Square";
    private static final String HARNESS = "org.gts3.atlantis.stuckpoint.fixtures.ShapeHarness";

    @TempDir
    Path tempDir;

    private Path writeEmptyExecFile() throws IOException {
        Path execFile = tempDir.resolve("jacoco.exec");
        try (OutputStream out = Files.newOutputStream(execFile)) {
            new ExecutionDataWriter(out);
        }
        return execFile;
    }

    private Path writeCorruptClass() throws IOException {
        Path corrupt = tempDir.resolve("broken").resolve("Broken.class");
        Files.createDirectories(corrupt.getParent());
        Files.write(corrupt, new byte[] {
                (byte) 0xCA, (byte) 0xFE, (byte) 0xBA, (byte) 0xBE,
                0x00, 0x00, 0x00, 0x34,
                (byte) 0xFF, (byte) 0xFF,
                0x00, 0x00, 0x00, 0x00});
        return corrupt;
    }

    private static AnalyzerConfig config(int threads) {
        return new AnalyzerConfig(false, threads, true, List.of());
    }

    @Test
    public void testCorruptBinaryIsSkippedAndCounted() throws Exception {
        Path shapes = FixtureClasses.copyTo(tempDir.resolve("shapes"), FixtureClasses.SHAPES);
        Path harness = FixtureClasses.copyTo(tempDir.resolve("harness"), FixtureClasses.HARNESS);
        Path corrupt = writeCorruptClass();

        IngestResult result = new CoverageIngestor(config(2)).ingest(writeEmptyExecFile(), List.of(shapes, corrupt, harness));

        IngestSummary summary = result.getSummary();
        assertEquals(2, summary.getSuccessCount());
        assertEquals(1, summary.getFailureCount());
        assertEquals(3, summary.getTotalBinaries());
        assertEquals(corrupt.toString(), summary.getFailures().get(0).getPath());

        CoverageTable table = result.getTable();
        assertThat(table.size(), greaterThan(0));
        assertThat(table.classNames(), hasItem(SQUARE));
        assertThat(table.classNames(), hasItem(HARNESS));
    }

    @Test
    public void testLinesWithoutExecutionDataAreNotCovered() throws Exception {
        Path shapes = FixtureClasses.copyTo(tempDir.resolve("shapes"), FixtureClasses.SHAPES);

        IngestResult result = new CoverageIngestor(config(1)).ingest(writeEmptyExecFile(), List.of(shapes));

        List<CoverageLine> lines = result.getTable().lines();
        assertThat(lines.size(), greaterThan(0));
        for (CoverageLine line : lines) {
            assertEquals(CoverageStatus.NOT_COVERED, line.getStatus());
            assertThat(line.getInstructionsTotal(), greaterThan(0));
        }
        CoverageLine squareLine = lines.stream().filter(l -> l.getClassFqn().equals(SQUARE)).findFirst().orElse(null);
        assertNotNull(squareLine);
        assertEquals("Square.java", squareLine.getFileName());
    }

    @Test
    public void testThreadCountDoesNotChangeTable() throws Exception {
        Path shapes = FixtureClasses.copyTo(tempDir.resolve("shapes"), FixtureClasses.SHAPES);
        Path harness = FixtureClasses.copyTo(tempDir.resolve("harness"), FixtureClasses.HARNESS);
        Path execFile = writeEmptyExecFile();

        CoverageTable sequential = new CoverageIngestor(config(1)).ingest(execFile, List.of(shapes, harness)).getTable();
        CoverageTable parallel = new CoverageIngestor(config(4)).ingest(execFile, List.of(shapes, harness)).getTable();

        assertEquals(sequential.lines(), parallel.lines());
    }

    @Test
    public void testMissingBinaryIsAFailure() throws Exception {
        Path shapes = FixtureClasses.copyTo(tempDir.resolve("shapes"), FixtureClasses.SHAPES);

        IngestResult result = new CoverageIngestor(config(1))
                .ingest(writeEmptyExecFile(), List.of(shapes, tempDir.resolve("missing.jar")));

        assertEquals(1, result.getSummary().getSuccessCount());
        assertEquals(1, result.getSummary().getFailureCount());
        assertThat(result.getSummary().getFailures().get(0).getMessage(), containsString("does not exist"));
    }

    @Test
    public void testMissingExecFileIsFatal() {
        Path missing = tempDir.resolve("nothing.exec");
        NoExecutionDataException e = assertThrows(NoExecutionDataException.class,
                () -> new CoverageIngestor(config(1)).ingest(missing, List.of()));
        assertEquals(missing, e.getExecFile());
    }

    @Test
    public void testGarbageExecFileIsFatal() throws Exception {
        Path garbage = tempDir.resolve("garbage.exec");
        Files.writeString(garbage, "this is not execution data");

        assertThrows(NoExecutionDataException.class,
                () -> new CoverageIngestor(config(1)).ingest(garbage, List.of()));
    }

    @Test
    public void testExtractLinesSkipsLinesWithoutInstructions() {
        ClassCoverageImpl classCoverage = new ClassCoverageImpl("com/example/Parser$Inner", 1L, false);
        classCoverage.setSourceFileName("Parser.java");
        classCoverage.increment(CounterImpl.getInstance(2, 3), CounterImpl.getInstance(1, 1), 10);
        classCoverage.increment(CounterImpl.getInstance(0, 4), CounterImpl.getInstance(0, 0), 12);

        List<CoverageLine> lines = CoverageIngestor.extractLines(classCoverage);

        assertEquals(2, lines.size());
        CoverageLine partly = lines.get(0);
        assertEquals("com.example.Parser$Inner", partly.getClassFqn());
        assertEquals("Parser.java", partly.getFileName());
        assertEquals(10, partly.getLineNumber());
        assertEquals(5, partly.getInstructionsTotal());
        assertEquals(3, partly.getInstructionsCovered());
        assertEquals(2, partly.getBranchesTotal());
        assertEquals(1, partly.getBranchesCovered());
        assertEquals(CoverageStatus.PARTLY_COVERED, partly.getStatus());

        CoverageLine full = lines.get(1);
        assertEquals(12, full.getLineNumber());
        assertEquals(CoverageStatus.FULLY_COVERED, full.getStatus());
    }

    @Test
    public void testFileNameFallsBackToOuterClass() {
        ClassCoverageImpl classCoverage = new ClassCoverageImpl("com/example/Parser$Inner", 1L, false);
        classCoverage.increment(CounterImpl.getInstance(1, 0), CounterImpl.getInstance(0, 0), 3);

        List<CoverageLine> lines = CoverageIngestor.extractLines(classCoverage);

        assertEquals(1, lines.size());
        assertEquals("Parser.java", lines.get(0).getFileName());
        assertEquals(CoverageStatus.NOT_COVERED, lines.get(0).getStatus());
    }
}
