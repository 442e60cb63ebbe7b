package org.gts3.atlantis.stuckpoint;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.gts3.atlantis.stuckpoint.callgraph.EntryPointSpec;

import static org.gts3.atlantis.stuckpoint.utils.LogLabel.LOG_ERROR;

/**
 * Parses the command line of the stuck point analyzer.
 */
public class ArgumentParser {
    static final String DEFAULT_OUTPUT = "stuck-points.json";
    static final int DEFAULT_TOP = 10;

    private final boolean helpRequested;
    private Path execFile;
    private List<Path> binaries;
    private EntryPointSpec entryPoint;
    private Path outputFile;
    private int topCount;
    private AnalyzerConfig config;

    /**
     * Parses and validates the arguments.
     *
     * @param args Command-line arguments
     * @throws IllegalArgumentException If an argument is missing or malformed; usage has been printed by then
     */
    public ArgumentParser(String[] args) {
        Options options = buildOptions();
        HelpFormatter formatter = new HelpFormatter();

        // Answer --help before required options are enforced
        boolean help = false;
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                help = true;
            }
        }
        this.helpRequested = help;
        if (help) {
            formatter.printHelp("StuckPointAnalyzer", options);
            return;
        }

        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(LOG_ERROR + "Failed to parse arguments: " + e.getMessage());
            formatter.printHelp("StuckPointAnalyzer", options);
            throw new IllegalArgumentException("Failed to parse command line arguments", e);
        }

        try {
            parse(cmd);
        } catch (IllegalArgumentException e) {
            formatter.printHelp("StuckPointAnalyzer", options);
            throw e;
        }
    }

    private static Options buildOptions() {
        Options options = new Options();

        Option execOption = new Option("e", "exec", true, "JaCoCo execution data file (.exec)");
        execOption.setRequired(true);
        options.addOption(execOption);

        Option binariesOption = Option.builder("b")
                .longOpt("binaries")
                .desc("Jars or class directories of the fuzzed program, separated by '" + File.pathSeparator + "' or repeated")
                .hasArg(true)
                .numberOfArgs(Option.UNLIMITED_VALUES)
                .valueSeparator(File.pathSeparatorChar)
                .required(true)
                .build();
        options.addOption(binariesOption);

        Option entryOption = Option.builder()
                .longOpt("entry")
                .desc("Fuzzer entry point, e.g. com.example.Fuzzer.fuzzerTestOneInput(byte[]) or <com.example.Fuzzer: void fuzzerTestOneInput(byte[])>")
                .hasArg(true)
                .required(true)
                .build();
        options.addOption(entryOption);

        options.addOption(Option.builder("o")
                .longOpt("output")
                .desc("Path of the JSON report (default: " + DEFAULT_OUTPUT + ")")
                .hasArg(true)
                .build());

        options.addOption(Option.builder("cp")
                .longOpt("classpath")
                .desc("Library jars used to resolve references from the application, separated by '" + File.pathSeparator + "'")
                .hasArg(true)
                .numberOfArgs(Option.UNLIMITED_VALUES)
                .valueSeparator(File.pathSeparatorChar)
                .build());

        options.addOption(Option.builder("t")
                .longOpt("threads")
                .desc("Number of worker threads (default: number of processors)")
                .hasArg(true)
                .build());

        options.addOption(Option.builder()
                .longOpt("top")
                .desc("Number of stuck points to print to the console (default: " + DEFAULT_TOP + ")")
                .hasArg(true)
                .build());

        options.addOption(Option.builder()
                .longOpt("no-memo")
                .desc("Do not cache the reachable set of callees while scoring")
                .build());

        options.addOption(new Option("v", "verbose", false, "Print detailed progress"));
        options.addOption(new Option("h", "help", false, "Print this help"));
        return options;
    }

    private void parse(CommandLine cmd) {
        this.execFile = Path.of(cmd.getOptionValue("exec"));

        this.binaries = new ArrayList<>();
        for (String value : cmd.getOptionValues("binaries")) {
            if (!value.isBlank()) {
                binaries.add(Path.of(value.trim()));
            }
        }
        if (binaries.isEmpty()) {
            throw new IllegalArgumentException("At least one binary is required");
        }

        this.entryPoint = EntryPointSpec.parse(cmd.getOptionValue("entry"));
        this.outputFile = Path.of(cmd.getOptionValue("output", DEFAULT_OUTPUT));

        List<Path> libraryClasspath = new ArrayList<>();
        if (cmd.hasOption("classpath")) {
            for (String value : cmd.getOptionValues("classpath")) {
                if (!value.isBlank()) {
                    libraryClasspath.add(Path.of(value.trim()));
                }
            }
        }

        int threads = cmd.hasOption("threads")
                ? parsePositiveInt("threads", cmd.getOptionValue("threads"))
                : AnalyzerConfig.defaultWorkerThreads();
        this.topCount = cmd.hasOption("top")
                ? parsePositiveInt("top", cmd.getOptionValue("top"))
                : DEFAULT_TOP;

        this.config = new AnalyzerConfig(cmd.hasOption("verbose"), threads, !cmd.hasOption("no-memo"), libraryClasspath);
    }

    private static int parsePositiveInt(String option, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException("--" + option + " must be at least 1, got " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects a number, got '" + value + "'", e);
        }
    }

    public boolean isHelpRequested() {
        return helpRequested;
    }

    public Path getExecFile() {
        return execFile;
    }

    public List<Path> getBinaries() {
        return binaries;
    }

    public EntryPointSpec getEntryPoint() {
        return entryPoint;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public int getTopCount() {
        return topCount;
    }

    public AnalyzerConfig getConfig() {
        return config;
    }
}
