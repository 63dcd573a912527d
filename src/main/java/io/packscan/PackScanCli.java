package io.packscan;

import io.packscan.analysis.ScanPipeline;
import io.packscan.diff.ArchiveDiffAnalyzer;
import io.packscan.diff.DiffReport;
import io.packscan.model.Finding;
import io.packscan.model.ScanLocation;
import io.packscan.model.ScanResult;
import io.packscan.output.ConsoleOutput;
import io.packscan.output.JsonOutput;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the pack-scan tool.
 */
@Command(
        name = "pack-scan",
        mixinStandardHelpOptions = true,
        version = "pack-scan 1.0.0",
        description = "Scans third-party packages for malicious or unsafe patterns before they are installed.",
        subcommands = {PackScanCli.ScanCommand.class, PackScanCli.DiffCommand.class},
        exitCodeOnInvalidInput = 1,
        exitCodeOnExecutionException = 1,
        footer = {
                "",
                "Examples:",
                "  pack-scan scan package-1.0.tar.gz",
                "  pack-scan scan ./unpacked --output-format json --min-score 10",
                "  pack-scan diff package-1.0.zip package-1.1.zip --fail-on 50"
        }
)
public class PackScanCli implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(System.err);
        return 1;
    }

    @FunctionalInterface
    interface ReportWriter {
        void write(OutputStream out) throws IOException;
    }

    /**
     * Options shared by all subcommands.
     */
    static class CommonOptions {

        @Option(
                names = {"-c", "--config"},
                description = "Path to configuration YAML file, merged over the bundled defaults"
        )
        Path configFile;

        @Option(
                names = {"-o", "--output-format"},
                description = "Output format: console (default), json",
                defaultValue = "console"
        )
        OutputFormat outputFormat;

        @Option(
                names = {"-f", "--output-file"},
                description = "Output file path (defaults to stdout)"
        )
        Path outputFile;

        @Option(
                names = {"--min-score"},
                description = "Minimum score of reported findings (overrides minScore)"
        )
        Integer minScore;

        @Option(
                names = {"--max-archive-size"},
                description = "Maximum uncompressed size of an archive entry in bytes (overrides maxArchiveSize)"
        )
        Long maxArchiveSize;

        @Option(
                names = {"--max-depth"},
                description = "Maximum archive nesting depth to unpack (overrides maxDepth)"
        )
        Integer maxDepth;

        @Option(
                names = {"--fail-on"},
                description = "Exit with code 2 if a reported finding has at least this score",
                defaultValue = "100"
        )
        int failOn;

        @Option(
                names = {"-v", "--verbose"},
                description = "Enable verbose output"
        )
        boolean verbose;

        ScanConfig loadConfig() throws IOException {
            ScanConfig config = ScanConfig.loadDefault();
            if (configFile != null) {
                if (!Files.isRegularFile(configFile)) {
                    throw new IOException("Config file does not exist: " + configFile);
                }
                log("Loading configuration from: " + configFile);
                config = config.merge(ScanConfig.load(configFile));
            }
            if (minScore != null) {
                config = config.withMinScore(minScore);
            }
            if (maxArchiveSize != null) {
                config = config.withMaxArchiveSize(maxArchiveSize);
            }
            if (maxDepth != null) {
                config = config.withMaxDepth(maxDepth);
            }
            return config;
        }

        void configureLogging() {
            if (verbose) {
                // Must happen before the first logger is created
                System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
            }
        }

        /**
         * Writes the report to the output file, or to stdout without closing it.
         */
        void writeOutput(ReportWriter writer) throws IOException {
            if (outputFile == null) {
                writer.write(System.out);
                System.out.flush();
                return;
            }
            try (OutputStream out = Files.newOutputStream(outputFile)) {
                writer.write(out);
            }
        }

        void log(String message) {
            if (verbose) {
                System.err.println(message);
            }
        }

        int exitCode(List<Finding> reported) {
            boolean failing = reported.stream().anyMatch(f -> f.score() >= failOn);
            if (failing) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to findings with score " + failOn + " or higher.");
                }
                return 2;
            }
            return 0;
        }
    }

    @Command(
            name = "scan",
            mixinStandardHelpOptions = true,
            description = "Scans a package file, archive or directory.",
            exitCodeOnInvalidInput = 1,
            exitCodeOnExecutionException = 1
    )
    static class ScanCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "File, archive or directory to scan")
        Path path;

        @Mixin
        CommonOptions options;

        @Override
        public Integer call() {
            options.configureLogging();
            Instant startTime = Instant.now();
            try {
                if (!Files.exists(path)) {
                    System.err.println("Error: Path does not exist: " + path);
                    return 1;
                }
                ScanConfig config = options.loadConfig();

                options.log("Scanning " + path + "...");
                ScanPipeline pipeline = new ScanPipeline(config);
                ScanResult result = pipeline.scan(ScanLocation.of(path),
                        finding -> options.log("  " + finding.name() + " at " + finding.displayLocation()));
                options.log("  Scanned " + result.locationsScanned() + " locations in "
                        + Duration.between(startTime, Instant.now()).toMillis() + " ms");

                options.writeOutput(out -> {
                    if (options.outputFormat == OutputFormat.json) {
                        new JsonOutput().minScore(config.minScore()).write(result, out);
                    } else {
                        PrintStream printer = new PrintStream(out, true, StandardCharsets.UTF_8);
                        new ConsoleOutput(printer).minScore(config.minScore()).print(result);
                        printer.flush();
                    }
                });
                if (options.outputFile != null && options.outputFormat == OutputFormat.console) {
                    System.out.println("Report written to: " + options.outputFile);
                }
                return options.exitCode(result.findingsAtLeast(config.minScore()));
            } catch (IOException e) {
                System.err.println("Error: " + e.getMessage());
                if (options.verbose) {
                    e.printStackTrace();
                }
                return 1;
            }
        }
    }

    @Command(
            name = "diff",
            mixinStandardHelpOptions = true,
            description = "Compares two versions of a package and analyzes changed archives on both sides.",
            exitCodeOnInvalidInput = 1,
            exitCodeOnExecutionException = 1
    )
    static class DiffCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Old version (file, archive or directory)")
        Path a;

        @Parameters(index = "1", description = "New version (file, archive or directory)")
        Path b;

        @Mixin
        CommonOptions options;

        @Override
        public Integer call() {
            options.configureLogging();
            try {
                for (Path path : List.of(a, b)) {
                    if (!Files.exists(path)) {
                        System.err.println("Error: Path does not exist: " + path);
                        return 1;
                    }
                }
                ScanConfig config = options.loadConfig();

                options.log("Comparing " + a + " with " + b + "...");
                DiffReport report = new ArchiveDiffAnalyzer(config).diff(ScanLocation.of(a), ScanLocation.of(b));
                List<Finding> reported = report.findings().stream()
                        .filter(f -> f.score() >= config.minScore())
                        .toList();

                options.writeOutput(out -> {
                    if (options.outputFormat == OutputFormat.json) {
                        new JsonOutput().minScore(config.minScore()).write(report, out);
                    } else {
                        PrintStream printer = new PrintStream(out, true, StandardCharsets.UTF_8);
                        new ConsoleOutput(printer).minScore(config.minScore()).print(report);
                        printer.flush();
                    }
                });
                return options.exitCode(reported);
            } catch (IOException e) {
                System.err.println("Error: " + e.getMessage());
                if (options.verbose) {
                    e.printStackTrace();
                }
                return 1;
            }
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PackScanCli()).execute(args);
        System.exit(exitCode);
    }
}
