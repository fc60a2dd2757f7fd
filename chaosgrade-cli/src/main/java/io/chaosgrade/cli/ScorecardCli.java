package io.chaosgrade.cli;

import io.chaosgrade.api.analysis.AnalyzerConfig;
import io.chaosgrade.api.report.ReportGenerator;
import io.chaosgrade.api.scorecard.Scorecard;
import io.chaosgrade.core.analysis.ScorecardAnalyzer;
import io.chaosgrade.core.report.JsonReportGenerator;
import io.chaosgrade.core.report.MarkdownReportGenerator;
import io.chaosgrade.core.report.ReportGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line entry point: analyzes one log and writes the JSON and/or
 * Markdown scorecard.
 * <p>
 * Exit status is 0 on success (including when no log file was found), 1 when a
 * report could not be written and 2 on invalid arguments.
 */
public class ScorecardCli {

    private static final Logger log = LoggerFactory.getLogger(ScorecardCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String RULE = "=".repeat(70);

    private final PrintStream out;
    private final PrintStream err;

    public ScorecardCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new ScorecardCli(System.out, System.err).run(args));
    }

    public int run(String[] args) {
        CliOptions options;
        AnalyzerConfig config;
        try {
            options = CliOptions.parse(args);
            config = AnalyzerConfig.create()
                    .logFile(options.logFile())
                    .logDir(options.logDir());
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.print(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            out.print(CliOptions.USAGE);
            return EXIT_OK;
        }

        out.println();
        out.println(RULE);
        out.println("Resilience Scorecard Generator");
        out.println(RULE);
        out.println();

        Path outputDir = Path.of(options.outputDir());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            log.error("Cannot create output directory {}", outputDir, e);
            return EXIT_FAILURE;
        }

        Scorecard scorecard = new ScorecardAnalyzer(config).analyze();

        try {
            for (ReportGenerator generator : generators(options)) {
                Path path = generator.generate(scorecard, outputDir.resolve(generator.defaultFileName()));
                out.println("✓ " + generator.format() + " report: " + path);
            }
        } catch (ReportGenerationException e) {
            log.error("Report generation failed", e);
            return EXIT_FAILURE;
        }

        printSummary(scorecard);
        return EXIT_OK;
    }

    private static List<ReportGenerator> generators(CliOptions options) {
        List<ReportGenerator> generators = new ArrayList<>();
        if (options.writeJson()) {
            generators.add(new JsonReportGenerator());
        }
        if (options.writeMarkdown()) {
            generators.add(new MarkdownReportGenerator());
        }
        return generators;
    }

    private void printSummary(Scorecard scorecard) {
        out.println();
        out.println(RULE);
        out.println("Scorecard Summary");
        out.println(RULE);
        out.println();
        out.println("Grade: " + scorecard.grade());
        out.println(String.format(Locale.ROOT, "Resilience Score: %.1f/100", scorecard.metrics().resilienceScore()));
        out.println();

        for (Map.Entry<String, String> entry : scorecard.summary().entrySet()) {
            if (!"grade".equals(entry.getKey())) {
                out.println("  " + MarkdownReportGenerator.titleCase(entry.getKey()) + ": " + entry.getValue());
            }
        }

        out.println();
        out.println(RULE);
        out.println();
    }
}
