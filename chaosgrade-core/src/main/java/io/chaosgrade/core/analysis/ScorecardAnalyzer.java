package io.chaosgrade.core.analysis;

import io.chaosgrade.api.analysis.Analyzer;
import io.chaosgrade.api.analysis.AnalyzerConfig;
import io.chaosgrade.api.event.Event;
import io.chaosgrade.api.metrics.Metrics;
import io.chaosgrade.api.metrics.MetricsCollector;
import io.chaosgrade.api.scorecard.Grade;
import io.chaosgrade.api.scorecard.Scorecard;
import io.chaosgrade.api.scorecard.ScorecardMetadata;
import io.chaosgrade.core.correlate.RaceDetector;
import io.chaosgrade.core.correlate.RetryCorrelator;
import io.chaosgrade.core.locate.LogLocator;
import io.chaosgrade.core.metrics.MicrometerMetricsCollector;
import io.chaosgrade.core.metrics.ScoreCalculator;
import io.chaosgrade.core.stream.EventStream;
import io.chaosgrade.core.stream.EventStreamReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Default {@link Analyzer}: locates the log, reads it in one pass, correlates
 * retries and races, then scores and grades the run.
 * <p>
 * Usage:
 * <pre>{@code
 * var config = AnalyzerConfig.create()
 *     .logFile("logs/proxy.log");
 *
 * Scorecard scorecard = new ScorecardAnalyzer(config).analyze();
 * }</pre>
 * Every call to {@link #analyze()} starts from a fresh collector, so analyzing
 * the same file twice yields equal scorecards apart from the generation time.
 */
public class ScorecardAnalyzer implements Analyzer {

    private static final Logger log = LoggerFactory.getLogger(ScorecardAnalyzer.class);

    public static final String NO_LOG_WARNING = "No log file found";
    public static final String READ_FAILURE_WARNING = "Failed to read log file";

    private final AnalyzerConfig config;
    private final Supplier<MetricsCollector> collectorFactory;
    private final LogLocator locator;
    private final EventStreamReader reader;
    private final RetryCorrelator retryCorrelator;
    private final RaceDetector raceDetector;
    private final ScoreCalculator scoreCalculator;

    public ScorecardAnalyzer(AnalyzerConfig config) {
        this(config, MicrometerMetricsCollector::new);
    }

    public ScorecardAnalyzer(AnalyzerConfig config, Supplier<MetricsCollector> collectorFactory) {
        this.config = config;
        this.collectorFactory = collectorFactory;
        this.locator = new LogLocator(config);
        this.reader = new EventStreamReader();
        this.retryCorrelator = new RetryCorrelator(config.retryWindowLines());
        this.raceDetector = new RaceDetector(config.dependencyRules(), config.simultaneityWindow());
        this.scoreCalculator = new ScoreCalculator();
    }

    @Override
    public Scorecard analyze() {
        Optional<Path> logFile = locator.locate();
        if (logFile.isEmpty()) {
            log.warn("No log file found (log dir: {}), producing an empty scorecard", config.logDir());
            return emptyScorecard(null, NO_LOG_WARNING);
        }

        Path path = logFile.get();
        log.info("Parsing log file: {}", path);

        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Error reading log file {}", path, e);
            return emptyScorecard(path.toString(), READ_FAILURE_WARNING);
        }

        return analyzeLines(path.toString(), lines);
    }

    Scorecard analyzeLines(String logFile, List<String> lines) {
        MetricsCollector collector = collectorFactory.get();

        EventStream stream = reader.read(lines, collector);
        retryCorrelator.correlate(stream, collector);
        raceDetector.detect(stream, collector);

        Metrics metrics = scoreCalculator.calculate(collector.snapshot());
        Grade grade = Grade.fromScore(metrics.resilienceScore());

        log.info("Analyzed {} lines: {} events, score {}, grade {}",
                lines.size(), stream.events().size(), metrics.resilienceScore(), grade);

        return new Scorecard(
                ScorecardMetadata.analyzed(Instant.now(config.clock()), logFile, lines.size()),
                metrics,
                grade,
                ScorecardSummary.of(metrics, grade),
                Recommendations.of(metrics, grade),
                EventStream.lastN(stream.eventsOf(Event.ToolCall.class), config.recentToolCalls()),
                EventStream.lastN(stream.events(), config.recentEvents()));
    }

    private Scorecard emptyScorecard(String logFile, String warning) {
        // Not scored: the vacuous recovery and completion rates would give 60.
        Metrics empty = Metrics.empty();
        return new Scorecard(
                ScorecardMetadata.unavailable(Instant.now(config.clock()), logFile, warning),
                empty,
                Grade.NOT_AVAILABLE,
                ScorecardSummary.empty(),
                Recommendations.of(empty, Grade.NOT_AVAILABLE),
                List.of(),
                List.of());
    }

    @Override
    public AnalyzerConfig config() {
        return config;
    }
}
