package io.chaosgrade.api.analysis;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for one analysis run.
 * Controls where the log is looked up, the correlation windows, and how much
 * recent history the scorecard keeps.
 */
public final class AnalyzerConfig {

    /**
     * Names tried, in order, relative to the base directory when no explicit log file resolves.
     */
    public static final List<String> DEFAULT_LOG_NAMES = List.of(
            "proxy.log",
            "chaos_proxy.log",
            "proxy_logs.txt",
            "logs/proxy.log",
            "logs/chaos_proxy.log"
    );

    private String logFile = null; // null = auto-detect
    private String logDir = "logs";
    private Path baseDir = Path.of("");
    private List<String> conventionalLogNames = DEFAULT_LOG_NAMES;
    private int retryWindowLines = 10;
    private Duration simultaneityWindow = Duration.ofSeconds(2);
    private int recentToolCalls = 10;
    private int recentEvents = 20;
    private List<DependencyRule> dependencyRules = List.of(DependencyRule.SEARCH_BEFORE_BOOK);
    private Clock clock = Clock.systemUTC();

    private AnalyzerConfig() {}

    public static AnalyzerConfig create() {
        return new AnalyzerConfig();
    }

    public AnalyzerConfig logFile(String logFile) {
        this.logFile = logFile;
        return this;
    }

    public AnalyzerConfig logDir(String logDir) {
        if (logDir == null || logDir.isBlank()) {
            throw new IllegalArgumentException("Log directory must not be blank");
        }
        this.logDir = logDir;
        return this;
    }

    /**
     * Directory that relative log paths and conventional names resolve against.
     * Defaults to the working directory.
     */
    public AnalyzerConfig baseDir(Path baseDir) {
        this.baseDir = baseDir;
        return this;
    }

    public AnalyzerConfig conventionalLogNames(List<String> conventionalLogNames) {
        this.conventionalLogNames = List.copyOf(conventionalLogNames);
        return this;
    }

    /**
     * Number of lines, starting at the retry line itself, searched for a successful response.
     */
    public AnalyzerConfig retryWindowLines(int retryWindowLines) {
        if (retryWindowLines <= 0) {
            throw new IllegalArgumentException("Retry window must be positive");
        }
        this.retryWindowLines = retryWindowLines;
        return this;
    }

    /**
     * Two calls closer than this are considered simultaneous.
     */
    public AnalyzerConfig simultaneityWindow(Duration simultaneityWindow) {
        if (simultaneityWindow.isNegative() || simultaneityWindow.isZero()) {
            throw new IllegalArgumentException("Simultaneity window must be positive");
        }
        this.simultaneityWindow = simultaneityWindow;
        return this;
    }

    public AnalyzerConfig recentToolCalls(int recentToolCalls) {
        if (recentToolCalls < 0) {
            throw new IllegalArgumentException("Recent tool call limit must not be negative");
        }
        this.recentToolCalls = recentToolCalls;
        return this;
    }

    public AnalyzerConfig recentEvents(int recentEvents) {
        if (recentEvents < 0) {
            throw new IllegalArgumentException("Recent event limit must not be negative");
        }
        this.recentEvents = recentEvents;
        return this;
    }

    public AnalyzerConfig dependencyRules(List<DependencyRule> dependencyRules) {
        this.dependencyRules = List.copyOf(dependencyRules);
        return this;
    }

    public AnalyzerConfig addDependencyRule(DependencyRule rule) {
        List<DependencyRule> rules = new ArrayList<>(dependencyRules);
        rules.add(rule);
        this.dependencyRules = List.copyOf(rules);
        return this;
    }

    /**
     * Clock used for the scorecard's generation timestamp.
     */
    public AnalyzerConfig clock(Clock clock) {
        this.clock = clock;
        return this;
    }


    public String logFile() { return logFile; }
    public String logDir() { return logDir; }
    public Path baseDir() { return baseDir; }
    public List<String> conventionalLogNames() { return conventionalLogNames; }
    public int retryWindowLines() { return retryWindowLines; }
    public Duration simultaneityWindow() { return simultaneityWindow; }
    public int recentToolCalls() { return recentToolCalls; }
    public int recentEvents() { return recentEvents; }
    public List<DependencyRule> dependencyRules() { return dependencyRules; }
    public Clock clock() { return clock; }
}
