package io.chaosgrade.core.report;

import io.chaosgrade.api.metrics.LogicError;
import io.chaosgrade.api.metrics.MetricCounts;
import io.chaosgrade.api.metrics.Rates;
import io.chaosgrade.api.metrics.Tally;
import io.chaosgrade.api.report.ReportGenerator;
import io.chaosgrade.api.scorecard.Scorecard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the scorecard as a human-readable Markdown document.
 * <p>
 * Sections: header with grade and score, summary, detailed metrics (tool calls,
 * swarm errors, fuzzing, recovery, agent outcome, race conditions, error
 * breakdown) and recommendations. Optional sections are left out when they
 * would be empty.
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    public static final String DEFAULT_FILE_NAME = "resilience_report.md";

    static final int LOGIC_ERROR_DETAILS = 5;

    @Override
    public Path generate(Scorecard scorecard, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputPath, render(scorecard), StandardCharsets.UTF_8);
            log.info("Markdown report generated: {}", outputPath);
            return outputPath;
        } catch (IOException e) {
            throw new ReportGenerationException("Failed to write Markdown report to " + outputPath, e);
        }
    }

    @Override
    public String format() {
        return "Markdown";
    }

    @Override
    public String defaultFileName() {
        return DEFAULT_FILE_NAME;
    }

    public String render(Scorecard scorecard) {
        MetricCounts counts = scorecard.metrics().counts();
        Rates rates = scorecard.metrics().rates();
        StringBuilder md = new StringBuilder();

        md.append("# Resilience Scorecard\n\n");
        md.append("**Generated:** ").append(scorecard.metadata().generatedAt()).append("\n\n");
        md.append("## Overall Grade: ").append(scorecard.grade()).append("\n\n");
        md.append("**Resilience Score:** ").append(fmt("%.1f", rates.resilienceScore())).append("/100\n\n");

        md.append("## Summary\n\n");
        for (Map.Entry<String, String> entry : scorecard.summary().entrySet()) {
            if (!"grade".equals(entry.getKey())) {
                md.append("- **").append(titleCase(entry.getKey())).append(":** ").append(entry.getValue()).append('\n');
            }
        }
        md.append('\n');

        md.append("## Detailed Metrics\n\n");
        appendToolCalls(md, counts, rates);
        appendSwarm(md, counts);
        appendFuzzing(md, counts, rates);

        md.append("### System Recovery\n\n");
        md.append("- Retry Attempts: ").append(counts.retryAttempts()).append('\n');
        md.append("- Successful Retries: ").append(counts.successfulRetries()).append('\n');
        md.append("- Recovery Rate: ").append(fmt("%.1f", rates.systemRecoveryRate())).append("%\n\n");

        md.append("### Agent Outcome\n\n");
        md.append("- Successful Completions: ").append(counts.agentSuccessfulCompletion()).append('\n');
        md.append("- Crashes: ").append(counts.agentCrashes()).append("\n\n");

        appendRaceConditions(md, counts);

        if (!counts.toolCallErrors().isEmpty()) {
            md.append("### Error Breakdown\n\n");
            appendTally(md, counts.toolCallErrors());
            md.append('\n');
        }

        md.append("## Recommendations\n\n");
        for (String recommendation : scorecard.recommendations()) {
            md.append("- ").append(recommendation).append('\n');
        }
        md.append('\n');

        return md.toString();
    }

    private void appendToolCalls(StringBuilder md, MetricCounts counts, Rates rates) {
        md.append("### Tool Calls\n\n");
        md.append("- Total Tool Calls: ").append(counts.totalToolCalls()).append('\n');
        md.append("- Successful: ").append(counts.successfulToolCalls()).append('\n');
        md.append("- Failed: ").append(counts.failedToolCalls()).append('\n');
        md.append("- Success Rate: ").append(fmt("%.1f", rates.toolCallSuccessRate())).append("%\n\n");
    }

    private void appendSwarm(StringBuilder md, MetricCounts counts) {
        if (counts.swarmCommunicationErrors().isEmpty()) {
            return;
        }
        md.append("### Swarm Communication Errors\n\n");
        appendTally(md, counts.swarmCommunicationErrors());
        md.append('\n');

        md.append("**Swarm Disruption Summary:**\n");
        md.append("- Agent-to-Agent Disruptions: ").append(counts.agentToAgentDisruptions()).append('\n');
        md.append("- Message Mutations: ").append(counts.messageMutations()).append('\n');
        md.append("- Consensus Delays: ").append(counts.consensusDelays()).append('\n');
        md.append("- Agent Isolations: ").append(counts.agentIsolations()).append("\n\n");
    }

    private void appendFuzzing(StringBuilder md, MetricCounts counts, Rates rates) {
        md.append("### Fuzzing\n\n");
        md.append("- Fuzzing Attempts: ").append(counts.fuzzingAttempts()).append('\n');
        md.append("- Successful Injections: ").append(counts.fuzzingSuccessful()).append('\n');
        md.append("- Fuzzing Success Rate: ").append(fmt("%.1f", rates.fuzzingSuccessRate())).append("%\n\n");

        if (!counts.fuzzingTypes().isEmpty()) {
            md.append("**Fuzzing Types:**\n");
            appendTally(md, counts.fuzzingTypes());
            md.append('\n');
        }
    }

    private void appendRaceConditions(StringBuilder md, MetricCounts counts) {
        if (counts.raceConditionsDetected() == 0) {
            return;
        }
        md.append("### Race Conditions Detected\n\n");
        md.append("**Critical Issue**: ").append(counts.raceConditionsDetected()).append(" race condition(s) found!\n\n");
        md.append("**What this means**: The agent called dependent tools (e.g., `book_ticket`) ")
                .append("before their dependencies (e.g., `search_flights`) completed, or with invalid data.\n\n");

        List<LogicError> errors = counts.logicErrors();
        if (errors.isEmpty()) {
            return;
        }
        md.append("**Details**:\n");
        for (int i = 0; i < Math.min(errors.size(), LOGIC_ERROR_DETAILS); i++) {
            LogicError error = errors.get(i);
            md.append(i + 1).append(". ").append(error.description()).append('\n');
            if (error.dependentCallTime() != null) {
                md.append("   - Time: ").append(error.dependentCallTime()).append('\n');
            }
            if (error.dependentCallStatus() != null) {
                md.append("   - Status: ").append(error.dependentCallStatus()).append('\n');
            }
        }
        md.append('\n');
    }

    private static void appendTally(StringBuilder md, Tally tally) {
        tally.asMap().forEach((key, count) -> md.append("- ").append(key).append(": ").append(count).append('\n'));
    }

    /**
     * {@code protocol_attacks} becomes {@code Protocol Attacks}.
     */
    public static String titleCase(String key) {
        StringBuilder title = new StringBuilder();
        for (String word : key.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return title.toString();
    }

    private static String fmt(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}
