package io.chaosgrade.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chaosgrade.api.report.ReportGenerator;
import io.chaosgrade.api.scorecard.Scorecard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the scorecard as an indented JSON document with snake_case keys and
 * ISO-8601 timestamps.
 */
public class JsonReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportGenerator.class);

    public static final String DEFAULT_FILE_NAME = "resilience_report.json";

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path generate(Scorecard scorecard, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(outputPath.toFile(), scorecard);
            log.info("JSON report generated: {}", outputPath);
            return outputPath;
        } catch (IOException e) {
            throw new ReportGenerationException("Failed to write JSON report to " + outputPath, e);
        }
    }

    /**
     * @return the scorecard as the same JSON text {@link #generate} writes
     */
    public String render(Scorecard scorecard) {
        try {
            return objectMapper.writeValueAsString(scorecard);
        } catch (IOException e) {
            throw new ReportGenerationException("Failed to render JSON report", e);
        }
    }

    @Override
    public String format() {
        return "JSON";
    }

    @Override
    public String defaultFileName() {
        return DEFAULT_FILE_NAME;
    }
}
