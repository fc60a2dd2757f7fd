package io.chaosgrade.core.locate;

import io.chaosgrade.api.analysis.AnalyzerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves which log file to analyze.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>the explicitly configured log file, if it exists</li>
 *   <li>the conventional proxy log names, in order</li>
 *   <li>the first {@code *.log} file in the log directory</li>
 * </ol>
 * All relative paths resolve against the configured base directory.
 * Finding nothing is a normal outcome, reported as an empty Optional.
 */
public class LogLocator {

    private static final Logger log = LoggerFactory.getLogger(LogLocator.class);

    private final AnalyzerConfig config;

    public LogLocator(AnalyzerConfig config) {
        this.config = config;
    }

    public Optional<Path> locate() {
        Path baseDir = config.baseDir();

        if (config.logFile() != null && !config.logFile().isBlank()) {
            Path explicit = baseDir.resolve(config.logFile());
            if (Files.isRegularFile(explicit)) {
                return Optional.of(explicit);
            }
            log.warn("Log file {} does not exist, searching conventional locations", explicit);
        }

        for (String name : config.conventionalLogNames()) {
            Path candidate = baseDir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                log.debug("Found conventional log file {}", candidate);
                return Optional.of(candidate);
            }
        }

        return firstLogInDirectory(baseDir.resolve(config.logDir()));
    }

    private Optional<Path> firstLogInDirectory(Path logDir) {
        if (!Files.isDirectory(logDir)) {
            return Optional.empty();
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(logDir, "*.log")) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    return Optional.of(entry);
                }
            }
        } catch (IOException e) {
            log.warn("Could not list log directory {}", logDir, e);
        }
        return Optional.empty();
    }
}
