package io.chaosgrade.cli;

/**
 * Parsed command-line options.
 *
 * @param logFile   explicit log file, or null to auto-detect
 * @param logDir    directory searched for {@code *.log} files
 * @param outputDir directory the reports are written to
 * @param jsonOnly  write only the JSON report
 * @param mdOnly    write only the Markdown report
 * @param help      print usage and exit
 */
public record CliOptions(
        String logFile,
        String logDir,
        String outputDir,
        boolean jsonOnly,
        boolean mdOnly,
        boolean help
) {

    public static final String USAGE = String.join("\n",
            "Usage: chaosgrade [options]",
            "",
            "Generate a resilience scorecard from chaos testing logs.",
            "",
            "Options:",
            "  --log-file <path>   Path to proxy log file (default: auto-detect)",
            "  --log-dir <dir>     Directory to search for log files (default: logs)",
            "  --output-dir <dir>  Output directory for reports (default: .)",
            "  --json-only         Only generate JSON report",
            "  --md-only           Only generate Markdown report",
            "  --help              Show this message",
            "");

    public static CliOptions defaults() {
        return new CliOptions(null, "logs", ".", false, false, false);
    }

    /**
     * @throws IllegalArgumentException on an unknown flag, a flag missing its value,
     *                                  or both {@code --json-only} and {@code --md-only}
     */
    public static CliOptions parse(String[] args) {
        String logFile = null;
        String logDir = "logs";
        String outputDir = ".";
        boolean jsonOnly = false;
        boolean mdOnly = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--log-file" -> logFile = value(args, ++i, arg);
                case "--log-dir" -> logDir = value(args, ++i, arg);
                case "--output-dir" -> outputDir = value(args, ++i, arg);
                case "--json-only" -> jsonOnly = true;
                case "--md-only" -> mdOnly = true;
                case "--help", "-h" -> help = true;
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        if (jsonOnly && mdOnly) {
            throw new IllegalArgumentException("--json-only and --md-only are mutually exclusive");
        }
        return new CliOptions(logFile, logDir, outputDir, jsonOnly, mdOnly, help);
    }

    public boolean writeJson() {
        return !mdOnly;
    }

    public boolean writeMarkdown() {
        return !jsonOnly;
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }
}
