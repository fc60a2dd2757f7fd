package io.chaosgrade.api.metrics;

/**
 * A logic defect found by correlating tool calls. Only race conditions are detected today.
 *
 * @param dependencyTool      the producer tool whose result the dependent call needs
 * @param dependentTool       the consumer tool that failed
 * @param dependentCallTime   time of the dependent call, as logged
 * @param dependentCallStatus HTTP status of the dependent call
 * @param dependencyAvailable whether a successful dependency call preceded the dependent call
 * @param simultaneousCalls   whether a dependency call fell inside the simultaneity window
 */
public record LogicError(
        String type,
        String description,
        String dependencyTool,
        String dependentTool,
        String dependentCallTime,
        Integer dependentCallStatus,
        boolean dependencyAvailable,
        boolean simultaneousCalls
) {

    public static final String RACE_CONDITION = "race_condition";

    public static LogicError raceCondition(String description, String dependencyTool, String dependentTool,
                                           String dependentCallTime, Integer dependentCallStatus,
                                           boolean dependencyAvailable, boolean simultaneousCalls) {
        return new LogicError(RACE_CONDITION, description, dependencyTool, dependentTool,
                dependentCallTime, dependentCallStatus, dependencyAvailable, simultaneousCalls);
    }
}
