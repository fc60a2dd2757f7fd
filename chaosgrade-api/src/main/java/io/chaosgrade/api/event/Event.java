package io.chaosgrade.api.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A typed event reconstructed from one log line.
 * <p>
 * The sealed hierarchy keeps every event kind known at compile time; each kind
 * carries only the fields meaningful to it. Every event knows its 1-based source
 * line and, where the line had one, its timestamp as written in the log.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Event.ToolCall.class, name = "tool_call"),
        @JsonSubTypes.Type(value = Event.Fuzzing.class, name = "fuzzing"),
        @JsonSubTypes.Type(value = Event.Error.class, name = "error"),
        @JsonSubTypes.Type(value = Event.Retry.class, name = "retry"),
        @JsonSubTypes.Type(value = Event.Completion.class, name = "completion"),
        @JsonSubTypes.Type(value = Event.Crash.class, name = "crash"),
        @JsonSubTypes.Type(value = Event.Response.class, name = "response")
})
public sealed interface Event {

    /**
     * @return 1-based line number in the analyzed log file
     */
    int line();

    /**
     * @return the timestamp as found in the log, or null if the line had none
     */
    String timestamp();

    /**
     * An outgoing tool invocation. {@code toolName} is the declared or inferred tool.
     */
    record ToolCall(int line, String timestamp, String url, String toolName) implements Event {}

    /**
     * A fuzzing injection observed by the interception layer.
     */
    record Fuzzing(int line, String timestamp, String fuzzType, int fieldsFuzzed) implements Event {}

    /**
     * An error line, classified by kind. The message is truncated.
     */
    record Error(int line, String timestamp, String errorType, String message) implements Event {}

    /**
     * A retry attempt.
     */
    record Retry(int line, String timestamp) implements Event {}

    /**
     * The agent reported successful completion of its workflow.
     */
    record Completion(int line, String timestamp) implements Event {}

    /**
     * The agent crashed (exception, traceback). The message is truncated.
     */
    record Crash(int line, String timestamp, String message) implements Event {}

    /**
     * An HTTP response with its status code.
     */
    record Response(int line, String timestamp, int statusCode) implements Event {}
}
