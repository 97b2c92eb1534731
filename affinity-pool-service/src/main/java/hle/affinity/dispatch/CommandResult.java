package hle.affinity.dispatch;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Outcome of one dispatched command: either the result payload or the failure,
 * with timing metadata.
 *
 * @param <T> the type of the result value
 */
public final class CommandResult<T> {

    private final String commandId;
    private final T value;
    private final Throwable exception;
    private final Instant startTime;
    private final Instant endTime;
    private final boolean success;

    private CommandResult(String commandId, T value, Throwable exception,
                          Instant startTime, Instant endTime, boolean success) {
        this.commandId = commandId;
        this.value = value;
        this.exception = exception;
        this.startTime = startTime;
        this.endTime = endTime;
        this.success = success;
    }

    public static <T> CommandResult<T> success(String commandId, T value, Instant startTime, Instant endTime) {
        return new CommandResult<>(commandId, value, null, startTime, endTime, true);
    }

    public static <T> CommandResult<T> failure(String commandId, Throwable exception,
                                               Instant startTime, Instant endTime) {
        return new CommandResult<>(commandId, null, exception, startTime, endTime, false);
    }

    public String getCommandId() {
        return commandId;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> getException() {
        return Optional.ofNullable(exception);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Gets the time from the dispatcher picking the command up to its completion.
     */
    public Duration getDuration() {
        return Duration.between(startTime, endTime);
    }

    /**
     * Gets the value or throws the failure.
     */
    public T getOrThrow() throws Exception {
        if (success) {
            return value;
        }
        if (exception instanceof Exception) {
            throw (Exception) exception;
        }
        throw new RuntimeException(exception);
    }

    public T getOrDefault(T defaultValue) {
        return success ? value : defaultValue;
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("CommandResult[commandId=%s, success=true, value=%s, duration=%dms]",
                    commandId, describe(value), getDuration().toMillis());
        }
        String errorMessage = exception != null
                ? (exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName())
                : "unknown error";
        return String.format("CommandResult[commandId=%s, success=false, error=%s, duration=%dms]",
                commandId, errorMessage, getDuration().toMillis());
    }

    private static String describe(Object value) {
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return String.valueOf(value);
    }
}
