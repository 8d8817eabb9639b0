package io.agentmesh.model;

/**
 * Failure record for an event whose handler threw. {@code lastRetry} is null until
 * the same event fails a second time.
 */
public record DeadLetter(
        Event event,
        Throwable error,
        long failedAt,
        int retryCount,
        Long lastRetry
) {
    public static DeadLetter firstFailure(Event event, Throwable error, long nowMs) {
        return new DeadLetter(event, error, nowMs, 0, null);
    }

    public DeadLetter failedAgain(Throwable nextError, long nowMs) {
        return new DeadLetter(event, nextError, failedAt, retryCount + 1, nowMs);
    }

    public String errorMessage() {
        if (error == null) {
            return "";
        }
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
