package dev.nishisan.monitor.common;

/**
 * Side channel for problems detected on best-effort recording paths.
 * <p>
 * Recording calls such as {@code recordFunctionCall} never report failures to
 * their caller. Whatever went wrong (an unknown execution id, a call after
 * termination, a malformed argument) is handed to this sink instead.
 */
@FunctionalInterface
public interface DiagnosticSink {

    /**
     * @param operation   the recording operation that was dropped or adjusted
     * @param executionId the execution it targeted, may be {@code null}
     * @param reason      human-readable description
     */
    void report(String operation, String executionId, String reason);
}
