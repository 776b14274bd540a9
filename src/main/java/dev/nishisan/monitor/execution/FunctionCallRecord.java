package dev.nishisan.monitor.execution;

import java.time.Instant;

/**
 * One timed sub-step of an execution, e.g. {@code voice_service.synthesize_speech}.
 *
 * @param name       the call name
 * @param durationMs how long the call took
 * @param success    whether the call succeeded
 * @param recordedAt when the call was reported
 */
public record FunctionCallRecord(String name, double durationMs, boolean success, Instant recordedAt) {
}
