package io.trigger4j.core;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Returned at once by a manual cleanup request; {@code completion} finishes when the queued sweep has run.
 */
public record CleanupAcknowledgement(
        String message,
        Instant requestedAt,
        CompletableFuture<SweepResult> completion
) {
}
