package io.trigger4j.core;

import java.time.Instant;

/**
 * Outcome of one lifecycle sweep.
 *
 * archived : events moved ACTIVE -> ARCHIVED
 * deleted  : events moved ARCHIVED -> DELETED
 */
public record SweepResult(
        long archived,
        long deleted,
        Instant sweptAt
) {

    public boolean changed() {
        return archived > 0 || deleted > 0;
    }
}
