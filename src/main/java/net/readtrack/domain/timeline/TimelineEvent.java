package net.readtrack.domain.timeline;

import jakarta.annotation.Nullable;
import java.time.Instant;

/**
 * Stored timeline event: immutable identity plus the current denormalized payload.
 */
public record TimelineEvent(
    long id,
    EntityKey key,
    String action,
    Instant occurredAt,
    @Nullable Long userId,
    TimelinePayload payload
) {

    public TimelineCursor cursor() {
        return new TimelineCursor(occurredAt, id);
    }
}
