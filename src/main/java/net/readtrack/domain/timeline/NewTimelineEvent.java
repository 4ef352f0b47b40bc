package net.readtrack.domain.timeline;

import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * Event about to be appended; the store assigns the id.
 *
 * @param key entity the mutation applied to
 * @param action free-form action label such as {@code created} or {@code finished}
 * @param occurredAt event time, already truncated to the store's precision
 * @param userId acting user, attribution only
 * @param payload denormalized display snapshot
 */
public record NewTimelineEvent(
    EntityKey key,
    String action,
    Instant occurredAt,
    @Nullable Long userId,
    TimelinePayload payload
) {
    public NewTimelineEvent {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(occurredAt, "occurredAt");
        Objects.requireNonNull(payload, "payload");
    }
}
