package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;
import java.util.Objects;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.snapshot.TimelineSnapshot;

/**
 * An entity write together with the timeline metadata it should be recorded under.
 *
 * @param entityType kind of entity the write touches
 * @param action action label to record
 * @param actingUserId user performing the write, if known
 * @param write callback that applies the write and reports the resulting state
 */
public record EntityMutation(EntityType entityType,
                             String action,
                             @Nullable Long actingUserId,
                             EntityWrite write) {

    public EntityMutation {
        Objects.requireNonNull(entityType, "entityType");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(write, "write");
    }

    /**
     * Applies the entity write against the library tables.
     */
    @FunctionalInterface
    public interface EntityWrite {
        Outcome apply();
    }

    /**
     * @param entityId id of the written entity (generated ids included)
     * @param newState state after the write; {@code null} for deletions
     */
    public record Outcome(long entityId, @Nullable TimelineSnapshot newState) {
    }
}
