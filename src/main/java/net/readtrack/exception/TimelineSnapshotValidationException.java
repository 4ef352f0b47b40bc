package net.readtrack.exception;

import net.readtrack.domain.timeline.EntityType;

/**
 * An entity snapshot handed to the timeline is missing fields its entity type requires.
 * RETRYABLE: No (the same snapshot fails again); the originating mutation must roll back.
 */
public class TimelineSnapshotValidationException extends RuntimeException {

    private final EntityType entityType;
    private final String field;

    public TimelineSnapshotValidationException(EntityType entityType, String field, String detail) {
        super("Invalid " + entityType.dbValue() + " snapshot: " + detail);
        this.entityType = entityType;
        this.field = field;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    /** Name of the offending field. */
    public String getField() {
        return field;
    }
}
