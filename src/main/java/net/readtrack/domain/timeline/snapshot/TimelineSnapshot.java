package net.readtrack.domain.timeline.snapshot;

import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.TimelinePayload;

/**
 * Current state of one tracked entity, tagged by {@link EntityType}.
 *
 * <p>Each variant knows which of its fields are required and how it is rendered into the
 * denormalized {@link TimelinePayload} stored on timeline events. Rendering is a pure function
 * of the snapshot so re-rendering unchanged state yields an identical payload.</p>
 */
public sealed interface TimelineSnapshot permits AuthorSnapshot, BookSnapshot, GenreSnapshot, ReadingSnapshot {

    EntityType entityType();

    long entityId();

    default EntityKey key() {
        return EntityKey.of(entityType(), entityId());
    }

    /**
     * Validates required fields and renders the display payload.
     *
     * @return payload to store on timeline events for this entity
     * @throws net.readtrack.exception.TimelineSnapshotValidationException when required fields are absent
     */
    TimelinePayload toPayload();
}
