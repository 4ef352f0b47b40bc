package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;
import net.readtrack.domain.timeline.EntityKey;

/**
 * Published inside the mutating transaction once a timeline event has been appended.
 * Listeners that act on it must wait for the commit.
 */
public class TimelineMutationEvent {

    private final long eventId;
    private final EntityKey key;
    private final String action;
    private final Long statsUserId;

    /**
     * @param eventId id of the appended timeline event
     * @param key entity that changed
     * @param action recorded action label
     * @param statsUserId owner of the changed reading, or the acting user; catalog changes affect every user
     */
    public TimelineMutationEvent(long eventId, EntityKey key, String action, @Nullable Long statsUserId) {
        this.eventId = eventId;
        this.key = key;
        this.action = action;
        this.statsUserId = statsUserId;
    }

    public long getEventId() {
        return eventId;
    }

    public EntityKey getKey() {
        return key;
    }

    @Nullable
    public Long getStatsUserId() {
        return statsUserId;
    }

    /** Whether the entity still exists after this mutation and may have changed its rendered fields. */
    public boolean isUpdate() {
        return TimelineActions.UPDATED.equals(action);
    }

    @Override
    public String toString() {
        return "TimelineMutationEvent{" + key + " " + action + " #" + eventId + "}";
    }
}
