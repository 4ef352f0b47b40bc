package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.NewTimelineEvent;
import net.readtrack.domain.timeline.TimelineEvent;
import net.readtrack.domain.timeline.TimelinePayload;
import net.readtrack.domain.timeline.snapshot.ReadingSnapshot;
import net.readtrack.domain.timeline.snapshot.TimelineSnapshot;
import net.readtrack.exception.TimelineSnapshotValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Appends exactly one timeline event per accepted entity mutation.
 *
 * <p>Must be called inside the transaction that applies the mutation: a failed append rolls
 * the mutation back and a rolled-back mutation leaves no event behind.</p>
 */
@Service
public class TimelineRecorder {

    private static final Logger log = LoggerFactory.getLogger(TimelineRecorder.class);

    private final TimelineEventRepository timelineEventRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public TimelineRecorder(TimelineEventRepository timelineEventRepository,
                            ApplicationEventPublisher eventPublisher,
                            Clock clock) {
        this.timelineEventRepository = timelineEventRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Records one mutation.
     *
     * @param entityType kind of entity mutated
     * @param entityId id of the entity mutated
     * @param action action label, for example {@code created} or {@code finished}
     * @param actingUserId user who performed the mutation, if known
     * @param newState entity state after the mutation; may be {@code null} only for deletions,
     *                 in which case the last recorded payload of the entity is reused
     * @return the stored event
     * @throws TimelineSnapshotValidationException when the snapshot is missing required fields,
     *         does not describe the given entity, or is absent where it is required
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TimelineEvent record(EntityType entityType,
                                long entityId,
                                String action,
                                @Nullable Long actingUserId,
                                @Nullable TimelineSnapshot newState) {
        if (!StringUtils.hasText(action)) {
            throw new IllegalArgumentException("Timeline action is required for " + entityType.dbValue() + ":" + entityId);
        }
        EntityKey key = EntityKey.of(entityType, entityId);
        String normalizedAction = action.trim();
        TimelineEvent lastRecorded = newState == null ? requireLastRecorded(key, normalizedAction) : null;
        TimelinePayload payload = lastRecorded != null ? lastRecorded.payload() : renderPayload(key, newState);

        Instant occurredAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        NewTimelineEvent event = new NewTimelineEvent(key, normalizedAction, occurredAt, actingUserId, payload);
        long id = timelineEventRepository.append(event);
        log.info("Recorded timeline event {} for {} ({})", id, key, normalizedAction);

        Long statsUserId = statsUserId(key, newState, lastRecorded, actingUserId);
        eventPublisher.publishEvent(new TimelineMutationEvent(id, key, normalizedAction, statsUserId));
        return new TimelineEvent(id, key, normalizedAction, occurredAt, actingUserId, payload);
    }

    private TimelineEvent requireLastRecorded(EntityKey key, String action) {
        if (!TimelineActions.DELETED.equals(action)) {
            throw new TimelineSnapshotValidationException(key.entityType(), "newState",
                "entity state is required for action '" + action + "'");
        }
        return timelineEventRepository.findLatestByEntity(key)
            .orElseThrow(() -> new TimelineSnapshotValidationException(key.entityType(), "newState",
                "no recorded state for deleted " + key + "; supply the last known snapshot"));
    }

    private static TimelinePayload renderPayload(EntityKey key, TimelineSnapshot newState) {
        if (!newState.key().equals(key)) {
            throw new TimelineSnapshotValidationException(key.entityType(), "entityId",
                "snapshot describes " + newState.key() + " but the mutation targets " + key);
        }
        return newState.toPayload();
    }

    /**
     * Whose stats the mutation affects. A reading belongs to its owner, who is not necessarily
     * the acting user; a reading deleted without state is attributed to the user of its last event.
     */
    @Nullable
    private static Long statsUserId(EntityKey key,
                                    @Nullable TimelineSnapshot newState,
                                    @Nullable TimelineEvent lastRecorded,
                                    @Nullable Long actingUserId) {
        if (newState instanceof ReadingSnapshot reading && reading.userId() != null) {
            return reading.userId();
        }
        if (key.entityType() == EntityType.READING && lastRecorded != null && lastRecorded.userId() != null) {
            return lastRecorded.userId();
        }
        return actingUserId;
    }
}
