package net.readtrack.application.timeline;

import net.readtrack.domain.timeline.TimelineEvent;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Entry point for entity write paths: applies the write and records its timeline event in one
 * transaction, so either both persist or neither does.
 */
@Service
public class TimelineMutationService {

    private final TimelineRecorder timelineRecorder;
    private final TransactionTemplate transactionTemplate;

    public TimelineMutationService(TimelineRecorder timelineRecorder, PlatformTransactionManager transactionManager) {
        this.timelineRecorder = timelineRecorder;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Runs {@code mutation.write()} and records the outcome.
     *
     * @return recorded timeline event
     * @throws net.readtrack.exception.TimelineSnapshotValidationException when the resulting state
     *         cannot be rendered; the write is rolled back
     */
    public TimelineEvent applyAndRecord(EntityMutation mutation) {
        return transactionTemplate.execute(status -> {
            EntityMutation.Outcome outcome = mutation.write().apply();
            return timelineRecorder.record(
                mutation.entityType(),
                outcome.entityId(),
                mutation.action(),
                mutation.actingUserId(),
                outcome.newState()
            );
        });
    }
}
