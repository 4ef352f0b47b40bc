package net.readtrack.application.timeline;

import net.readtrack.application.stats.StatsQueryService;
import net.readtrack.domain.timeline.EntityKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Reacts to committed timeline mutations: invalidates affected stats cache rows and, for
 * catalog updates, refreshes the denormalized payloads that embed the changed entity.
 * Nothing here runs for rolled-back mutations.
 */
@Component
public class TimelineMutationListener {

    private static final Logger log = LoggerFactory.getLogger(TimelineMutationListener.class);

    private final StatsQueryService statsQueryService;
    private final TimelineRebuildService timelineRebuildService;
    private final boolean refreshOnUpdate;

    public TimelineMutationListener(StatsQueryService statsQueryService,
                                    TimelineRebuildService timelineRebuildService,
                                    @Value("${app.timeline.refresh-on-update:true}") boolean refreshOnUpdate) {
        this.statsQueryService = statsQueryService;
        this.timelineRebuildService = timelineRebuildService;
        this.refreshOnUpdate = refreshOnUpdate;
    }

    /**
     * Reading changes affect one user's stats; catalog changes rename things in everybody's.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void invalidateStats(TimelineMutationEvent event) {
        EntityKey key = event.getKey();
        if (key.entityType().isCatalogEntity()) {
            int removed = statsQueryService.invalidateAll();
            log.debug("{} invalidated {} stats cache rows", event, removed);
            return;
        }
        Long userId = event.getStatsUserId();
        if (userId == null) {
            log.debug("{} has no user to invalidate stats for", event);
            return;
        }
        statsQueryService.invalidateUser(userId);
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void refreshDependents(TimelineMutationEvent event) {
        if (!refreshOnUpdate || !event.isUpdate() || !event.getKey().entityType().isCatalogEntity()) {
            return;
        }
        try {
            timelineRebuildService.refreshEntityCascade(event.getKey());
        } catch (RuntimeException ex) {
            log.error("Cascade timeline refresh failed for {}; the next full rebuild will repair it", event.getKey(), ex);
        }
    }
}
