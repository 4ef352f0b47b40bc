package net.readtrack.application.timeline;

import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.application.stats.StatsQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Called by the account layer before a user row is deleted. Timeline events survive with
 * their attribution cleared; the user's stats cache row is invalidated and later removed with
 * the user row.
 */
@Service
public class UserRemovalHandler {

    private static final Logger log = LoggerFactory.getLogger(UserRemovalHandler.class);

    private final TimelineEventRepository timelineEventRepository;
    private final StatsQueryService statsQueryService;

    public UserRemovalHandler(TimelineEventRepository timelineEventRepository, StatsQueryService statsQueryService) {
        this.timelineEventRepository = timelineEventRepository;
        this.statsQueryService = statsQueryService;
    }

    @Transactional
    public void onUserRemoved(long userId) {
        int detached = timelineEventRepository.clearUserAttribution(userId);
        statsQueryService.invalidateUser(userId);
        log.info("Detached {} timeline events from removed user {}", detached, userId);
    }
}
