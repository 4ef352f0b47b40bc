package net.readtrack.controller;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import net.readtrack.application.stats.StatsQueryService;
import net.readtrack.application.timeline.RebuildProgress;
import net.readtrack.application.timeline.RebuildSummary;
import net.readtrack.application.timeline.TimelineEntry;
import net.readtrack.application.timeline.TimelineQueryService;
import net.readtrack.application.timeline.TimelineRebuildService;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative operations on the timeline and the stats cache.
 */
@RestController
@RequestMapping("/admin")
@Slf4j
public class TimelineAdminController {

    private final TimelineRebuildService timelineRebuildService;
    private final TimelineQueryService timelineQueryService;
    private final StatsQueryService statsQueryService;

    public TimelineAdminController(TimelineRebuildService timelineRebuildService,
                                   TimelineQueryService timelineQueryService,
                                   StatsQueryService statsQueryService) {
        this.timelineRebuildService = timelineRebuildService;
        this.timelineQueryService = timelineQueryService;
        this.statsQueryService = statsQueryService;
    }

    /**
     * Runs a full rebuild on the request thread and returns its totals.
     *
     * @param resume continue after the checkpoint of an interrupted run
     */
    @PostMapping(value = "/timeline/rebuild", produces = MediaType.APPLICATION_JSON_VALUE)
    public RebuildSummary rebuildTimeline(@RequestParam(name = "resume", defaultValue = "false") boolean resume) {
        log.info("Admin requested timeline rebuild (resume={})", resume);
        return timelineRebuildService.rebuildAll(resume);
    }

    @GetMapping(value = "/timeline/rebuild/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public RebuildProgress getRebuildStatus() {
        return timelineRebuildService.getProgress();
    }

    @PostMapping(value = "/timeline/rebuild/cancel", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> cancelRebuild() {
        if (!timelineRebuildService.isRunning()) {
            return ResponseEntity.ok("No timeline rebuild is running");
        }
        timelineRebuildService.cancel();
        return ResponseEntity.ok("Timeline rebuild cancellation requested");
    }

    @PostMapping(value = "/timeline/refresh/{entityType}/{entityId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public RebuildSummary refreshEntity(@PathVariable("entityType") String entityType,
                                        @PathVariable("entityId") long entityId) {
        EntityKey key = EntityKey.of(EntityType.requireDbValue(entityType), entityId);
        log.info("Admin requested cascade refresh of {}", key);
        return timelineRebuildService.refreshEntityCascade(key);
    }

    @GetMapping(value = "/timeline/{entityType}/{entityId}/events", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TimelineEntry> getEntityHistory(@PathVariable("entityType") String entityType,
                                                @PathVariable("entityId") long entityId) {
        return timelineQueryService.history(EntityKey.of(EntityType.requireDbValue(entityType), entityId));
    }

    @DeleteMapping("/stats/{userId}")
    public ResponseEntity<Void> invalidateStats(@PathVariable("userId") long userId) {
        boolean userFound = statsQueryService.invalidateUser(userId);
        log.info("Admin invalidated stats cache for user {} (user found={})", userId, userFound);
        return ResponseEntity.noContent().build();
    }
}
