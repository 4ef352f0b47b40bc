package net.readtrack.controller;

import lombok.extern.slf4j.Slf4j;
import net.readtrack.application.timeline.TimelineEntry;
import net.readtrack.application.timeline.TimelineQueryService;
import net.readtrack.domain.timeline.TimelinePage;
import net.readtrack.domain.timeline.TimelineScope;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Activity feed. The acting user arrives in {@code X-User-Id}, set by the upstream auth layer.
 */
@RestController
@RequestMapping("/api/timeline")
@Slf4j
public class TimelineController {

    static final String USER_HEADER = "X-User-Id";

    private final TimelineQueryService timelineQueryService;

    public TimelineController(TimelineQueryService timelineQueryService) {
        this.timelineQueryService = timelineQueryService;
    }

    /**
     * Returns one page of the feed, newest first.
     *
     * @param scope {@code mine} or {@code global} (default)
     * @param cursor {@code nextCursor} from the previous page
     * @param limit page size, clamped to the configured bounds
     * @param userId acting user
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public TimelinePage<TimelineEntry> getTimeline(
            @RequestParam(name = "scope", required = false) String scope,
            @RequestParam(name = "cursor", required = false) String cursor,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestHeader(name = USER_HEADER, required = false) Long userId) {
        TimelineScope resolvedScope = TimelineScope.fromParameter(scope);
        log.debug("Timeline page requested: scope={}, user={}, limit={}, cursor={}", resolvedScope, userId, limit, cursor);
        return timelineQueryService.page(resolvedScope, userId, cursor, limit);
    }
}
