package net.readtrack.controller;

import java.time.Instant;
import java.util.List;
import net.readtrack.application.stats.StatsQueryService;
import net.readtrack.domain.stats.CachedStats;
import net.readtrack.domain.stats.StatsSnapshot;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Per-user reading statistics. The user comes from {@code userId} or, when absent, from the
 * {@code X-User-Id} header.
 */
@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final StatsQueryService statsQueryService;

    public StatsController(StatsQueryService statsQueryService) {
        this.statsQueryService = statsQueryService;
    }

    public record StatsResponse(CachedStats data, Instant computedAt) {
        static StatsResponse from(StatsSnapshot snapshot) {
            return new StatsResponse(snapshot.data(), snapshot.computedAt());
        }
    }

    public record YearsResponse(long userId, List<Integer> years) {
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public StatsResponse getStats(@RequestParam(name = "userId", required = false) Long userId,
                                  @RequestHeader(name = TimelineController.USER_HEADER, required = false) Long headerUserId) {
        return StatsResponse.from(statsQueryService.getStats(resolveUser(userId, headerUserId)));
    }

    @GetMapping(value = "/years", produces = MediaType.APPLICATION_JSON_VALUE)
    public YearsResponse getAvailableYears(@RequestParam(name = "userId", required = false) Long userId,
                                           @RequestHeader(name = TimelineController.USER_HEADER, required = false) Long headerUserId) {
        long resolved = resolveUser(userId, headerUserId);
        return new YearsResponse(resolved, statsQueryService.availableYears(resolved));
    }

    @GetMapping(value = "/year/{year}", produces = MediaType.APPLICATION_JSON_VALUE)
    public StatsResponse getStatsForYear(@PathVariable("year") int year,
                                         @RequestParam(name = "userId", required = false) Long userId,
                                         @RequestHeader(name = TimelineController.USER_HEADER, required = false) Long headerUserId) {
        return StatsResponse.from(statsQueryService.getStatsForYear(resolveUser(userId, headerUserId), year));
    }

    private static long resolveUser(Long userId, Long headerUserId) {
        Long resolved = userId != null ? userId : headerUserId;
        if (resolved == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        return resolved;
    }
}
