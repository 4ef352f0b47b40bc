package net.readtrack.application.stats;

import java.time.Clock;
import java.time.Duration;
import java.time.Year;
import java.time.temporal.ChronoUnit;
import java.util.List;
import net.readtrack.adapters.persistence.StatsCacheRepository;
import net.readtrack.domain.stats.StatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;
import org.springframework.stereotype.Service;

/**
 * Read side of the stats cache: serves the cached row when it is fresh and recomputes it
 * otherwise. Writers only invalidate; recomputation always happens on read.
 */
@Service
public class StatsQueryService {

    private static final Logger log = LoggerFactory.getLogger(StatsQueryService.class);

    private final StatsCacheRepository statsCacheRepository;
    private final StatsAggregator statsAggregator;
    private final StatsSettings settings;
    private final Clock clock;

    public StatsQueryService(StatsCacheRepository statsCacheRepository,
                             StatsAggregator statsAggregator,
                             StatsSettings settings,
                             Clock clock) {
        this.statsCacheRepository = statsCacheRepository;
        this.statsAggregator = statsAggregator;
        this.settings = settings;
        this.clock = clock;
    }

    @Component
    public static class ConfigLoader {
        @Bean
        public StatsSettings statsSettings(@Value("${app.stats.max-age:PT24H}") Duration maxAge) {
            return new StatsSettings(maxAge);
        }
    }

    /**
     * @param maxAge age after which a cached row is recomputed on read
     */
    public record StatsSettings(Duration maxAge) {
        public StatsSettings {
            if (maxAge == null || maxAge.isNegative()) {
                maxAge = Duration.ofHours(24);
            }
        }
    }

    /**
     * Returns the user's statistics, computing them when no fresh cached row exists.
     * A user with no library data gets a zeroed document, never an error.
     */
    public StatsSnapshot getStats(long userId) {
        return statsCacheRepository.find(userId)
            .filter(cached -> !cached.isOlderThan(settings.maxAge(), clock.instant()))
            .orElseGet(() -> {
                log.debug("Stats cache miss for user {}; recomputing", userId);
                return statsAggregator.refresh(userId);
            });
    }

    /**
     * Statistics for the books finished in one calendar year.
     *
     * @throws IllegalArgumentException when {@code year} is outside the supported range
     */
    public StatsSnapshot getStatsForYear(long userId, int year) {
        if (year < 1 || year > Year.MAX_VALUE) {
            throw new IllegalArgumentException("year must be a positive calendar year but was " + year);
        }
        return statsAggregator.computeForYear(userId, year);
    }

    public List<Integer> availableYears(long userId) {
        return statsAggregator.availableYears(userId);
    }

    /**
     * Marks the user's cached row stale so the next read recomputes it. A refresh already in
     * progress will not overwrite the mark.
     *
     * @return {@code false} when the user does not exist
     */
    public boolean invalidateUser(long userId) {
        boolean marked = statsCacheRepository.invalidate(userId, clock.instant().truncatedTo(ChronoUnit.MICROS));
        if (marked) {
            log.debug("Invalidated stats cache for user {}", userId);
        }
        return marked;
    }

    /**
     * Marks every cached row stale; used when shared catalog names change.
     */
    public int invalidateAll() {
        int marked = statsCacheRepository.invalidateAll(clock.instant().truncatedTo(ChronoUnit.MICROS));
        log.debug("Invalidated {} stats cache rows", marked);
        return marked;
    }
}
