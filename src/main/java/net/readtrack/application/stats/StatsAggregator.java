package net.readtrack.application.stats;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import net.readtrack.adapters.persistence.ReadingStatsRepository;
import net.readtrack.adapters.persistence.StatsCacheRepository;
import net.readtrack.domain.stats.CachedStats;
import net.readtrack.domain.stats.StatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Computes per-user statistics from the library tables and stores them in the stats cache.
 *
 * <p>All queries of one computation run in a single read-only repeatable-read transaction, so
 * the document never mixes data from before and after a concurrent write. The freshness stamp
 * is taken before that transaction opens; the cache keeps the document only if no invalidation
 * arrived at or after the stamp.</p>
 */
@Service
public class StatsAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    private final ReadingStatsRepository readingStatsRepository;
    private final StatsCacheRepository statsCacheRepository;
    private final TransactionTemplate snapshotTemplate;
    private final Clock clock;
    private final Timer computeTimer;
    private final Counter refreshCounter;
    private final Counter orphanedUserCounter;
    private final Counter supersededCounter;

    public StatsAggregator(ReadingStatsRepository readingStatsRepository,
                           StatsCacheRepository statsCacheRepository,
                           PlatformTransactionManager transactionManager,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.readingStatsRepository = readingStatsRepository;
        this.statsCacheRepository = statsCacheRepository;
        this.snapshotTemplate = new TransactionTemplate(transactionManager);
        this.snapshotTemplate.setReadOnly(true);
        this.snapshotTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        this.clock = clock;
        this.computeTimer = meterRegistry.timer("stats.compute.duration");
        this.refreshCounter = meterRegistry.counter("stats.cache.refresh");
        this.orphanedUserCounter = meterRegistry.counter("stats.cache.refresh.unknown-user");
        this.supersededCounter = meterRegistry.counter("stats.cache.refresh.superseded");
    }

    /**
     * Recomputes and stores the user's statistics.
     *
     * @return the computed snapshot; it is not cached when the user has no {@code users} row or
     *         when a write invalidated the user's stats while the computation ran
     */
    public StatsSnapshot refresh(long userId) {
        Instant computedAt = clock.instant().truncatedTo(ChronoUnit.MICROS);
        CachedStats data = computeTimer.record(() -> snapshotTemplate.execute(status -> new CachedStats(
            readingStatsRepository.librarySummary(userId),
            readingStatsRepository.readingSummary(userId, computedAt),
            computedAt
        )));
        refreshCounter.increment();
        try {
            if (statsCacheRepository.upsert(userId, data, computedAt)) {
                log.debug("Refreshed stats cache for user {}", userId);
            } else {
                supersededCounter.increment();
                log.debug("Stats for user {} computed at {} were invalidated meanwhile; not cached", userId, computedAt);
            }
        } catch (DataIntegrityViolationException ex) {
            orphanedUserCounter.increment();
            log.warn("Stats for user {} not cached; user row is missing: {}", userId, ex.getMessage());
        }
        return new StatsSnapshot(userId, data, computedAt);
    }

    /**
     * Computes statistics restricted to one calendar year. Never cached.
     */
    public StatsSnapshot computeForYear(long userId, int year) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        CachedStats data = computeTimer.record(() -> snapshotTemplate.execute(status -> new CachedStats(
            readingStatsRepository.yearSummary(userId, year),
            readingStatsRepository.readingSummaryForYear(userId, year),
            now
        )));
        return new StatsSnapshot(userId, data, now);
    }

    public List<Integer> availableYears(long userId) {
        return readingStatsRepository.availableYears(userId);
    }
}
