package net.readtrack.domain.stats;

import java.time.Duration;
import java.time.Instant;

/**
 * Stats payload returned to callers together with its freshness marker.
 */
public record StatsSnapshot(long userId, CachedStats data, Instant computedAt) {

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return computedAt.plus(maxAge).isBefore(now);
    }
}
