package net.readtrack.domain.stats;

import java.time.Instant;

/**
 * Complete statistics snapshot for one user, stored as JSON in {@code stats_cache.data}.
 *
 * @param bookSummary library composition
 * @param reading reading activity
 * @param computedAt when the underlying queries ran
 */
public record CachedStats(BookSummaryStats bookSummary, ReadingStats reading, Instant computedAt) {
}
