package net.readtrack.adapters.persistence;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.readtrack.domain.stats.CachedStats;
import net.readtrack.domain.stats.StatsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres adapter for the one-row-per-user {@code stats_cache} table.
 *
 * <p>Invalidation stamps {@code invalidated_at} instead of deleting the row. A refresh stores its
 * document only when the row was not invalidated at or after the refresh's {@code computed_at},
 * so a computation that started before a write can never hide that write. Refreshes racing each
 * other are unlocked and the last one wins. A row whose document is missing, invalidated or
 * unreadable is reported as absent so callers recompute it.</p>
 */
@Repository
public class StatsCacheRepository {

    private static final Logger log = LoggerFactory.getLogger(StatsCacheRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public StatsCacheRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<StatsSnapshot> find(long userId) {
        List<StatsSnapshot> rows = jdbcTemplate.query("""
            SELECT data, computed_at FROM stats_cache
            WHERE user_id = ?
              AND data IS NOT NULL
              AND (invalidated_at IS NULL OR invalidated_at < computed_at)
            """,
            (rs, rowNum) -> {
                CachedStats data = deserialize(userId, rs.getString("data"));
                return data == null ? null : new StatsSnapshot(userId, data, rs.getTimestamp("computed_at").toInstant());
            },
            userId
        );
        if (rows.isEmpty() || rows.get(0) == null) {
            return Optional.empty();
        }
        return Optional.of(rows.get(0));
    }

    /**
     * Stores a freshly computed document unless the row was invalidated after the computation began.
     *
     * @param computedAt instant taken before the computation's snapshot was opened
     * @return {@code true} when the document was stored
     */
    public boolean upsert(long userId, CachedStats data, Instant computedAt) {
        String sql = """
            INSERT INTO stats_cache (user_id, data, computed_at)
            VALUES (?, ?, ?)
            ON CONFLICT (user_id) DO UPDATE
               SET data = EXCLUDED.data,
                   computed_at = EXCLUDED.computed_at
             WHERE stats_cache.invalidated_at IS NULL
                OR stats_cache.invalidated_at < EXCLUDED.computed_at
            """;
        return jdbcTemplate.update(sql, userId, serialize(data), Timestamp.from(computedAt)) > 0;
    }

    /**
     * Marks the user's row stale as of {@code invalidatedAt}, creating an empty row when none
     * exists yet so an in-flight refresh cannot store a document computed before the write.
     *
     * @return {@code false} when the user does not exist
     */
    public boolean invalidate(long userId, Instant invalidatedAt) {
        String sql = """
            INSERT INTO stats_cache (user_id, invalidated_at)
            SELECT u.id, CAST(? AS TIMESTAMPTZ) FROM users u WHERE u.id = ?
            ON CONFLICT (user_id) DO UPDATE
               SET invalidated_at = GREATEST(stats_cache.invalidated_at, EXCLUDED.invalidated_at)
            """;
        return jdbcTemplate.update(sql, Timestamp.from(invalidatedAt), userId) > 0;
    }

    /**
     * Marks every user's row stale as of {@code invalidatedAt}.
     *
     * @return number of rows marked
     */
    public int invalidateAll(Instant invalidatedAt) {
        String sql = """
            INSERT INTO stats_cache (user_id, invalidated_at)
            SELECT u.id, CAST(? AS TIMESTAMPTZ) FROM users u
            ON CONFLICT (user_id) DO UPDATE
               SET invalidated_at = GREATEST(stats_cache.invalidated_at, EXCLUDED.invalidated_at)
            """;
        return jdbcTemplate.update(sql, Timestamp.from(invalidatedAt));
    }

    private String serialize(CachedStats data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Failed to serialize cached stats", ex);
        }
    }

    private CachedStats deserialize(long userId, String json) {
        try {
            return objectMapper.readValue(json, CachedStats.class);
        } catch (JacksonException ex) {
            log.warn("Discarding unreadable cached stats for user {}: {}", userId, ex.getMessage());
            return null;
        }
    }
}
