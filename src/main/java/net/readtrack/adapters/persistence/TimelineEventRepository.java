package net.readtrack.adapters.persistence;

import jakarta.annotation.Nullable;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.NewTimelineEvent;
import net.readtrack.domain.timeline.TimelineCursor;
import net.readtrack.domain.timeline.TimelineEvent;
import net.readtrack.domain.timeline.TimelinePage;
import net.readtrack.domain.timeline.TimelinePayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Postgres adapter for the append-mostly {@code timeline_events} table.
 *
 * <p>Identity columns ({@code entity_type}, {@code entity_id}, {@code action},
 * {@code occurred_at}) are written once by {@link #append(NewTimelineEvent)}. Only the payload
 * columns are ever updated, and only through {@link #rewritePayload(EntityKey, TimelinePayload)}.
 * Feeds are read newest first with keyset pagination on {@code (occurred_at, id)}.</p>
 */
@Repository
public class TimelineEventRepository {

    private static final Logger log = LoggerFactory.getLogger(TimelineEventRepository.class);

    private static final String EVENT_COLUMNS = """
        id, entity_type, entity_id, action, occurred_at, user_id,
        title, details_json, genres_json, reading_data_json
        """;

    private final JdbcTemplate jdbcTemplate;
    private final TimelinePayloadCodec payloadCodec;
    private final RowMapper<TimelineEvent> eventRowMapper = this::mapEvent;

    public TimelineEventRepository(JdbcTemplate jdbcTemplate, TimelinePayloadCodec payloadCodec) {
        this.jdbcTemplate = jdbcTemplate;
        this.payloadCodec = payloadCodec;
    }

    /**
     * Appends one event.
     *
     * @param event event to store
     * @return generated event id
     */
    public long append(NewTimelineEvent event) {
        TimelinePayloadCodec.EncodedPayload encoded = payloadCodec.encode(event.payload());
        String sql = """
            INSERT INTO timeline_events
              (entity_type, entity_id, action, occurred_at, user_id,
               title, details_json, genres_json, reading_data_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            RETURNING id
            """;
        Long id = jdbcTemplate.queryForObject(
            sql,
            Long.class,
            event.key().entityType().dbValue(),
            event.key().entityId(),
            event.action(),
            Timestamp.from(event.occurredAt()),
            event.userId(),
            encoded.title(),
            encoded.detailsJson(),
            encoded.genresJson(),
            encoded.readingDataJson()
        );
        if (id == null) {
            throw new IllegalStateException("Timeline insert returned no id for " + event.key());
        }
        log.debug("Appended timeline event {} for {} ({})", id, event.key(), event.action());
        return id;
    }

    /**
     * Lists events attributed to one user, newest first.
     *
     * @param userId acting user
     * @param cursor position of the last row of the previous page, or {@code null} for the first page
     * @param limit page size, at least 1
     */
    public TimelinePage<TimelineEvent> listByUser(long userId, @Nullable TimelineCursor cursor, int limit) {
        requirePositiveLimit(limit);
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS)
            .append(" FROM timeline_events WHERE user_id = ?");
        args.add(userId);
        appendCursorClause(sql, args, cursor, true);
        return fetchPage(sql, args, limit);
    }

    /**
     * Lists all events, newest first.
     *
     * @param cursor position of the last row of the previous page, or {@code null} for the first page
     * @param limit page size, at least 1
     */
    public TimelinePage<TimelineEvent> listGlobal(@Nullable TimelineCursor cursor, int limit) {
        requirePositiveLimit(limit);
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS).append(" FROM timeline_events");
        appendCursorClause(sql, args, cursor, false);
        return fetchPage(sql, args, limit);
    }

    /**
     * Full history of one entity in ascending {@code (occurred_at, id)} order.
     */
    public List<TimelineEvent> listByEntity(EntityKey key) {
        String sql = "SELECT " + EVENT_COLUMNS + """
             FROM timeline_events
            WHERE entity_type = ? AND entity_id = ?
            ORDER BY occurred_at ASC, id ASC
            """;
        return jdbcTemplate.query(sql, eventRowMapper, key.entityType().dbValue(), key.entityId());
    }

    /**
     * Most recent event of one entity, used as the last known display state of deleted entities.
     */
    public Optional<TimelineEvent> findLatestByEntity(EntityKey key) {
        String sql = "SELECT " + EVENT_COLUMNS + """
             FROM timeline_events
            WHERE entity_type = ? AND entity_id = ?
            ORDER BY occurred_at DESC, id DESC
            LIMIT 1
            """;
        List<TimelineEvent> rows = jdbcTemplate.query(sql, eventRowMapper, key.entityType().dbValue(), key.entityId());
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Enumerates distinct entity keys that have events, in {@link EntityKey} order.
     *
     * @param after exclusive lower bound, or {@code null} to start from the first key
     * @param batchSize maximum number of keys returned
     */
    public List<EntityKey> findEntityKeysAfter(@Nullable EntityKey after, int batchSize) {
        requirePositiveLimit(batchSize);
        RowMapper<EntityKey> keyMapper = (rs, rowNum) -> EntityKey.of(
            EntityType.requireDbValue(rs.getString("entity_type")),
            rs.getLong("entity_id")
        );
        if (after == null) {
            String sql = """
                SELECT entity_type, entity_id
                FROM timeline_events
                GROUP BY entity_type, entity_id
                ORDER BY entity_type COLLATE "C", entity_id
                LIMIT ?
                """;
            return jdbcTemplate.query(sql, keyMapper, batchSize);
        }
        String sql = """
            SELECT entity_type, entity_id
            FROM timeline_events
            WHERE entity_type COLLATE "C" > ?
               OR (entity_type = ? AND entity_id > ?)
            GROUP BY entity_type, entity_id
            ORDER BY entity_type COLLATE "C", entity_id
            LIMIT ?
            """;
        String type = after.entityType().dbValue();
        return jdbcTemplate.query(sql, keyMapper, type, type, after.entityId(), batchSize);
    }

    /**
     * Overwrites the payload columns of every event of one entity. Rows whose payload already
     * matches are left alone, so the returned count is the number of rows that actually changed.
     *
     * @return number of rows changed
     */
    public int rewritePayload(EntityKey key, TimelinePayload payload) {
        TimelinePayloadCodec.EncodedPayload encoded = payloadCodec.encode(payload);
        String sql = """
            UPDATE timeline_events
               SET title = ?, details_json = ?, genres_json = ?, reading_data_json = ?
             WHERE entity_type = ? AND entity_id = ?
               AND (title IS DISTINCT FROM ?
                    OR details_json IS DISTINCT FROM ?
                    OR genres_json IS DISTINCT FROM ?
                    OR reading_data_json IS DISTINCT FROM ?)
            """;
        return jdbcTemplate.update(sql, ps -> {
            ps.setString(1, encoded.title());
            ps.setString(2, encoded.detailsJson());
            ps.setString(3, encoded.genresJson());
            ps.setString(4, encoded.readingDataJson());
            ps.setString(5, key.entityType().dbValue());
            ps.setLong(6, key.entityId());
            ps.setString(7, encoded.title());
            ps.setString(8, encoded.detailsJson());
            ps.setString(9, encoded.genresJson());
            ps.setString(10, encoded.readingDataJson());
        });
    }

    /**
     * Deletes every event of one entity. Only the rebuild job's prune policy calls this.
     *
     * @return number of rows deleted
     */
    public int deleteByEntity(EntityKey key) {
        return jdbcTemplate.update(
            "DELETE FROM timeline_events WHERE entity_type = ? AND entity_id = ?",
            key.entityType().dbValue(),
            key.entityId()
        );
    }

    /**
     * Detaches a user from their events without deleting the events.
     *
     * @return number of rows detached
     */
    public int clearUserAttribution(long userId) {
        return jdbcTemplate.update("UPDATE timeline_events SET user_id = NULL WHERE user_id = ?", userId);
    }

    private static void appendCursorClause(StringBuilder sql,
                                           List<Object> args,
                                           @Nullable TimelineCursor cursor,
                                           boolean hasWhere) {
        if (cursor != null) {
            sql.append(hasWhere ? " AND" : " WHERE").append(" (occurred_at, id) < (?, ?)");
            args.add(Timestamp.from(cursor.occurredAt()));
            args.add(cursor.id());
        }
        sql.append(" ORDER BY occurred_at DESC, id DESC LIMIT ?");
    }

    private TimelinePage<TimelineEvent> fetchPage(StringBuilder sql, List<Object> args, int limit) {
        args.add(limit + 1);
        List<TimelineEvent> rows = jdbcTemplate.query(sql.toString(), eventRowMapper, args.toArray());
        if (rows.size() <= limit) {
            return new TimelinePage<>(rows, null);
        }
        List<TimelineEvent> items = rows.subList(0, limit);
        return new TimelinePage<>(items, items.get(limit - 1).cursor().encode());
    }

    private TimelineEvent mapEvent(ResultSet rs, int rowNum) throws SQLException {
        EntityKey key = EntityKey.of(EntityType.requireDbValue(rs.getString("entity_type")), rs.getLong("entity_id"));
        TimelinePayload payload = payloadCodec.decode(
            rs.getString("title"),
            rs.getString("details_json"),
            rs.getString("genres_json"),
            rs.getString("reading_data_json")
        );
        return new TimelineEvent(
            rs.getLong("id"),
            key,
            rs.getString("action"),
            rs.getTimestamp("occurred_at").toInstant(),
            rs.getObject("user_id", Long.class),
            payload
        );
    }

    private static void requirePositiveLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1 but was " + limit);
        }
    }
}
