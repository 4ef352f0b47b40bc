package net.readtrack.adapters.persistence;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntitySnapshotReader;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.snapshot.AuthorSnapshot;
import net.readtrack.domain.timeline.snapshot.BookSnapshot;
import net.readtrack.domain.timeline.snapshot.GenreSnapshot;
import net.readtrack.domain.timeline.snapshot.ReadingFormat;
import net.readtrack.domain.timeline.snapshot.ReadingSnapshot;
import net.readtrack.domain.timeline.snapshot.ReadingStatus;
import net.readtrack.domain.timeline.snapshot.TimelineSnapshot;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Loads entity snapshots from the library tables for the timeline recorder and rebuild job.
 *
 * <p>Credited authors are ordered by name so that re-reading an unchanged book always
 * renders the same payload.</p>
 */
@Repository
public class JdbcEntitySnapshotReader implements EntitySnapshotReader {

    private final JdbcTemplate jdbcTemplate;

    public JdbcEntitySnapshotReader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<TimelineSnapshot> read(EntityKey key) {
        return switch (key.entityType()) {
            case AUTHOR -> readNamed("SELECT id, name FROM authors WHERE id = ?", key.entityId())
                .map(name -> new AuthorSnapshot(key.entityId(), name));
            case GENRE -> readNamed("SELECT id, name FROM genres WHERE id = ?", key.entityId())
                .map(name -> new GenreSnapshot(key.entityId(), name));
            case BOOK -> readBook(key.entityId());
            case READING -> readReading(key.entityId());
        };
    }

    @Override
    public List<EntityKey> dependentsOf(EntityKey key) {
        TreeSet<EntityKey> dependents = new TreeSet<>();
        switch (key.entityType()) {
            case BOOK -> addReadingsOfBooks(dependents, List.of(key.entityId()));
            case AUTHOR -> {
                List<Long> bookIds = jdbcTemplate.queryForList(
                    "SELECT DISTINCT book_id FROM book_authors WHERE author_id = ? ORDER BY book_id",
                    Long.class,
                    key.entityId()
                );
                bookIds.forEach(bookId -> dependents.add(EntityKey.of(EntityType.BOOK, bookId)));
                addReadingsOfBooks(dependents, bookIds);
            }
            case GENRE -> jdbcTemplate.queryForList(
                    "SELECT id FROM books WHERE primary_genre_id = ? OR secondary_genre_id = ? ORDER BY id",
                    Long.class,
                    key.entityId(),
                    key.entityId()
                )
                .forEach(bookId -> dependents.add(EntityKey.of(EntityType.BOOK, bookId)));
            case READING -> {
                // readings are leaves
            }
        }
        return List.copyOf(dependents);
    }

    private Optional<String> readNamed(String sql, long id) {
        List<String> names = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("name"), id);
        return names.isEmpty() ? Optional.empty() : Optional.ofNullable(names.get(0));
    }

    private Optional<TimelineSnapshot> readBook(long bookId) {
        List<TimelineSnapshot> rows = jdbcTemplate.query("""
            SELECT b.id, b.title, b.page_count, pg.name AS primary_genre, sg.name AS secondary_genre
            FROM books b
            LEFT JOIN genres pg ON pg.id = b.primary_genre_id
            LEFT JOIN genres sg ON sg.id = b.secondary_genre_id
            WHERE b.id = ?
            """,
            (rs, rowNum) -> new BookSnapshot(
                rs.getLong("id"),
                rs.getString("title"),
                authorNames(bookId),
                rs.getString("primary_genre"),
                rs.getString("secondary_genre"),
                rs.getObject("page_count", Integer.class)
            ),
            bookId
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private Optional<TimelineSnapshot> readReading(long readingId) {
        List<TimelineSnapshot> rows = jdbcTemplate.query("""
            SELECT r.id, r.user_id, r.book_id, r.status, r.format, r.rating, b.title AS book_title
            FROM readings r
            JOIN books b ON b.id = r.book_id
            WHERE r.id = ?
            """,
            (rs, rowNum) -> {
                long bookId = rs.getLong("book_id");
                BigDecimal rating = rs.getBigDecimal("rating");
                return new ReadingSnapshot(
                    rs.getLong("id"),
                    rs.getObject("user_id", Long.class),
                    bookId,
                    rs.getString("book_title"),
                    authorNames(bookId),
                    ReadingStatus.fromDbValue(rs.getString("status")).orElse(null),
                    ReadingFormat.fromDbValue(rs.getString("format")).orElse(null),
                    rating == null ? null : rating.doubleValue()
                );
            },
            readingId
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private List<String> authorNames(long bookId) {
        return jdbcTemplate.queryForList("""
            SELECT a.name
            FROM book_authors ba
            JOIN authors a ON a.id = ba.author_id
            WHERE ba.book_id = ? AND ba.role = 'author'
            ORDER BY a.name, a.id
            """, String.class, bookId);
    }

    private void addReadingsOfBooks(TreeSet<EntityKey> dependents, List<Long> bookIds) {
        for (Long bookId : bookIds) {
            jdbcTemplate.queryForList("SELECT id FROM readings WHERE book_id = ? ORDER BY id", Long.class, bookId)
                .forEach(readingId -> dependents.add(EntityKey.of(EntityType.READING, readingId)));
        }
    }
}
