package net.readtrack.adapters.persistence;

import jakarta.annotation.Nullable;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import net.readtrack.domain.stats.BookSummaryStats;
import net.readtrack.domain.stats.NameCount;
import net.readtrack.domain.stats.NamePages;
import net.readtrack.domain.stats.RatingCount;
import net.readtrack.domain.stats.ReadingStats;
import net.readtrack.domain.stats.TitlePages;
import net.readtrack.domain.timeline.snapshot.ReadingFormat;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

/**
 * Read-only aggregate queries over the library tables ({@code user_books}, {@code books},
 * {@code book_authors}, {@code authors}, {@code genres}, {@code readings}).
 *
 * <p>Callers run every query of one computation inside a single repeatable-read transaction so
 * the resulting statistics describe one consistent snapshot. Calendar buckets use UTC.</p>
 */
@Repository
public class ReadingStatsRepository {

    static final int TOP_AUTHOR_LIMIT = 13;

    private static final String READING_YEAR = "CAST(EXTRACT(YEAR FROM %s AT TIME ZONE 'UTC') AS INTEGER)";

    private static final RowMapper<NameCount> NAME_COUNT_MAPPER =
        (rs, rowNum) -> new NameCount(rs.getString("name"), rs.getLong("count"));

    private static final RowMapper<TitlePages> TITLE_PAGES_MAPPER =
        (rs, rowNum) -> new TitlePages(rs.getString("title"), rs.getInt("page_count"));

    private final JdbcTemplate jdbcTemplate;

    public ReadingStatsRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Set of books a book summary covers, expressed as a {@code scope_books(book_id)} CTE.
     */
    private record BookScope(String cte, Object[] args) {

        static BookScope library(long userId) {
            return new BookScope("""
                WITH scope_books AS (
                    SELECT ub.book_id FROM user_books ub
                    WHERE ub.user_id = ? AND ub.shelf = 'library'
                )
                """, new Object[] {userId});
        }

        static BookScope finishedIn(long userId, int year) {
            return new BookScope("""
                WITH scope_books AS (
                    SELECT DISTINCT r.book_id FROM readings r
                    WHERE r.user_id = ? AND r.status = 'read'
                      AND %s = ?
                )
                """.formatted(READING_YEAR.formatted("r.finished_at")), new Object[] {userId, year});
        }
    }

    /**
     * Shelf composition of the user's library.
     */
    public BookSummaryStats librarySummary(long userId) {
        return bookSummary(userId, BookScope.library(userId), null);
    }

    /**
     * Composition of the books the user finished during one calendar year.
     */
    public BookSummaryStats yearSummary(long userId, int year) {
        return bookSummary(userId, BookScope.finishedIn(userId, year), year);
    }

    /**
     * All-time reading activity plus the current-state counters (in progress, shelf, wishlist).
     *
     * @param now reference instant for the rolling 30-day window and the current calendar year
     */
    public ReadingStats readingSummary(long userId, Instant now) {
        Timestamp windowStart = Timestamp.from(now.minus(30, ChronoUnit.DAYS));
        int currentYear = now.atZone(ZoneOffset.UTC).getYear();

        long booksLast30Days = count("""
            SELECT COUNT(*) FROM readings
            WHERE user_id = ? AND status = 'read' AND finished_at >= ?
            """, userId, windowStart);
        long pagesLast30Days = count("""
            SELECT COALESCE(SUM(bk.page_count), 0) FROM readings r
            JOIN books bk ON r.book_id = bk.id
            WHERE r.user_id = ? AND r.status = 'read' AND r.finished_at >= ?
              AND bk.page_count IS NOT NULL
            """, userId, windowStart);
        long booksInProgress = count(
            "SELECT COUNT(*) FROM readings WHERE user_id = ? AND status = 'reading'", userId);
        long booksOnShelf = count("""
            SELECT COUNT(*) FROM user_books ub
            WHERE ub.user_id = ? AND ub.shelf = 'library'
              AND NOT EXISTS (
                  SELECT 1 FROM readings r
                  WHERE r.book_id = ub.book_id AND r.user_id = ub.user_id
              )
            """, userId);
        long booksOnWishlist = count(
            "SELECT COUNT(*) FROM user_books WHERE user_id = ? AND shelf = 'wishlist'", userId);

        List<NameCount> yearlyBooks = jdbcTemplate.query("""
            SELECT CAST(%s AS TEXT) AS name, COUNT(*) AS count
            FROM readings
            WHERE user_id = ? AND status = 'read' AND finished_at IS NOT NULL
            GROUP BY 1 ORDER BY 1
            """.formatted(READING_YEAR.formatted("finished_at")), NAME_COUNT_MAPPER, userId);
        List<NamePages> yearlyPages = jdbcTemplate.query("""
            SELECT CAST(%s AS TEXT) AS name, COALESCE(SUM(bk.page_count), 0) AS pages
            FROM readings r
            JOIN books bk ON r.book_id = bk.id
            WHERE r.user_id = ? AND r.status = 'read' AND r.finished_at IS NOT NULL
              AND bk.page_count IS NOT NULL
            GROUP BY 1 ORDER BY 1
            """.formatted(READING_YEAR.formatted("r.finished_at")),
            (rs, rowNum) -> new NamePages(rs.getString("name"), rs.getLong("pages")), userId);

        return readingStats(userId, null, currentYear,
            new CurrentState(booksLast30Days, pagesLast30Days, booksInProgress, booksOnShelf, booksOnWishlist),
            yearlyBooks, yearlyPages);
    }

    /**
     * Reading activity restricted to one calendar year. Current-state counters and yearly
     * series are zero or empty in this view.
     */
    public ReadingStats readingSummaryForYear(long userId, int year) {
        return readingStats(userId, year, year, CurrentState.NONE, List.of(), List.of());
    }

    /**
     * Calendar years in which the user finished at least one book, newest first.
     */
    public List<Integer> availableYears(long userId) {
        return jdbcTemplate.queryForList("""
            SELECT DISTINCT %s AS finished_year
            FROM readings
            WHERE user_id = ? AND status = 'read' AND finished_at IS NOT NULL
            ORDER BY finished_year DESC
            """.formatted(READING_YEAR.formatted("finished_at")), Integer.class, userId);
    }

    private record CurrentState(long booksLast30Days,
                                long pagesLast30Days,
                                long booksInProgress,
                                long booksOnShelf,
                                long booksOnWishlist) {
        static final CurrentState NONE = new CurrentState(0, 0, 0, 0, 0);
    }

    private BookSummaryStats bookSummary(long userId, BookScope scope, @Nullable Integer year) {
        String cte = scope.cte();
        Object[] args = scope.args();

        long totalBooks = count(cte + "SELECT COUNT(*) FROM scope_books", args);
        long totalAuthors = count(cte + """
            SELECT COUNT(DISTINCT ba.author_id)
            FROM scope_books sb JOIN book_authors ba ON ba.book_id = sb.book_id
            """, args);
        List<NameCount> genreCounts = jdbcTemplate.query(cte + """
            SELECT g.name AS name, COUNT(*) AS count
            FROM scope_books sb
            JOIN books b ON b.id = sb.book_id
            JOIN genres g ON g.id IN (b.primary_genre_id, b.secondary_genre_id)
            GROUP BY g.id, g.name
            ORDER BY count DESC, g.name
            """, NAME_COUNT_MAPPER, args);
        String topAuthor = firstName(jdbcTemplate.query(cte + """
            SELECT a.name AS name, COUNT(*) AS count
            FROM scope_books sb
            JOIN book_authors ba ON ba.book_id = sb.book_id
            JOIN authors a ON ba.author_id = a.id
            GROUP BY a.id, a.name
            ORDER BY count DESC, a.name
            LIMIT 1
            """, NAME_COUNT_MAPPER, args));
        List<NameCount> pageCountDistribution = jdbcTemplate.query(cte + """
            SELECT CASE
                     WHEN b.page_count < 200 THEN '< 200'
                     WHEN b.page_count <= 350 THEN '200 - 350'
                     WHEN b.page_count <= 500 THEN '350 - 500'
                     ELSE '500+'
                   END AS name,
                   COUNT(*) AS count
            FROM scope_books sb
            JOIN books b ON b.id = sb.book_id
            WHERE b.page_count IS NOT NULL
            GROUP BY 1
            ORDER BY MIN(b.page_count)
            """, NAME_COUNT_MAPPER, args);
        List<NameCount> yearPublishedDistribution = jdbcTemplate.query(cte + """
            SELECT CAST(b.year_published / 10 * 10 AS TEXT) || 's' AS name, COUNT(*) AS count
            FROM scope_books sb
            JOIN books b ON b.id = sb.book_id
            WHERE b.year_published IS NOT NULL
            GROUP BY b.year_published / 10
            ORDER BY count DESC, name
            """, NAME_COUNT_MAPPER, args);
        List<TitlePages> longest = jdbcTemplate.query(cte + """
            SELECT b.title, b.page_count
            FROM scope_books sb JOIN books b ON b.id = sb.book_id
            WHERE b.page_count IS NOT NULL
            ORDER BY b.page_count DESC, b.id
            LIMIT 1
            """, TITLE_PAGES_MAPPER, args);
        List<TitlePages> shortest = jdbcTemplate.query(cte + """
            SELECT b.title, b.page_count
            FROM scope_books sb JOIN books b ON b.id = sb.book_id
            WHERE b.page_count IS NOT NULL
            ORDER BY b.page_count ASC, b.id
            LIMIT 1
            """, TITLE_PAGES_MAPPER, args);

        List<Object> readingArgs = new ArrayList<>(List.of(userId));
        String readingYear = yearFilter("r.finished_at", year, readingArgs);
        List<NameCount> topAuthors = jdbcTemplate.query("""
            SELECT a.name AS name, COUNT(*) AS count
            FROM readings r
            JOIN book_authors ba ON r.book_id = ba.book_id AND ba.role = 'author'
            JOIN authors a ON ba.author_id = a.id
            WHERE r.user_id = ? AND r.status = 'read'%s
            GROUP BY a.id, a.name
            ORDER BY count DESC, a.name
            LIMIT %d
            """.formatted(readingYear, TOP_AUTHOR_LIMIT), NAME_COUNT_MAPPER, readingArgs.toArray());
        String mostRatedAuthor = firstName(jdbcTemplate.query("""
            SELECT a.name AS name, COUNT(*) AS count
            FROM readings r
            JOIN book_authors ba ON r.book_id = ba.book_id AND ba.role = 'author'
            JOIN authors a ON ba.author_id = a.id
            WHERE r.user_id = ? AND r.status = 'read' AND r.rating IS NOT NULL%s
            GROUP BY a.id, a.name
            ORDER BY SUM(r.rating) DESC, a.name
            LIMIT 1
            """.formatted(readingYear), NAME_COUNT_MAPPER, readingArgs.toArray()));
        String mostRatedGenre = firstName(jdbcTemplate.query("""
            SELECT g.name AS name, COUNT(*) AS count
            FROM readings r
            JOIN books b ON r.book_id = b.id
            JOIN genres g ON g.id IN (b.primary_genre_id, b.secondary_genre_id)
            WHERE r.user_id = ? AND r.status = 'read' AND r.rating IS NOT NULL%s
            GROUP BY g.id, g.name
            ORDER BY SUM(r.rating) DESC, g.name
            LIMIT 1
            """.formatted(readingYear), NAME_COUNT_MAPPER, readingArgs.toArray()));

        return new BookSummaryStats(
            totalBooks,
            totalAuthors,
            genreCounts.size(),
            firstName(genreCounts),
            topAuthor,
            mostRatedAuthor,
            mostRatedGenre,
            genreCounts,
            NameCount.maxCount(genreCounts),
            pageCountDistribution,
            yearPublishedDistribution,
            NameCount.maxCount(yearPublishedDistribution),
            topAuthors,
            NameCount.maxCount(topAuthors),
            longest.isEmpty() ? null : longest.get(0),
            shortest.isEmpty() ? null : shortest.get(0)
        );
    }

    private ReadingStats readingStats(long userId,
                                      @Nullable Integer year,
                                      int calendarYear,
                                      CurrentState currentState,
                                      List<NameCount> yearlyBooks,
                                      List<NamePages> yearlyPages) {
        List<Object> finishedArgs = new ArrayList<>(List.of(userId));
        String finishedYear = yearFilter("finished_at", year, finishedArgs);
        List<Object> joinedArgs = new ArrayList<>(List.of(userId));
        String joinedYear = yearFilter("r.finished_at", year, joinedArgs);
        List<Object> startedArgs = new ArrayList<>(List.of(userId));
        String startedYear = yearFilter("started_at", year, startedArgs);

        long booksFinished = count(
            "SELECT COUNT(*) FROM readings WHERE user_id = ? AND status = 'read'" + finishedYear,
            finishedArgs.toArray());
        long pagesFinished = count("""
            SELECT COALESCE(SUM(bk.page_count), 0) FROM readings r
            JOIN books bk ON r.book_id = bk.id
            WHERE r.user_id = ? AND r.status = 'read' AND bk.page_count IS NOT NULL
            """ + joinedYear, joinedArgs.toArray());
        Double averageRating = jdbcTemplate.queryForObject("""
            SELECT CAST(AVG(rating) AS DOUBLE PRECISION) FROM readings
            WHERE user_id = ? AND status = 'read' AND rating IS NOT NULL
            """ + finishedYear, Double.class, finishedArgs.toArray());
        Double averageDaysToFinish = jdbcTemplate.queryForObject("""
            SELECT CAST(AVG(EXTRACT(EPOCH FROM (finished_at - started_at)) / 86400.0) AS DOUBLE PRECISION)
            FROM readings
            WHERE user_id = ? AND status = 'read' AND started_at IS NOT NULL AND finished_at IS NOT NULL
            """ + finishedYear, Double.class, finishedArgs.toArray());
        List<RatingCount> ratingDistribution = jdbcTemplate.query("""
            SELECT CAST(rating AS DOUBLE PRECISION) AS rating, COUNT(*) AS count
            FROM readings
            WHERE user_id = ? AND status = 'read' AND rating IS NOT NULL%s
            GROUP BY rating ORDER BY rating
            """.formatted(finishedYear),
            (rs, rowNum) -> new RatingCount(rs.getDouble("rating"), rs.getLong("count")),
            finishedArgs.toArray());
        long maxRatingCount = 0;
        for (RatingCount bucket : ratingDistribution) {
            maxRatingCount = Math.max(maxRatingCount, bucket.count());
        }

        List<NameCount> monthlyBooks = new ArrayList<>(12);
        List<NamePages> monthlyPages = new ArrayList<>(12);
        jdbcTemplate.query("""
            SELECT m.month AS month, COUNT(r.id) AS books, COALESCE(SUM(bk.page_count), 0) AS pages
            FROM generate_series(1, 12) AS m(month)
            LEFT JOIN readings r
              ON CAST(EXTRACT(MONTH FROM r.finished_at AT TIME ZONE 'UTC') AS INTEGER) = m.month
             AND %s = ?
             AND r.status = 'read' AND r.user_id = ?
            LEFT JOIN books bk ON r.book_id = bk.id AND bk.page_count IS NOT NULL
            GROUP BY m.month
            ORDER BY m.month
            """.formatted(READING_YEAR.formatted("r.finished_at")),
            rs -> {
                String name = Month.of(rs.getInt("month")).getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
                monthlyBooks.add(new NameCount(name, rs.getLong("books")));
                monthlyPages.add(new NamePages(name, rs.getLong("pages")));
            },
            calendarYear, userId);

        List<NameCount> paceDistribution = jdbcTemplate.query("""
            SELECT pace AS name, COUNT(*) AS count
            FROM (
                SELECT CASE
                         WHEN bk.page_count / GREATEST(1.0, EXTRACT(EPOCH FROM (r.finished_at - r.started_at)) / 86400.0) < 15 THEN 'Slow'
                         WHEN bk.page_count / GREATEST(1.0, EXTRACT(EPOCH FROM (r.finished_at - r.started_at)) / 86400.0) <= 40 THEN 'Medium'
                         ELSE 'Fast'
                       END AS pace
                FROM readings r
                JOIN books bk ON r.book_id = bk.id
                WHERE r.user_id = ? AND r.status = 'read'
                  AND r.started_at IS NOT NULL AND r.finished_at IS NOT NULL
                  AND bk.page_count IS NOT NULL
                  AND r.finished_at >= r.started_at%s
            ) paced
            GROUP BY pace
            ORDER BY CASE pace WHEN 'Slow' THEN 1 WHEN 'Medium' THEN 2 ELSE 3 END
            """.formatted(joinedYear), NAME_COUNT_MAPPER, joinedArgs.toArray());
        List<NameCount> formatCounts = jdbcTemplate.query("""
            SELECT format AS name, COUNT(*) AS count
            FROM readings
            WHERE user_id = ? AND status = 'read' AND format IS NOT NULL%s
            GROUP BY format
            ORDER BY count DESC, format
            """.formatted(finishedYear), NAME_COUNT_MAPPER, finishedArgs.toArray())
            .stream()
            .map(bucket -> new NameCount(
                ReadingFormat.fromDbValue(bucket.name()).map(ReadingFormat::displayLabel).orElse(bucket.name()),
                bucket.count()))
            .toList();
        long booksAbandoned = count(
            "SELECT COUNT(*) FROM readings WHERE user_id = ? AND status = 'abandoned'" + startedYear,
            startedArgs.toArray());

        return new ReadingStats(
            currentState.booksLast30Days(),
            booksFinished,
            currentState.pagesLast30Days(),
            pagesFinished,
            currentState.booksInProgress(),
            currentState.booksOnShelf(),
            currentState.booksOnWishlist(),
            booksAbandoned,
            averageRating,
            averageDaysToFinish,
            ratingDistribution,
            maxRatingCount,
            monthlyBooks,
            monthlyPages,
            NameCount.maxCount(monthlyBooks),
            NamePages.maxPages(monthlyPages),
            yearlyBooks,
            yearlyPages,
            NameCount.maxCount(yearlyBooks),
            NamePages.maxPages(yearlyPages),
            paceDistribution,
            formatCounts
        );
    }

    private static String yearFilter(String column, @Nullable Integer year, List<Object> args) {
        if (year == null) {
            return "";
        }
        args.add(year);
        return " AND " + READING_YEAR.formatted(column) + " = ?";
    }

    private long count(String sql, Object... args) {
        Long value = jdbcTemplate.queryForObject(sql, Long.class, args);
        return value == null ? 0L : value;
    }

    @Nullable
    private static String firstName(List<NameCount> rows) {
        return rows.isEmpty() ? null : rows.get(0).name();
    }
}
