package net.readtrack.domain.stats;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Library-shelf composition for one user: sizes, genre and author rankings, length and era.
 */
public record BookSummaryStats(
    long totalBooks,
    long totalAuthors,
    long uniqueGenres,
    @Nullable String topGenre,
    @Nullable String topAuthor,
    @Nullable String mostRatedAuthor,
    @Nullable String mostRatedGenre,
    List<NameCount> genreCounts,
    long maxGenreCount,
    List<NameCount> pageCountDistribution,
    List<NameCount> yearPublishedDistribution,
    long maxYearPublishedCount,
    List<NameCount> topAuthors,
    long maxTopAuthorCount,
    @Nullable TitlePages longestBook,
    @Nullable TitlePages shortestBook
) {
    public BookSummaryStats {
        genreCounts = genreCounts == null ? List.of() : List.copyOf(genreCounts);
        pageCountDistribution = pageCountDistribution == null ? List.of() : List.copyOf(pageCountDistribution);
        yearPublishedDistribution = yearPublishedDistribution == null ? List.of() : List.copyOf(yearPublishedDistribution);
        topAuthors = topAuthors == null ? List.of() : List.copyOf(topAuthors);
    }

    public static BookSummaryStats empty() {
        return new BookSummaryStats(0, 0, 0, null, null, null, null,
            List.of(), 0, List.of(), List.of(), 0, List.of(), 0, null, null);
    }
}
