package net.readtrack.domain.stats;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * Reading activity totals and distributions for one user.
 */
public record ReadingStats(
    long booksLast30Days,
    long booksAllTime,
    long pagesLast30Days,
    long pagesAllTime,
    long booksInProgress,
    long booksOnShelf,
    long booksOnWishlist,
    long booksAbandoned,
    @Nullable Double averageRating,
    @Nullable Double averageDaysToFinish,
    List<RatingCount> ratingDistribution,
    long maxRatingCount,
    List<NameCount> monthlyBooks,
    List<NamePages> monthlyPages,
    long maxMonthlyBooks,
    long maxMonthlyPages,
    List<NameCount> yearlyBooks,
    List<NamePages> yearlyPages,
    long maxYearlyBooks,
    long maxYearlyPages,
    List<NameCount> paceDistribution,
    List<NameCount> formatCounts
) {
    public ReadingStats {
        ratingDistribution = ratingDistribution == null ? List.of() : List.copyOf(ratingDistribution);
        monthlyBooks = monthlyBooks == null ? List.of() : List.copyOf(monthlyBooks);
        monthlyPages = monthlyPages == null ? List.of() : List.copyOf(monthlyPages);
        yearlyBooks = yearlyBooks == null ? List.of() : List.copyOf(yearlyBooks);
        yearlyPages = yearlyPages == null ? List.of() : List.copyOf(yearlyPages);
        paceDistribution = paceDistribution == null ? List.of() : List.copyOf(paceDistribution);
        formatCounts = formatCounts == null ? List.of() : List.copyOf(formatCounts);
    }
}
