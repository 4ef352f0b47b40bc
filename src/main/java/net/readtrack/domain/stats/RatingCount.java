package net.readtrack.domain.stats;

/** Number of readings given one half-star rating value. */
public record RatingCount(double rating, long count) {
}
