package net.readtrack.domain.timeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.annotation.Nullable;

/**
 * Reading facts attached to reading events for quick reference in the feed.
 */
@JsonPropertyOrder({"book_id", "status", "rating"})
public record TimelineReadingData(
    @JsonProperty("book_id") long bookId,
    @JsonProperty("status") String status,
    @JsonProperty("rating") @Nullable Double rating
) {
}
