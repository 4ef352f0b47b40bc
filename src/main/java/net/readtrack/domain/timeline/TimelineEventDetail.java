package net.readtrack.domain.timeline;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * Label/value pair rendered under a timeline entry (for example {@code Author: Frank Herbert}).
 */
@JsonPropertyOrder({"label", "value"})
public record TimelineEventDetail(String label, String value) {

    static final String UNKNOWN_AUTHOR = "Unknown";

    public static TimelineEventDetail authors(List<String> authorNames) {
        if (authorNames == null || authorNames.isEmpty()) {
            return new TimelineEventDetail("Author", UNKNOWN_AUTHOR);
        }
        return new TimelineEventDetail("Author", String.join(", ", authorNames));
    }
}
