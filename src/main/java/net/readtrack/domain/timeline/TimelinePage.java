package net.readtrack.domain.timeline;

import jakarta.annotation.Nullable;
import java.util.List;

/**
 * One page of the feed plus the cursor of the next page, absent on the last page.
 */
public record TimelinePage<T>(List<T> items, @Nullable String nextCursor) {

    public TimelinePage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }
}
