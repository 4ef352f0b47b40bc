package net.readtrack.application.timeline;

import jakarta.annotation.Nullable;
import java.util.List;
import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.TimelineCursor;
import net.readtrack.domain.timeline.TimelineEvent;
import net.readtrack.domain.timeline.TimelinePage;
import net.readtrack.domain.timeline.TimelineScope;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Serves feed pages and entity histories from the timeline store.
 */
@Service
public class TimelineQueryService {

    private final TimelineEventRepository timelineEventRepository;
    private final PageSettings pageSettings;

    public TimelineQueryService(TimelineEventRepository timelineEventRepository, PageSettings pageSettings) {
        this.timelineEventRepository = timelineEventRepository;
        this.pageSettings = pageSettings;
    }

    @Component
    public static class ConfigLoader {
        @Bean
        public PageSettings timelinePageSettings(
            @Value("${app.timeline.default-page-size:20}") int defaultPageSize,
            @Value("${app.timeline.max-page-size:100}") int maxPageSize
        ) {
            return new PageSettings(defaultPageSize, maxPageSize);
        }
    }

    public record PageSettings(int defaultPageSize, int maxPageSize) {
        public PageSettings {
            if (maxPageSize < 1) {
                throw new IllegalArgumentException("app.timeline.max-page-size must be at least 1 but was " + maxPageSize);
            }
            defaultPageSize = Math.max(1, Math.min(defaultPageSize, maxPageSize));
        }

        int clamp(@Nullable Integer requested) {
            if (requested == null) {
                return defaultPageSize;
            }
            return Math.max(1, Math.min(requested, maxPageSize));
        }
    }

    /**
     * Returns one feed page ordered newest first.
     *
     * @param scope {@code MINE} for the acting user's events, {@code GLOBAL} for everyone's
     * @param actingUserId required for {@code MINE}
     * @param cursor {@code nextCursor} of the previous page, or blank for the first page
     * @param limit requested page size; clamped to the configured bounds
     * @throws net.readtrack.exception.InvalidTimelineCursorException when {@code cursor} is malformed
     * @throws IllegalArgumentException when {@code MINE} is requested without a user
     */
    @Transactional(readOnly = true)
    public TimelinePage<TimelineEntry> page(TimelineScope scope,
                                            @Nullable Long actingUserId,
                                            @Nullable String cursor,
                                            @Nullable Integer limit) {
        TimelineCursor position = StringUtils.hasText(cursor) ? TimelineCursor.decode(cursor) : null;
        int pageSize = pageSettings.clamp(limit);
        TimelinePage<TimelineEvent> events;
        if (scope == TimelineScope.MINE) {
            if (actingUserId == null) {
                throw new IllegalArgumentException("scope 'mine' requires an authenticated user");
            }
            events = timelineEventRepository.listByUser(actingUserId, position, pageSize);
        } else {
            events = timelineEventRepository.listGlobal(position, pageSize);
        }
        return new TimelinePage<>(events.items().stream().map(TimelineEntry::from).toList(), events.nextCursor());
    }

    /**
     * Full history of one entity, oldest first.
     */
    @Transactional(readOnly = true)
    public List<TimelineEntry> history(EntityKey key) {
        return timelineEventRepository.listByEntity(key).stream().map(TimelineEntry::from).toList();
    }
}
