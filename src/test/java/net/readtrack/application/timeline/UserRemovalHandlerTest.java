package net.readtrack.application.timeline;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.application.stats.StatsQueryService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserRemovalHandlerTest {

    @Mock
    private TimelineEventRepository timelineEventRepository;

    @Mock
    private StatsQueryService statsQueryService;

    @Test
    void should_DetachEventsAndDropStats_When_UserRemoved() {
        when(timelineEventRepository.clearUserAttribution(7L)).thenReturn(4);
        UserRemovalHandler handler = new UserRemovalHandler(timelineEventRepository, statsQueryService);

        handler.onUserRemoved(7L);

        InOrder order = inOrder(timelineEventRepository, statsQueryService);
        order.verify(timelineEventRepository).clearUserAttribution(7L);
        order.verify(statsQueryService).invalidateUser(7L);
    }
}
