package net.readtrack.controller;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;
import net.readtrack.application.stats.StatsQueryService;
import net.readtrack.application.timeline.RebuildProgress;
import net.readtrack.application.timeline.RebuildSummary;
import net.readtrack.application.timeline.TimelineEntry;
import net.readtrack.application.timeline.TimelineQueryService;
import net.readtrack.application.timeline.TimelineRebuildService;
import net.readtrack.controller.support.ApiExceptionHandler;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.exception.RebuildAlreadyRunningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class TimelineAdminControllerTest {

    @Mock
    private TimelineRebuildService timelineRebuildService;

    @Mock
    private TimelineQueryService timelineQueryService;

    @Mock
    private StatsQueryService statsQueryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TimelineAdminController controller =
            new TimelineAdminController(timelineRebuildService, timelineQueryService, statsQueryService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    void should_ReturnSummary_When_RebuildCompletes() throws Exception {
        when(timelineRebuildService.rebuildAll(true))
            .thenReturn(new RebuildSummary(120, 40, 78, 2, 0, 0, 2, "book:9", false, 850));

        mockMvc.perform(post("/admin/timeline/rebuild").param("resume", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scanned").value(120))
            .andExpect(jsonPath("$.updated").value(40))
            .andExpect(jsonPath("$.orphaned").value(2))
            .andExpect(jsonPath("$.resumedFrom").value("book:9"));
    }

    @Test
    void should_ReturnConflict_When_RebuildAlreadyRunning() throws Exception {
        when(timelineRebuildService.rebuildAll(false)).thenThrow(new RebuildAlreadyRunningException());

        mockMvc.perform(post("/admin/timeline/rebuild"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Rebuild already running"));
    }

    @Test
    void should_ReportProgress_When_StatusRequested() throws Exception {
        when(timelineRebuildService.getProgress()).thenReturn(
            new RebuildProgress(true, 200, 10, 1, 0, 2, "reading:77", Instant.parse("2024-06-15T08:00:00Z"), null));

        mockMvc.perform(get("/admin/timeline/rebuild/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(true))
            .andExpect(jsonPath("$.lastCommittedKey").value("reading:77"));
    }

    @Test
    void should_NotCancel_When_NoRebuildRunning() throws Exception {
        when(timelineRebuildService.isRunning()).thenReturn(false);

        mockMvc.perform(post("/admin/timeline/rebuild/cancel"))
            .andExpect(status().isOk())
            .andExpect(content().string("No timeline rebuild is running"));

        verify(timelineRebuildService, never()).cancel();
    }

    @Test
    void should_RequestCancellation_When_RebuildRunning() throws Exception {
        when(timelineRebuildService.isRunning()).thenReturn(true);

        mockMvc.perform(post("/admin/timeline/rebuild/cancel"))
            .andExpect(status().isOk())
            .andExpect(content().string("Timeline rebuild cancellation requested"));

        verify(timelineRebuildService).cancel();
    }

    @Test
    void should_RefreshCascade_When_EntityRefreshRequested() throws Exception {
        EntityKey key = EntityKey.of(EntityType.AUTHOR, 3);
        when(timelineRebuildService.refreshEntityCascade(key))
            .thenReturn(new RebuildSummary(4, 4, 0, 0, 0, 0, 1, null, false, 12));

        mockMvc.perform(post("/admin/timeline/refresh/author/3"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.updated").value(4));
    }

    @Test
    void should_ReturnBadRequest_When_EntityTypeUnknown() throws Exception {
        mockMvc.perform(post("/admin/timeline/refresh/shelf/3"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(timelineRebuildService);
    }

    @Test
    void should_ReturnEntityHistory() throws Exception {
        EntityKey key = EntityKey.of(EntityType.BOOK, 1);
        when(timelineQueryService.history(key)).thenReturn(List.of(
            new TimelineEntry(1, "book", 1, "created", Instant.parse("2024-01-01T00:00:00Z"), "Dune",
                List.of(), List.of("Sci-Fi"), null)
        ));

        mockMvc.perform(get("/admin/timeline/book/1/events"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].action").value("created"))
            .andExpect(jsonPath("$[0].genres[0]").value("Sci-Fi"));
    }

    @Test
    void should_InvalidateUserStats() throws Exception {
        when(statsQueryService.invalidateUser(7L)).thenReturn(true);

        mockMvc.perform(delete("/admin/stats/7"))
            .andExpect(status().isNoContent());

        verify(statsQueryService).invalidateUser(7L);
    }
}
