package net.readtrack.application.timeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import net.readtrack.adapters.persistence.JdbcEntitySnapshotReader;
import net.readtrack.adapters.persistence.RebuildCheckpointRepository;
import net.readtrack.adapters.persistence.TimelineEventRepository;
import net.readtrack.adapters.persistence.TimelinePayloadCodec;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import net.readtrack.domain.timeline.TimelineEvent;
import net.readtrack.domain.timeline.TimelineEventDetail;
import net.readtrack.domain.timeline.snapshot.BookSnapshot;
import net.readtrack.exception.TimelineSnapshotValidationException;
import net.readtrack.testutil.LibraryFixtures;
import net.readtrack.testutil.PostgresTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import tools.jackson.databind.ObjectMapper;

/**
 * Records events through the mutation path against Postgres, then changes the library behind
 * the timeline's back and checks what a rebuild does with the stored payloads.
 */
class TimelineRebuildIntegrationTest {

    private JdbcTemplate jdbcTemplate;
    private LibraryFixtures fixtures;
    private TimelineEventRepository eventRepository;
    private JdbcEntitySnapshotReader snapshotReader;
    private TimelineMutationService mutationService;
    private TimelineRebuildService rebuildService;

    private long authorId;
    private long bookId;
    private long readingId;

    @BeforeEach
    void setUp() {
        DataSource dataSource = PostgresTestSupport.dataSource();
        jdbcTemplate = new JdbcTemplate(dataSource);
        PostgresTestSupport.resetTables(jdbcTemplate);
        fixtures = new LibraryFixtures(jdbcTemplate);

        DataSourceTransactionManager transactionManager = new DataSourceTransactionManager(dataSource);
        eventRepository = new TimelineEventRepository(jdbcTemplate, new TimelinePayloadCodec(new ObjectMapper()));
        snapshotReader = new JdbcEntitySnapshotReader(jdbcTemplate);
        TimelineRecorder recorder = new TimelineRecorder(eventRepository, event -> { }, Clock.systemUTC());
        mutationService = new TimelineMutationService(recorder, transactionManager);
        rebuildService = new TimelineRebuildService(
            eventRepository,
            snapshotReader,
            new RebuildCheckpointRepository(jdbcTemplate),
            new RebuildProgressTracker(),
            new TimelineRebuildService.RebuildSettings(2, OrphanPolicy.FREEZE, 2, 1L),
            transactionManager,
            new SimpleMeterRegistry(),
            Clock.systemUTC()
        );

        long alice = fixtures.user("alice");
        long sciFi = fixtures.genre("Sci-Fi");
        authorId = record(EntityType.AUTHOR, TimelineActions.CREATED, null,
            () -> fixtures.author("Frank Herbert"));
        bookId = record(EntityType.BOOK, TimelineActions.CREATED, null, () -> {
            long id = fixtures.book("Dune", 412, 1965, sciFi, null);
            fixtures.credit(id, authorId);
            return id;
        });
        readingId = record(EntityType.READING, "started", alice,
            () -> fixtures.reading(alice, bookId, "reading", null, null, null, "ereader"));
    }

    @Test
    void should_RefreshEmbeddedAuthorName_When_AuthorRenamed() {
        fixtures.renameAuthor(authorId, "Frank P. Herbert");

        RebuildSummary summary = rebuildService.rebuildAll(false);

        assertThat(summary.scanned()).isEqualTo(3);
        assertThat(summary.updated()).isEqualTo(3);
        assertThat(summary.errors()).isZero();
        assertThat(eventsOf(EntityType.AUTHOR, authorId).get(0).payload().title()).isEqualTo("Frank P. Herbert");
        assertThat(eventsOf(EntityType.BOOK, bookId).get(0).payload().details())
            .contains(new TimelineEventDetail("Author", "Frank P. Herbert"));
        assertThat(eventsOf(EntityType.READING, readingId).get(0).payload().details())
            .contains(new TimelineEventDetail("Author", "Frank P. Herbert"));
    }

    @Test
    void should_LeaveRowsByteIdentical_When_RebuildRunsTwice() {
        fixtures.renameAuthor(authorId, "Frank P. Herbert");
        rebuildService.rebuildAll(false);
        List<Map<String, Object>> afterFirst = allEvents();

        RebuildSummary second = rebuildService.rebuildAll(false);

        assertThat(second.updated()).isZero();
        assertThat(second.unchanged()).isEqualTo(3);
        assertThat(allEvents()).isEqualTo(afterFirst);
    }

    @Test
    void should_FreezeEventsOfDeletedBook_When_OrphanPolicyIsFreeze() {
        fixtures.renameAuthor(authorId, "Frank P. Herbert");
        fixtures.deleteBook(bookId);

        RebuildSummary summary = rebuildService.rebuildAll(false);

        // deleting the book cascades to its reading
        assertThat(summary.orphaned()).isEqualTo(2);
        assertThat(summary.pruned()).isZero();
        assertThat(eventsOf(EntityType.BOOK, bookId)).singleElement()
            .satisfies(event -> assertThat(event.payload().details())
                .contains(new TimelineEventDetail("Author", "Frank Herbert")));
        assertThat(eventsOf(EntityType.AUTHOR, authorId).get(0).payload().title()).isEqualTo("Frank P. Herbert");
    }

    @Test
    void should_RefreshDependents_When_CascadeRequestedForAuthor() {
        fixtures.renameAuthor(authorId, "F. Herbert");

        RebuildSummary summary = rebuildService.refreshEntityCascade(EntityKey.of(EntityType.AUTHOR, authorId));

        assertThat(summary.scanned()).isEqualTo(3);
        assertThat(summary.updated()).isEqualTo(3);
        assertThat(eventsOf(EntityType.READING, readingId).get(0).payload().details())
            .contains(new TimelineEventDetail("Author", "F. Herbert"));
    }

    @Test
    void should_PersistNeitherEntityNorEvent_When_SnapshotInvalid() {
        Integer booksBefore = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM books", Integer.class);
        Integer eventsBefore = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM timeline_events", Integer.class);

        assertThatThrownBy(() -> mutationService.applyAndRecord(new EntityMutation(EntityType.BOOK,
            TimelineActions.CREATED, null, () -> {
                long id = fixtures.book("Untitled draft", 10, null, null, null);
                return new EntityMutation.Outcome(id, new BookSnapshot(id, " ", List.of(), null, null, 10));
            })))
            .isInstanceOf(TimelineSnapshotValidationException.class);

        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM books", Integer.class)).isEqualTo(booksBefore);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM timeline_events", Integer.class))
            .isEqualTo(eventsBefore);
    }

    private long record(EntityType type, String action, Long userId, EntityInsert insert) {
        TimelineEvent event = mutationService.applyAndRecord(new EntityMutation(type, action, userId, () -> {
            long id = insert.insert();
            return new EntityMutation.Outcome(id, snapshotReader.read(EntityKey.of(type, id)).orElseThrow());
        }));
        return event.key().entityId();
    }

    private List<TimelineEvent> eventsOf(EntityType type, long id) {
        return eventRepository.listByEntity(EntityKey.of(type, id));
    }

    private List<Map<String, Object>> allEvents() {
        return jdbcTemplate.queryForList("SELECT * FROM timeline_events ORDER BY id");
    }

    @FunctionalInterface
    private interface EntityInsert {
        long insert();
    }
}
