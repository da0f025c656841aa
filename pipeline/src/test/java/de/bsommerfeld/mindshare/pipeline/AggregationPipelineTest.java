package de.bsommerfeld.mindshare.pipeline;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.mindshare.core.config.GlobalConfig;
import de.bsommerfeld.mindshare.core.domain.EngagementCounters;
import de.bsommerfeld.mindshare.core.domain.LeaderboardSnapshot;
import de.bsommerfeld.mindshare.core.domain.RawEngagementRecord;
import de.bsommerfeld.mindshare.core.event.ApplicationEventBus;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.RunCompletedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.SnapshotPersistedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.SnapshotWriteFailedEvent;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.Target;
import de.bsommerfeld.mindshare.core.event.PipelineEvents.WindowResolvedEvent;
import de.bsommerfeld.mindshare.db.DatabaseService;
import de.bsommerfeld.mindshare.db.StoreException;
import de.bsommerfeld.mindshare.pipeline.PipelineException.Stage;
import de.bsommerfeld.mindshare.pipeline.aggregate.EngagementAggregator;
import de.bsommerfeld.mindshare.pipeline.export.CsvSnapshotExporter;
import de.bsommerfeld.mindshare.pipeline.rank.LeaderboardRanker;
import de.bsommerfeld.mindshare.pipeline.window.WindowResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Orchestration tests with a mocked store and exporter: stage mapping,
 * connection cleanup on every path, and the observable partial-write window.
 */
@ExtendWith(MockitoExtension.class)
class AggregationPipelineTest {

    private static final Instant NOW = Instant.parse("2024-06-05T12:30:00Z");
    private static final String NAME = "AggregatedYapScores_2024_06_05_1230";

    @Mock
    private DatabaseService store;

    @Mock
    private CsvSnapshotExporter exporter;

    private final ApplicationEventBus eventBus = new ApplicationEventBus();
    private final EventRecorder events = new EventRecorder();
    private AggregationPipeline pipeline;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        eventBus.register(events);
        pipeline = new AggregationPipeline(store, new WindowResolver(clock), new EngagementAggregator(),
                new LeaderboardRanker(100, 25), exporter, new GlobalConfig(), clock, eventBus);
    }

    @Test
    void run_shouldWriteBothOutputsAndClose() throws Exception {
        when(store.findRecordsBetween(Instant.parse("2024-06-03T00:00:00Z"), NOW))
                .thenReturn(List.of(record("a", 300), record("b", 100)));
        when(store.replaceSnapshot(eq(NAME), any())).thenReturn(2);
        when(exporter.export(eq(NAME), any())).thenReturn(Path.of("csvs", NAME + ".csv"));

        RunReport report = pipeline.run();

        assertEquals(NAME, report.snapshotName());
        assertEquals(2, report.snapshot().size());
        InOrder order = inOrder(store, exporter);
        order.verify(store).connect();
        order.verify(store).replaceSnapshot(eq(NAME), any());
        order.verify(exporter).export(eq(NAME), any());
        order.verify(store).close();

        assertTrue(events.received.get(0) instanceof WindowResolvedEvent);
        assertTrue(events.received.contains(new SnapshotPersistedEvent(Target.STORE, NAME, 2)));
        assertTrue(events.received.contains(new SnapshotPersistedEvent(Target.CSV, NAME, 2)));
        assertTrue(events.received.contains(new RunCompletedEvent(NAME, Path.of("csvs", NAME + ".csv"), 2)));
    }

    @Test
    void run_shouldProduceBothOutputsForEmptyWindow() throws Exception {
        when(store.findRecordsBetween(any(), any())).thenReturn(List.of());
        when(store.replaceSnapshot(eq(NAME), any())).thenReturn(0);
        when(exporter.export(eq(NAME), any())).thenReturn(Path.of(NAME + ".csv"));

        RunReport report = pipeline.run();

        assertTrue(report.snapshot().isEmpty());
        verify(store).replaceSnapshot(eq(NAME), any(LeaderboardSnapshot.class));
        verify(exporter).export(eq(NAME), any(LeaderboardSnapshot.class));
    }

    @Test
    void run_shouldFailWithConnectionStageAndSkipTheRest() throws Exception {
        doThrow(new StoreException("unreachable")).when(store).connect();

        PipelineException e = assertThrows(PipelineException.class, pipeline::run);

        assertEquals(Stage.CONNECTION, e.getStage());
        assertEquals(2, e.getStage().exitCode());
        verify(store, never()).findRecordsBetween(any(), any());
        verifyNoInteractions(exporter);
        verify(store).close();
    }

    @Test
    void run_shouldCloseAfterAggregationFailure() throws Exception {
        when(store.findRecordsBetween(any(), any())).thenThrow(new StoreException("query failed"));

        PipelineException e = assertThrows(PipelineException.class, pipeline::run);

        assertEquals(Stage.AGGREGATION, e.getStage());
        verify(store, never()).replaceSnapshot(anyString(), any());
        verifyNoInteractions(exporter);
        verify(store).close();
    }

    @Test
    void run_shouldNotExportWhenStoreWriteFails() throws Exception {
        when(store.findRecordsBetween(any(), any())).thenReturn(List.of(record("a", 1)));
        when(store.replaceSnapshot(eq(NAME), any())).thenThrow(new StoreException("disk full"));

        PipelineException e = assertThrows(PipelineException.class, pipeline::run);

        assertEquals(Stage.STORE_WRITE, e.getStage());
        verifyNoInteractions(exporter);
        verify(store).close();
        assertTrue(events.received.stream()
                .filter(SnapshotWriteFailedEvent.class::isInstance)
                .map(SnapshotWriteFailedEvent.class::cast)
                .anyMatch(failed -> failed.target() == Target.STORE));
    }

    @Test
    void run_shouldSurfaceCsvFailureAfterStoreWrite() throws Exception {
        IOException failure = new IOException("read-only file system");
        when(store.findRecordsBetween(any(), any())).thenReturn(List.of(record("a", 1)));
        when(store.replaceSnapshot(eq(NAME), any())).thenReturn(1);
        when(exporter.export(eq(NAME), any())).thenThrow(failure);

        PipelineException e = assertThrows(PipelineException.class, pipeline::run);

        assertEquals(Stage.EXPORT_WRITE, e.getStage());
        assertSame(failure, e.getCause());
        verify(store).close();
        assertTrue(events.received.contains(new SnapshotPersistedEvent(Target.STORE, NAME, 1)),
                "The persisted table must be reported before the CSV failure");
        assertTrue(events.received.contains(new SnapshotWriteFailedEvent(Target.CSV, NAME, failure)));
        assertFalse(events.received.stream().anyMatch(ev -> ev instanceof RunCompletedEvent));
    }

    @Test
    void run_shouldMapUncheckedStoreWriteFailureToStoreStage() throws Exception {
        IllegalStateException failure = new IllegalStateException("driver bug");
        when(store.findRecordsBetween(any(), any())).thenReturn(List.of(record("a", 1)));
        when(store.replaceSnapshot(eq(NAME), any())).thenThrow(failure);

        PipelineException e = assertThrows(PipelineException.class, pipeline::run);

        assertEquals(Stage.STORE_WRITE, e.getStage());
        assertSame(failure, e.getCause());
        verifyNoInteractions(exporter);
        verify(store).close();
        assertTrue(events.received.contains(new SnapshotWriteFailedEvent(Target.STORE, NAME, failure)));
    }

    @Test
    void run_shouldMapUncheckedExportFailureToExportStage() throws Exception {
        IllegalStateException failure = new IllegalStateException("mapper misconfigured");
        when(store.findRecordsBetween(any(), any())).thenReturn(List.of(record("a", 1)));
        when(store.replaceSnapshot(eq(NAME), any())).thenReturn(1);
        when(exporter.export(eq(NAME), any())).thenThrow(failure);

        PipelineException e = assertThrows(PipelineException.class, pipeline::run);

        assertEquals(Stage.EXPORT_WRITE, e.getStage());
        assertSame(failure, e.getCause());
        verify(store).close();
    }

    private static RawEngagementRecord record(String authorId, double score) {
        return new RawEngagementRecord(authorId, authorId, score, EngagementCounters.zero(), List.of(),
                Instant.parse("2024-06-04T10:00:00Z"));
    }

    public static class EventRecorder {
        final List<Object> received = new ArrayList<>();

        @Subscribe
        public void on(Object event) {
            received.add(event);
        }
    }
}
