package cz.vut.fit.iocradar.monitor;

import cz.vut.fit.iocradar.MutableClock;
import cz.vut.fit.iocradar.StorageUnavailableException;
import cz.vut.fit.iocradar.aggregation.AggregationEngine;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKey;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.Observation;
import cz.vut.fit.iocradar.models.RollingStats;
import cz.vut.fit.iocradar.models.scores.NumericScore;
import cz.vut.fit.iocradar.notifications.EventType;
import cz.vut.fit.iocradar.notifications.NotificationSink;
import cz.vut.fit.iocradar.store.InMemoryIndicatorBackend;
import cz.vut.fit.iocradar.store.IndicatorBackend;
import cz.vut.fit.iocradar.store.IndicatorStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalAnswers.delegatesTo;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FeedMonitorTest {

    private static final List<Observation> THREE = List.of(
            new Observation("192.0.2.1", IndicatorKind.IP, "honeypot", new NumericScore(90)),
            new Observation("192.0.2.2", IndicatorKind.IP, "honeypot", new NumericScore(70)),
            new Observation("192.0.2.3", IndicatorKind.IP, "honeypot", new NumericScore(40))
    );

    private MutableClock clock;
    private InMemoryIndicatorBackend memory;
    private IndicatorBackend backend;
    private StatsCache statsCache;
    private NotificationSink sink;
    private FeedMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        memory = new InMemoryIndicatorBackend();
        backend = mock(IndicatorBackend.class, delegatesTo(memory));
        statsCache = new StatsCache(Duration.ofSeconds(10), clock);
        sink = mock(NotificationSink.class);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (monitor != null)
            monitor.close();
    }

    private FeedMonitor monitor(ObservationFeed feed, Duration interval) {
        return monitor(feed, interval, interval);
    }

    private FeedMonitor monitor(ObservationFeed feed, Duration interval, Duration backoff) {
        var engine = new AggregationEngine(new IndicatorStore(backend, clock), List.of(), Duration.ofHours(1),
                Duration.ofSeconds(1));
        monitor = new FeedMonitor(engine, feed, statsCache, List.of(sink), interval, backoff);
        return monitor;
    }

    @Test
    void cycleRecordsObservationsUpdatesStatsAndNotifies() {
        var report = monitor(() -> THREE, Duration.ofSeconds(10)).runCycle();

        assertEquals(3, report.polled());
        assertEquals(3, report.created());
        assertFalse(report.hasErrors());
        assertEquals(3, memory.size());

        var cached = statsCache.get();
        assertFalse(cached.stale());
        assertEquals(3, cached.snapshot().threatsLastHour());
        assertEquals(3, cached.snapshot().totalIndicators());

        verify(sink, times(3)).publish(eq(EventType.NEW_OBSERVATION), any(Indicator.class));
        verify(sink).publish(EventType.STATS_UPDATE, cached.snapshot());
    }

    @Test
    void failingObservationDoesNotAbortTheCycle() throws Exception {
        var second = new IndicatorKey("192.0.2.2", IndicatorKind.IP);
        doThrow(new StorageUnavailableException("write failed")).when(backend).upsert(eq(second), any());

        var report = monitor(() -> THREE, Duration.ofSeconds(10)).runCycle();

        assertEquals(2, report.recorded().size());
        assertEquals(1, report.failed());
        assertTrue(report.hasErrors());
        assertTrue(memory.findOne(new IndicatorKey("192.0.2.1", IndicatorKind.IP)).isPresent());
        assertTrue(memory.findOne(second).isEmpty());
        assertTrue(memory.findOne(new IndicatorKey("192.0.2.3", IndicatorKind.IP)).isPresent());
        verify(sink, times(2)).publish(eq(EventType.NEW_OBSERVATION), any());
    }

    @Test
    void invalidObservationDoesNotAbortTheCycle() {
        var feed = (ObservationFeed) () -> List.of(
                THREE.get(0),
                new Observation("not-an-ip", IndicatorKind.IP, "honeypot", new NumericScore(90)),
                THREE.get(2));

        var report = monitor(feed, Duration.ofSeconds(10)).runCycle();

        assertEquals(2, report.recorded().size());
        assertEquals(1, report.failed());
        assertEquals(2, memory.size());
    }

    @Test
    void feedFailureIsReportedAndStatsStillPublished() {
        var report = monitor(() -> {
            throw new IllegalStateException("feed down");
        }, Duration.ofSeconds(10)).runCycle();

        assertTrue(report.feedFailed());
        assertTrue(report.hasErrors());
        verify(sink).publish(eq(EventType.STATS_UPDATE), any(RollingStats.class));
    }

    @Test
    void statsFailureKeepsLastSnapshot() throws Exception {
        var m = monitor(() -> THREE, Duration.ofSeconds(10));
        m.runCycle();
        var first = statsCache.last().orElseThrow();

        doThrow(new StorageUnavailableException("read failed")).when(backend).aggregate(any());
        clock.advance(Duration.ofSeconds(10));
        var report = m.runCycle();

        assertNull(report.stats());
        assertTrue(report.hasErrors());
        assertSame(first, statsCache.last().orElseThrow());
    }

    @Test
    void stopDuringCycleSkipsRemainingObservations() throws Exception {
        var m = monitor(() -> THREE, Duration.ofSeconds(10));
        doAnswer(invocation -> {
            m.stop();
            return memory.upsert(invocation.getArgument(0), invocation.getArgument(1));
        }).when(backend).upsert(eq(new IndicatorKey("192.0.2.1", IndicatorKind.IP)), any());

        var report = m.runCycle();

        assertEquals(1, report.recorded().size());
        assertEquals(1, memory.size());
        assertEquals(FeedMonitor.State.STOPPED, m.getState());
    }

    @Test
    void lifecycle() throws Exception {
        var polled = new CountDownLatch(1);
        var m = monitor(() -> {
            polled.countDown();
            return List.of();
        }, Duration.ofHours(1));

        assertEquals(FeedMonitor.State.IDLE, m.getState());
        m.start();
        m.start();
        assertEquals(FeedMonitor.State.RUNNING, m.getState());
        assertTrue(polled.await(5, TimeUnit.SECONDS));

        // The monitor sleeps for an hour now; stopping must cut the sleep short
        m.stop();
        assertTrue(m.awaitTermination(Duration.ofSeconds(5)));
        assertEquals(FeedMonitor.State.STOPPED, m.getState());
        assertThrows(IllegalStateException.class, m::start);
    }

    @Test
    void sinkFailureDoesNotBreakTheCycle() {
        doThrow(new RuntimeException("broker down")).when(sink).publish(any(), any());

        var report = monitor(() -> THREE, Duration.ofSeconds(10)).runCycle();

        assertEquals(3, report.recorded().size());
        assertFalse(report.hasErrors());
    }

    @Test
    void materialChangeIsTrackedPerCycle() {
        var batch = new AtomicReference<>(THREE);
        var m = monitor(batch::get, Duration.ofSeconds(10));

        var first = m.runCycle();
        assertEquals(3, first.changed());
        assertTrue(first.anyChanged());

        // lower or equal scores only grow the observation history
        batch.set(List.of(
                new Observation("192.0.2.1", IndicatorKind.IP, "email_filter", new NumericScore(50)),
                new Observation("192.0.2.2", IndicatorKind.IP, "honeypot", new NumericScore(70))));
        var repeated = m.runCycle();
        assertEquals(2, repeated.recorded().size());
        assertEquals(0, repeated.changed());
        assertFalse(repeated.anyChanged());

        batch.set(List.of(new Observation("192.0.2.3", IndicatorKind.IP, "sinkhole", new NumericScore(85))));
        var escalated = m.runCycle();
        assertEquals(1, escalated.changed());
        assertTrue(escalated.anyChanged());
        assertEquals(85, memory.findOne(new IndicatorKey("192.0.2.3", IndicatorKind.IP)).orElseThrow().threatScore());
    }

    @Test
    void backoffFollowsOnlyCyclesWithErrors() {
        var m = monitor(List::of, Duration.ofSeconds(10), Duration.ofSeconds(30));
        var stats = RollingStats.empty(clock.instant());

        assertEquals(Duration.ofSeconds(30), m.nextPause(null));
        assertEquals(Duration.ofSeconds(30), m.nextPause(new CycleReport(3, List.of(), 0, 1, false, stats)));
        assertEquals(Duration.ofSeconds(30), m.nextPause(new CycleReport(0, List.of(), 0, 0, true, stats)));
        assertEquals(Duration.ofSeconds(30), m.nextPause(new CycleReport(0, List.of(), 0, 0, false, null)));
        assertEquals(Duration.ofSeconds(10), m.nextPause(new CycleReport(0, List.of(), 0, 0, false, stats)));
    }

    @Test
    void loopBacksOffOnceThenReturnsToNormalInterval() throws Exception {
        var polls = new AtomicInteger();
        var secondPoll = new CountDownLatch(1);
        var m = monitor(() -> {
            if (polls.incrementAndGet() == 1)
                throw new IllegalStateException("feed down");
            secondPoll.countDown();
            return List.of();
        }, Duration.ofHours(1), Duration.ofMillis(50));

        m.start();

        // the failed first cycle waits only for the short backoff
        assertTrue(secondPoll.await(5, TimeUnit.SECONDS));
        // the clean second cycle waits for the hour-long interval
        Thread.sleep(300);
        assertEquals(2, polls.get());
    }
}
