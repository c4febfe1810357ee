package cz.vut.fit.iocradar.monitor;

import cz.vut.fit.iocradar.AggregatorConfig;
import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.InvalidObservationException;
import cz.vut.fit.iocradar.StorageUnavailableException;
import cz.vut.fit.iocradar.aggregation.AggregationEngine;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.Observation;
import cz.vut.fit.iocradar.models.RollingStats;
import cz.vut.fit.iocradar.notifications.EventType;
import cz.vut.fit.iocradar.notifications.NotificationSink;
import cz.vut.fit.iocradar.store.UpsertOutcome;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A background process that periodically polls an {@link ObservationFeed}, records the observations through
 * the {@link AggregationEngine}, recomputes the rolling statistics and notifies the subscribers.
 * <p>
 * The monitor moves from {@link State#IDLE} to {@link State#RUNNING} on {@link #start()} and to the terminal
 * {@link State#STOPPED} on {@link #stop()}. Stopping lets the observation being recorded finish; no further
 * observation or cycle is started and the sleep between cycles is cut short.
 */
public class FeedMonitor implements AutoCloseable {
    public static final String COMPONENT_NAME = "feed-monitor";
    private static final Logger Logger = Common.getComponentLogger(FeedMonitor.class);

    public enum State {
        IDLE,
        RUNNING,
        STOPPED
    }

    private final AggregationEngine _engine;
    private final ObservationFeed _feed;
    private final StatsCache _statsCache;
    private final List<NotificationSink> _sinks;
    private final Duration _interval;
    private final Duration _backoffInterval;

    private final AtomicReference<State> _state = new AtomicReference<>(State.IDLE);
    private final CountDownLatch _stopLatch = new CountDownLatch(1);
    private Thread _thread;

    public FeedMonitor(@NotNull AggregationEngine engine, @NotNull ObservationFeed feed,
                       @NotNull StatsCache statsCache, @NotNull List<NotificationSink> sinks,
                       @NotNull Duration interval, @NotNull Duration backoffInterval) {
        _engine = engine;
        _feed = feed;
        _statsCache = statsCache;
        _sinks = List.copyOf(sinks);
        _interval = interval;
        _backoffInterval = backoffInterval;
    }

    public FeedMonitor(@NotNull AggregationEngine engine, @NotNull ObservationFeed feed,
                       @NotNull StatsCache statsCache, @NotNull List<NotificationSink> sinks,
                       @NotNull Properties properties) {
        this(engine, feed, statsCache, sinks,
                Common.secondsProperty(properties, AggregatorConfig.MONITOR_INTERVAL_SEC_CONFIG,
                        AggregatorConfig.MONITOR_INTERVAL_SEC_DEFAULT),
                Common.secondsProperty(properties, AggregatorConfig.MONITOR_BACKOFF_SEC_CONFIG,
                        AggregatorConfig.MONITOR_BACKOFF_SEC_DEFAULT));
    }

    /**
     * Starts the monitor thread. Calling this method on a running monitor has no effect.
     *
     * @throws IllegalStateException If the monitor has been stopped.
     */
    public synchronized void start() {
        if (_state.get() == State.RUNNING)
            return;
        if (!_state.compareAndSet(State.IDLE, State.RUNNING))
            throw new IllegalStateException("A stopped monitor cannot be restarted");

        _thread = new Thread(this::runLoop, COMPONENT_NAME);
        _thread.setDaemon(true);
        _thread.start();
        Logger.info("Feed monitor started (interval {} s, backoff {} s)", _interval.toSeconds(),
                _backoffInterval.toSeconds());
    }

    /**
     * Requests the monitor to stop. Does not wait for the current observation to finish.
     */
    public void stop() {
        var previous = _state.getAndSet(State.STOPPED);
        _stopLatch.countDown();
        if (previous != State.STOPPED)
            Logger.info("Feed monitor stopping");
    }

    /**
     * Waits for the monitor thread to finish.
     *
     * @param timeout The maximum time to wait.
     * @return True if the thread has finished or was never started.
     * @throws InterruptedException If the waiting thread is interrupted.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread thread;
        synchronized (this) {
            thread = _thread;
        }
        if (thread == null)
            return true;

        thread.join(timeout.toMillis());
        return !thread.isAlive();
    }

    public State getState() {
        return _state.get();
    }

    public StatsCache getStatsCache() {
        return _statsCache;
    }

    private void runLoop() {
        while (_state.get() == State.RUNNING) {
            CycleReport report = null;
            try {
                report = runCycle();
            } catch (RuntimeException e) {
                Logger.error("Unhandled exception in the monitor cycle", e);
            }

            final var pause = nextPause(report);
            try {
                if (_stopLatch.await(pause.toMillis(), TimeUnit.MILLISECONDS))
                    break;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        Logger.info("Feed monitor stopped");
    }

    /**
     * Chooses the pause after a cycle. A cycle that failed as a whole or reported any error is followed by
     * the backoff interval; the next clean cycle returns to the normal interval.
     *
     * @param report The report of the finished cycle, or null if the cycle threw.
     * @return The time to wait before the next cycle.
     */
    Duration nextPause(@Nullable CycleReport report) {
        return report == null || report.hasErrors() ? _backoffInterval : _interval;
    }

    /**
     * Runs one cycle: polls the feed, records the observations, recomputes the statistics and publishes
     * the events. A failing observation does not prevent the others from being recorded.
     *
     * @return The report of the cycle.
     */
    public CycleReport runCycle() {
        List<Observation> observations;
        boolean feedFailed = false;
        try {
            observations = _feed.poll();
        } catch (RuntimeException e) {
            Logger.warn("Cannot poll the observation feed", e);
            observations = List.of();
            feedFailed = true;
        }

        final var recorded = new ArrayList<UpsertOutcome>();
        int changed = 0;
        int failed = 0;
        for (var observation : observations) {
            if (_state.get() == State.STOPPED) {
                Logger.debug("Stopped, skipping the remaining observations");
                break;
            }

            try {
                var outcome = _engine.record(observation);
                recorded.add(outcome);
                if (outcome.changed())
                    changed++;
                Logger.debug("New {} observation: {} ({}), score {}", observation.source(), observation.value(),
                        observation.kind(), outcome.record().threatScore());
            } catch (InvalidObservationException e) {
                failed++;
                Logger.warn("Rejected an observation: {}", e.getMessage());
            } catch (StorageUnavailableException e) {
                failed++;
                Logger.warn("Cannot store an observation of {}: {}", observation.value(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                Logger.error("Unexpected error while recording an observation", e);
            }
        }

        RollingStats stats = null;
        try {
            stats = _engine.getStore().rollingStats();
            _statsCache.put(stats);
        } catch (StorageUnavailableException e) {
            Logger.warn("Cannot recompute the statistics, keeping the last snapshot: {}", e.getMessage());
        }

        if (changed > 0) {
            var top = recorded.stream()
                    .filter(UpsertOutcome::changed)
                    .map(UpsertOutcome::record)
                    .max(Comparator.comparingInt(Indicator::threatScore))
                    .orElseThrow();
            Logger.info("Threat picture changed: {} indicator(s) new or escalated, highest {} ({}, score {})",
                    changed, top.key(), top.classification().id(), top.threatScore());
        }

        for (var outcome : recorded) {
            publish(EventType.NEW_OBSERVATION, outcome.record());
        }
        publish(EventType.STATS_UPDATE, _statsCache.get().snapshot());

        var report = new CycleReport(observations.size(), recorded, changed, failed, feedFailed, stats);
        Logger.debug("Cycle finished: {} polled, {} recorded, {} changed, {} failed", report.polled(),
                recorded.size(), changed, failed);
        return report;
    }

    private void publish(EventType event, Object payload) {
        for (var sink : _sinks) {
            try {
                sink.publish(event, payload);
            } catch (RuntimeException e) {
                Logger.warn("Notification sink {} failed", sink.getClass().getSimpleName(), e);
            }
        }
    }

    @Override
    public void close() throws InterruptedException {
        stop();
        if (!awaitTermination(_interval.plusSeconds(5)))
            Logger.warn("The monitor thread did not finish in time");
    }
}
