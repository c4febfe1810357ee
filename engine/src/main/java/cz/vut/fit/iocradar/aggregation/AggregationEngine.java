package cz.vut.fit.iocradar.aggregation;

import cz.vut.fit.iocradar.AggregatorConfig;
import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.InvalidObservationException;
import cz.vut.fit.iocradar.StorageUnavailableException;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKey;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.IndicatorUpdate;
import cz.vut.fit.iocradar.models.Observation;
import cz.vut.fit.iocradar.models.SourceObservation;
import cz.vut.fit.iocradar.scoring.ScoreNormalizer;
import cz.vut.fit.iocradar.sources.SourceLookup;
import cz.vut.fit.iocradar.sources.SourceReport;
import cz.vut.fit.iocradar.store.IndicatorStore;
import cz.vut.fit.iocradar.store.UpsertOutcome;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Orchestrates the reputation sources and the indicator store.
 * <p>
 * A lookup first checks whether the stored record is fresh; if not, all sources that support the indicator
 * kind are asked concurrently, each bounded by the source timeout. Sources that fail, time out or have no data
 * are skipped. Observations pushed by feeds are validated, normalized and merged into the store.
 */
public class AggregationEngine implements AutoCloseable {
    public static final String COMPONENT_NAME = "aggregation-engine";
    private static final Logger Logger = Common.getComponentLogger(AggregationEngine.class);

    private final IndicatorStore _store;
    private final List<SourceLookup> _sources;
    private final Duration _freshnessWindow;
    private final Duration _sourceTimeout;
    private final Clock _clock;

    public AggregationEngine(@NotNull IndicatorStore store, @NotNull List<SourceLookup> sources,
                             @NotNull Duration freshnessWindow, @NotNull Duration sourceTimeout) {
        _store = store;
        _sources = List.copyOf(sources);
        _freshnessWindow = freshnessWindow;
        _sourceTimeout = sourceTimeout;
        _clock = store.getClock();
    }

    public AggregationEngine(@NotNull IndicatorStore store, @NotNull List<SourceLookup> sources,
                             @NotNull Properties properties) {
        this(store, sources,
                Common.secondsProperty(properties, AggregatorConfig.FRESHNESS_WINDOW_SEC_CONFIG,
                        AggregatorConfig.FRESHNESS_WINDOW_SEC_DEFAULT),
                Common.secondsProperty(properties, AggregatorConfig.SOURCE_TIMEOUT_SEC_CONFIG,
                        AggregatorConfig.SOURCE_TIMEOUT_SEC_DEFAULT));
    }

    /**
     * Returns the record of an indicator, refreshing it from the sources if it is missing or stale.
     *
     * @param value The indicator value.
     * @param kind  The indicator kind.
     * @return The fresh or newly merged record, or an empty optional if no record is stored and no source
     * has data about the indicator.
     * @throws StorageUnavailableException If the merged record cannot be written.
     */
    public @NotNull Optional<Indicator> lookupOrFetch(@NotNull String value, @NotNull IndicatorKind kind)
            throws StorageUnavailableException {
        if (value == null || value.isBlank() || kind == null)
            throw new IllegalArgumentException("A lookup requires a value and a kind");

        final var now = _clock.instant();
        final var key = new IndicatorKey(value, kind);

        try {
            var stored = _store.get(value, kind);
            if (stored.isPresent() && isFresh(stored.get(), now)) {
                Logger.debug("[{}] Fresh record, skipping the sources", key);
                return stored;
            }
        } catch (StorageUnavailableException e) {
            Logger.warn("[{}] Cannot read the stored record, querying the sources: {}", key, e.getMessage());
        }

        final var applicable = _sources.stream().filter(source -> source.supports(kind)).toList();
        if (applicable.isEmpty()) {
            Logger.debug("[{}] No source supports kind {}", key, kind);
            return Optional.empty();
        }

        final var futures = applicable.stream()
                .map(source -> boundedLookup(source, value, kind))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        final var observedAt = _clock.instant();
        final var observations = new ArrayList<SourceObservation>();
        final Set<String> responders = new HashSet<>();
        int score = 0;
        for (var future : futures) {
            var report = future.join();
            if (report.isEmpty())
                continue;

            var normalized = ScoreNormalizer.normalize(report.get().source(), report.get().rawScore());
            observations.add(new SourceObservation(report.get().source(), normalized.score(), normalized.tier(),
                    observedAt, report.get().details()));
            responders.add(report.get().source());
            score = Math.max(score, normalized.score());
        }

        if (responders.isEmpty()) {
            Logger.debug("[{}] No source has data", key);
            return Optional.empty();
        }

        Logger.debug("[{}] {} of {} sources answered, score {}", key, responders.size(), applicable.size(), score);
        var outcome = _store.upsert(new IndicatorUpdate(key, score, responders, observations, Set.of(),
                kind.id().toUpperCase(Locale.ROOT) + ": " + key.value()));
        return Optional.of(outcome.record());
    }

    /**
     * Validates, normalizes and stores one observation.
     *
     * @param observation The observation.
     * @return The merge outcome; {@link UpsertOutcome#changed()} tells whether the record was created or its
     * score or classification changed.
     * @throws InvalidObservationException If the observation is malformed. Nothing is stored in such case.
     * @throws StorageUnavailableException If the record cannot be written.
     */
    public @NotNull UpsertOutcome record(Observation observation) throws StorageUnavailableException {
        validate(observation);

        final var normalized = ScoreNormalizer.normalize(observation.source(), observation.rawScore());
        final var snapshot = new SourceObservation(observation.source(), normalized.score(), normalized.tier(),
                _clock.instant(), observation.details());
        final var key = new IndicatorKey(observation.value(), observation.kind());

        return _store.upsert(new IndicatorUpdate(key, normalized.score(), Set.of(observation.source()),
                List.of(snapshot), observation.tags(), observation.description()));
    }

    static void validate(Observation observation) {
        if (observation == null)
            throw new InvalidObservationException("Missing observation");
        if (observation.value() == null || observation.value().isBlank())
            throw new InvalidObservationException("Missing indicator value");
        if (observation.kind() == null)
            throw new InvalidObservationException("Missing indicator kind for " + observation.value());
        if (observation.source() == null || observation.source().isBlank())
            throw new InvalidObservationException("Missing source for " + observation.value());
        if (observation.rawScore() == null)
            throw new InvalidObservationException("Missing score for " + observation.value());
        if (!observation.kind().accepts(observation.value()))
            throw new InvalidObservationException("'" + observation.value() + "' is not a valid "
                    + observation.kind().id());
    }

    private boolean isFresh(Indicator record, Instant now) {
        return Duration.between(record.lastSeen(), now).compareTo(_freshnessWindow) < 0;
    }

    private CompletableFuture<Optional<SourceReport>> boundedLookup(SourceLookup source, String value,
                                                                   IndicatorKind kind) {
        final CompletableFuture<Optional<SourceReport>> future;
        try {
            future = source.lookup(value, kind);
        } catch (RuntimeException e) {
            Logger.warn("[{}:{}] Source {} failed", kind, value, source.getName(), e);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return future.copy()
                .orTimeout(_sourceTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, e) -> {
                    if (e == null)
                        return result == null ? Optional.<SourceReport>empty() : result;

                    var cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof TimeoutException) {
                        Logger.debug("[{}:{}] Source {} timed out", kind, value, source.getName());
                    } else {
                        Logger.warn("[{}:{}] Source {} failed: {}", kind, value, source.getName(),
                                cause.toString());
                    }
                    return Optional.<SourceReport>empty();
                });
    }

    public IndicatorStore getStore() {
        return _store;
    }

    @Override
    public void close() {
        for (var source : _sources) {
            try {
                source.close();
            } catch (Exception e) {
                Logger.warn("Failed to close source {}", source.getName(), e);
            }
        }
    }
}
