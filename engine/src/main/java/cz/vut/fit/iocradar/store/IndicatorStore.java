package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.StorageUnavailableException;
import cz.vut.fit.iocradar.models.Classification;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKey;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.IndicatorUpdate;
import cz.vut.fit.iocradar.models.RollingStats;
import cz.vut.fit.iocradar.models.SourceObservation;
import cz.vut.fit.iocradar.models.ThreatLevel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owns the canonical indicator records. Evidence about an indicator is merged into its record so that
 * the threat score never decreases, the sources and tags only grow, and {@code firstSeen} never changes.
 */
public class IndicatorStore {
    public static final String COMPONENT_NAME = "indicator-store";
    private static final Logger Logger = Common.getComponentLogger(IndicatorStore.class);

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final IndicatorBackend _backend;
    private final Clock _clock;

    public IndicatorStore(@NotNull IndicatorBackend backend, @NotNull Clock clock) {
        _backend = backend;
        _clock = clock;
    }

    public IndicatorStore(@NotNull IndicatorBackend backend) {
        this(backend, Clock.systemUTC());
    }

    /**
     * Merges evidence into the record of an indicator, creating the record if it does not exist.
     *
     * @param update The evidence.
     * @return The merged record and whether it was created or materially changed.
     * @throws StorageUnavailableException If the backend fails.
     */
    public @NotNull UpsertOutcome upsert(@NotNull IndicatorUpdate update) throws StorageUnavailableException {
        final var now = _clock.instant();
        final var result = _backend.upsert(update.key(), current -> merge(current, update, now));
        final var previous = result.previous();
        final var record = result.record();

        final boolean changed = previous == null
                || previous.threatScore() != record.threatScore()
                || previous.classification() != record.classification();

        Logger.trace("[{}] Upserted (created: {}, changed: {}, score: {})", update.key(), previous == null, changed,
                record.threatScore());
        return new UpsertOutcome(record, previous == null, changed);
    }

    /**
     * Computes the merged record.
     *
     * @param existing The current record, or null if there is none.
     * @param update   The evidence to merge.
     * @param now      The merge time.
     * @return The new record.
     */
    static @NotNull Indicator merge(@Nullable Indicator existing, @NotNull IndicatorUpdate update, @NotNull Instant now) {
        final var key = update.key();
        if (existing == null) {
            return new Indicator(key.value(), key.kind(), update.score(), Classification.classify(update.score()),
                    new TreeSet<>(update.sources()), update.observations(), new TreeSet<>(update.tags()),
                    now, now, update.description());
        }

        final int score = Math.max(existing.threatScore(), update.score());

        final var sources = new TreeSet<>(existing.sources());
        sources.addAll(update.sources());
        final var tags = new TreeSet<>(existing.tags());
        tags.addAll(update.tags());
        final var observations = new ArrayList<>(existing.sourceObservations());
        observations.addAll(update.observations());

        final var lastSeen = now.isAfter(existing.lastSeen()) ? now : existing.lastSeen();
        final var description = update.description() != null ? update.description() : existing.description();

        return new Indicator(existing.value(), existing.kind(), score, Classification.classify(score), sources,
                observations, tags, existing.firstSeen(), lastSeen, description);
    }

    public @NotNull Optional<Indicator> get(@NotNull String value, @NotNull IndicatorKind kind)
            throws StorageUnavailableException {
        return _backend.findOne(new IndicatorKey(value, kind));
    }

    /**
     * Returns one page of the records matching a query.
     *
     * @param query    The predicate.
     * @param sort     The ordering.
     * @param page     The 1-based page number.
     * @param pageSize The page size.
     * @return The page; a page past the last one is empty but reports the correct totals.
     * @throws StorageUnavailableException If the backend fails.
     */
    public @NotNull Page queryPage(@NotNull IndicatorQuery query, @NotNull SortOrder sort, int page, int pageSize)
            throws StorageUnavailableException {
        if (page < 1)
            throw new IllegalArgumentException("Pages are numbered from 1, got " + page);
        if (pageSize < 1)
            throw new IllegalArgumentException("The page size must be positive, got " + pageSize);

        final long skip = (long) (page - 1) * pageSize;
        final var result = _backend.findMany(query, sort, (int) Math.min(skip, Integer.MAX_VALUE), pageSize);
        final int pages = (int) ((result.totalMatching() + pageSize - 1) / pageSize);
        return new Page(result.records(), result.totalMatching(), page, pageSize, pages);
    }

    /**
     * Counts the records first seen at or after a cut-off.
     *
     * @param cutoff         The cut-off.
     * @param classification If not null, only records of this classification are counted.
     * @return The count.
     * @throws StorageUnavailableException If the backend fails.
     */
    public long statsSince(@NotNull Instant cutoff, @Nullable Classification classification)
            throws StorageUnavailableException {
        var query = IndicatorQuery.all().withFirstSeenSince(cutoff);
        if (classification != null)
            query = query.withClassifications(classification);
        return _backend.countMatching(query);
    }

    /**
     * Adds tags to an existing record. Never creates a record.
     *
     * @param value The indicator value.
     * @param kind  The indicator kind.
     * @param tags  The tags to add.
     * @return The updated record, or an empty optional if the indicator is not known.
     * @throws StorageUnavailableException If the backend fails.
     */
    public @NotNull Optional<Indicator> addTags(@NotNull String value, @NotNull IndicatorKind kind,
                                                @NotNull Set<String> tags) throws StorageUnavailableException {
        var cleaned = new TreeSet<String>();
        for (var tag : tags) {
            if (tag != null && !tag.isBlank())
                cleaned.add(tag.trim());
        }
        return _backend.update(new IndicatorKey(value, kind), current -> current.withTags(cleaned));
    }

    /**
     * Computes an overview of the stored indicators. A backend failure yields the empty summary.
     *
     * @param topN The maximum number of high or critical records to include.
     * @return The summary.
     */
    public @NotNull ThreatSummary threatSummary(int topN) {
        try {
            final var byClassification = new EnumMap<Classification, Long>(Classification.class);
            for (var group : _backend.aggregate(GroupSpec.of(IndicatorQuery.all(), GroupSpec.Field.CLASSIFICATION))) {
                if (group.classification() != null)
                    byClassification.put(group.classification(), group.count());
            }

            final var recent = _backend.countMatching(
                    IndicatorQuery.all().withFirstSeenSince(_clock.instant().minus(DAY)));
            final var top = _backend.findMany(
                    IndicatorQuery.all().withClassifications(Classification.CRITICAL, Classification.HIGH),
                    SortOrder.THREAT_SCORE_DESC, 0, Math.max(topN, 0));
            final var total = _backend.countMatching(IndicatorQuery.all());

            return new ThreatSummary(byClassification, recent, top.records(), total);
        } catch (StorageUnavailableException e) {
            Logger.warn("Cannot compute the threat summary: {}", e.getMessage());
            return ThreatSummary.empty();
        }
    }

    /**
     * Computes per-day, per-classification counts of the records first seen in the last {@code days} days.
     *
     * @param days The length of the window in days.
     * @return The points ordered by day and classification.
     * @throws StorageUnavailableException If the backend fails.
     */
    public @NotNull List<TrendPoint> trends(int days) throws StorageUnavailableException {
        if (days < 1)
            throw new IllegalArgumentException("The trend window must be at least one day, got " + days);

        final var cutoff = _clock.instant().minus(Duration.ofDays(days));
        final var groups = _backend.aggregate(GroupSpec.of(IndicatorQuery.all().withFirstSeenSince(cutoff),
                GroupSpec.Field.FIRST_SEEN_DAY, GroupSpec.Field.CLASSIFICATION));

        return groups.stream()
                .filter(g -> g.day() != null && g.classification() != null)
                .map(g -> new TrendPoint(g.day(), g.classification(), g.count()))
                .sorted(Comparator.comparing(TrendPoint::day).thenComparing(TrendPoint::classification))
                .toList();
    }

    /**
     * Returns the source observations of an indicator, newest first.
     *
     * @param value The indicator value.
     * @param kind  The indicator kind.
     * @return The observations, or an empty optional if the indicator is not known.
     * @throws StorageUnavailableException If the backend fails.
     */
    public @NotNull Optional<List<SourceObservation>> timeline(@NotNull String value, @NotNull IndicatorKind kind)
            throws StorageUnavailableException {
        return get(value, kind).map(record -> {
            List<SourceObservation> observations = new ArrayList<>(record.sourceObservations());
            observations.sort(Comparator.comparing(SourceObservation::observedAt).reversed());
            return observations;
        });
    }

    /**
     * Computes the rolling statistics at the current time.
     *
     * @return The snapshot.
     * @throws StorageUnavailableException If the backend fails.
     */
    public @NotNull RollingStats rollingStats() throws StorageUnavailableException {
        final var now = _clock.instant();
        final var hourAgo = now.minus(HOUR);

        final var lastHourByClassification = new EnumMap<Classification, Long>(Classification.class);
        for (var group : _backend.aggregate(GroupSpec.of(IndicatorQuery.all().withFirstSeenSince(hourAgo),
                GroupSpec.Field.CLASSIFICATION))) {
            if (group.classification() != null)
                lastHourByClassification.put(group.classification(), group.count());
        }

        final long lastHour = lastHourByClassification.values().stream().mapToLong(Long::longValue).sum();
        final long last24h = statsSince(now.minus(DAY), null);
        final long total = _backend.countMatching(IndicatorQuery.all());
        final var level = ThreatLevel.derive(
                lastHourByClassification.getOrDefault(Classification.CRITICAL, 0L),
                lastHourByClassification.getOrDefault(Classification.HIGH, 0L));

        return new RollingStats(now, lastHour, last24h, Map.copyOf(lastHourByClassification), level, total);
    }

    public Clock getClock() {
        return _clock;
    }
}
