package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKey;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A backend that keeps the records in a concurrent map. Read-modify-write of a key holds a monitor owned by
 * that key only; the merge function never runs under a lock of the map, so keys sharing a hash bin do not
 * wait for each other. Reads take no lock.
 */
public class InMemoryIndicatorBackend implements IndicatorBackend {
    private final ConcurrentHashMap<IndicatorKey, Indicator> _records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<IndicatorKey, Object> _keyLocks = new ConcurrentHashMap<>();

    @Override
    public @NotNull UpsertResult upsert(@NotNull IndicatorKey key, @NotNull Function<Indicator, Indicator> mergeFn) {
        synchronized (lockFor(key)) {
            final var current = _records.get(key);
            final var stored = Objects.requireNonNull(mergeFn.apply(current), "The merge function returned null");
            _records.put(key, stored);
            return new UpsertResult(current, stored);
        }
    }

    @Override
    public @NotNull Optional<Indicator> update(@NotNull IndicatorKey key, @NotNull UnaryOperator<Indicator> fn) {
        synchronized (lockFor(key)) {
            final var current = _records.get(key);
            if (current == null)
                return Optional.empty();

            final var stored = Objects.requireNonNull(fn.apply(current), "The update function returned null");
            _records.put(key, stored);
            return Optional.of(stored);
        }
    }

    private Object lockFor(IndicatorKey key) {
        return _keyLocks.computeIfAbsent(key, k -> new Object());
    }

    @Override
    public @NotNull Optional<Indicator> findOne(@NotNull IndicatorKey key) {
        return Optional.ofNullable(_records.get(key));
    }

    @Override
    public @NotNull FindResult findMany(@NotNull IndicatorQuery query, @NotNull SortOrder sort, int skip, int limit) {
        var matching = _records.values().stream()
                .filter(query::matches)
                .sorted(sort.comparator())
                .toList();

        var from = Math.min(Math.max(skip, 0), matching.size());
        var to = Math.min(from + Math.max(limit, 0), matching.size());
        return new FindResult(matching.subList(from, to), matching.size());
    }

    @Override
    public long countMatching(@NotNull IndicatorQuery query) {
        return _records.values().stream().filter(query::matches).count();
    }

    @Override
    public @NotNull List<GroupCount> aggregate(@NotNull GroupSpec groupSpec) {
        final var byClassification = groupSpec.groupsBy(GroupSpec.Field.CLASSIFICATION);
        final var byDay = groupSpec.groupsBy(GroupSpec.Field.FIRST_SEEN_DAY);

        final Map<GroupCount, Long> counts = new HashMap<>();
        for (var record : _records.values()) {
            if (!groupSpec.filter().matches(record))
                continue;

            var groupKey = new GroupCount(
                    byClassification ? record.classification() : null,
                    byDay ? LocalDate.ofInstant(record.firstSeen(), ZoneOffset.UTC) : null,
                    0);
            counts.merge(groupKey, 1L, Long::sum);
        }

        var result = new ArrayList<GroupCount>(counts.size());
        counts.forEach((group, count) -> result.add(new GroupCount(group.classification(), group.day(), count)));
        result.sort(Comparator.comparing(GroupCount::day, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(GroupCount::classification, Comparator.nullsFirst(Comparator.naturalOrder())));
        return result;
    }

    /**
     * Returns the number of stored records.
     */
    public int size() {
        return _records.size();
    }
}
