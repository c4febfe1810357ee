package cz.vut.fit.iocradar.monitor;

import cz.vut.fit.iocradar.models.RollingStats;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the last computed statistics snapshot. The snapshot is replaced as a whole; readers never block.
 * A snapshot older than twice the monitor cadence is reported as stale.
 */
public class StatsCache {
    private final AtomicReference<RollingStats> _snapshot = new AtomicReference<>();
    private final Duration _staleAfter;
    private final Clock _clock;

    public StatsCache(@NotNull Duration cadence, @NotNull Clock clock) {
        _staleAfter = cadence.multipliedBy(2);
        _clock = clock;
    }

    public void put(@NotNull RollingStats snapshot) {
        _snapshot.set(snapshot);
    }

    /**
     * Returns the current snapshot. Before the first computation, the zeroed snapshot is returned as stale.
     *
     * @return The snapshot and whether it is stale.
     */
    public @NotNull CachedStats get() {
        final var now = _clock.instant();
        final var snapshot = _snapshot.get();
        if (snapshot == null)
            return new CachedStats(RollingStats.empty(now), true);

        final var age = Duration.between(snapshot.computedAt(), now);
        return new CachedStats(snapshot, age.compareTo(_staleAfter) > 0);
    }

    /**
     * Returns the last computed snapshot, if any.
     */
    public @NotNull Optional<RollingStats> last() {
        return Optional.ofNullable(_snapshot.get());
    }
}
