package cz.vut.fit.iocradar.monitor;

import cz.vut.fit.iocradar.models.RollingStats;

/**
 * The statistics snapshot held by the {@link StatsCache} together with its staleness.
 */
public record CachedStats(RollingStats snapshot, boolean stale) {
}
