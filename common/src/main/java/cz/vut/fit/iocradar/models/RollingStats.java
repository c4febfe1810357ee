package cz.vut.fit.iocradar.models;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * A snapshot of the rolling indicator statistics.
 *
 * @param computedAt                The time the snapshot was computed.
 * @param threatsLastHour           The number of indicators first seen in the last hour.
 * @param threatsLast24h            The number of indicators first seen in the last 24 hours.
 * @param lastHourByClassification  Per-classification counts of indicators first seen in the last hour.
 * @param threatLevel               The derived overall threat level.
 * @param totalIndicators           The total number of canonical records.
 */
public record RollingStats(
        @NotNull Instant computedAt,
        long threatsLastHour,
        long threatsLast24h,
        @NotNull Map<Classification, Long> lastHourByClassification,
        @NotNull ThreatLevel threatLevel,
        long totalIndicators
) {
    public RollingStats {
        var copy = new EnumMap<Classification, Long>(Classification.class);
        for (var classification : Classification.values()) {
            copy.put(classification, 0L);
        }
        if (lastHourByClassification != null)
            copy.putAll(lastHourByClassification);
        lastHourByClassification = Map.copyOf(copy);
    }

    /**
     * Returns the zeroed snapshot used before the first computation and as a fallback.
     *
     * @param at The timestamp to assign.
     * @return The zeroed snapshot.
     */
    public static RollingStats empty(Instant at) {
        return new RollingStats(at, 0, 0, Map.of(), ThreatLevel.LOW, 0);
    }

    public long lastHour(Classification classification) {
        return lastHourByClassification.getOrDefault(classification, 0L);
    }
}
