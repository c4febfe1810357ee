package cz.vut.fit.iocradar.monitor;

import cz.vut.fit.iocradar.models.RollingStats;
import cz.vut.fit.iocradar.store.UpsertOutcome;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The result of one feed monitor cycle.
 *
 * @param polled   The number of observations returned by the feed.
 * @param recorded The outcomes of the observations that were stored.
 * @param changed  The number of stored observations that created a record or changed its threat score or
 *                 classification.
 * @param failed   The number of observations that were rejected or could not be stored.
 * @param feedFailed True if the feed could not be polled.
 * @param stats    The recomputed statistics, or null if they could not be computed.
 */
public record CycleReport(int polled, List<UpsertOutcome> recorded, int changed, int failed, boolean feedFailed,
                          @Nullable RollingStats stats) {
    public CycleReport {
        recorded = List.copyOf(recorded);
    }

    public long created() {
        return recorded.stream().filter(UpsertOutcome::created).count();
    }

    /**
     * Checks whether any observation of the cycle is worth an alert.
     */
    public boolean anyChanged() {
        return changed > 0;
    }

    /**
     * Checks whether any step of the cycle failed.
     */
    public boolean hasErrors() {
        return failed > 0 || feedFailed || stats == null;
    }
}
