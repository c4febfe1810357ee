package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Indicator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The result of a backend upsert.
 *
 * @param previous The record before the upsert, or null if it was created.
 * @param record   The stored record.
 */
public record UpsertResult(@Nullable Indicator previous, @NotNull Indicator record) {
    public boolean created() {
        return previous == null;
    }
}
