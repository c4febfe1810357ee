package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Indicator;
import org.jetbrains.annotations.NotNull;

/**
 * The result of merging evidence into the store.
 *
 * @param record  The merged record.
 * @param created True if the record did not exist before.
 * @param changed True if the record was created or its threat score or classification changed.
 */
public record UpsertOutcome(@NotNull Indicator record, boolean created, boolean changed) {
}
