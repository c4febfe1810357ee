package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Classification;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;

/**
 * One group of a {@link GroupSpec} aggregation. The components the group is not keyed by are null.
 */
public record GroupCount(@Nullable Classification classification, @Nullable LocalDate day, long count) {
}
