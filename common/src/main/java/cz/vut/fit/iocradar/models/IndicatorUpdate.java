package cz.vut.fit.iocradar.models;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Normalized evidence about one indicator, ready to be merged into its canonical record.
 *
 * @param key          The indicator key.
 * @param score        The normalized score carried by this evidence.
 * @param sources      The sources that contributed the evidence.
 * @param observations The per-source snapshots to append.
 * @param tags         The tags to add.
 * @param description  A description to set, or null to keep the current one.
 */
public record IndicatorUpdate(
        @NotNull IndicatorKey key,
        int score,
        @NotNull Set<String> sources,
        @NotNull List<SourceObservation> observations,
        @NotNull Set<String> tags,
        @Nullable String description
) {
    public IndicatorUpdate {
        sources = Set.copyOf(sources);
        observations = List.copyOf(observations);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
