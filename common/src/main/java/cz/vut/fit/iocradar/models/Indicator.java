package cz.vut.fit.iocradar.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The canonical, merged record of one indicator of compromise. Instances are immutable; a merge produces
 * a new instance.
 *
 * @param value              The raw indicator value.
 * @param kind               The indicator kind.
 * @param threatScore        The highest normalized score ever observed.
 * @param classification     Always {@code Classification.classify(threatScore)}.
 * @param sources            The identifiers of all sources that reported the indicator.
 * @param sourceObservations The per-source observations in the order they were recorded.
 * @param tags               User- and system-assigned tags.
 * @param firstSeen          The time the record was created.
 * @param lastSeen           The time of the last merge.
 * @param description        An informational description, may be null.
 */
public record Indicator(
        @NotNull String value,
        @NotNull IndicatorKind kind,
        int threatScore,
        @NotNull Classification classification,
        @NotNull SortedSet<String> sources,
        @NotNull List<SourceObservation> sourceObservations,
        @NotNull SortedSet<String> tags,
        @NotNull Instant firstSeen,
        @NotNull Instant lastSeen,
        @Nullable String description
) {
    public Indicator {
        sources = Collections.unmodifiableSortedSet(sources == null ? new TreeSet<>() : new TreeSet<>(sources));
        tags = Collections.unmodifiableSortedSet(tags == null ? new TreeSet<>() : new TreeSet<>(tags));
        sourceObservations = sourceObservations == null ? List.of() : List.copyOf(sourceObservations);
    }

    @JsonIgnore
    public IndicatorKey key() {
        return new IndicatorKey(value, kind);
    }

    /**
     * Checks whether the indicator has a given tag.
     *
     * @param tag The tag.
     * @return True if the tag is assigned.
     */
    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /**
     * Returns a copy of this record with additional tags.
     *
     * @param newTags The tags to add.
     * @return The new record.
     */
    public Indicator withTags(Set<String> newTags) {
        var union = new TreeSet<>(tags);
        union.addAll(newTags);
        return new Indicator(value, kind, threatScore, classification, sources, sourceObservations, union,
                firstSeen, lastSeen, description);
    }
}
