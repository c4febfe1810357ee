package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.models.Classification;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKind;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * A conjunctive predicate over canonical records. A null component does not constrain the result.
 *
 * @param search          A case-insensitive substring matched against the value and the description.
 * @param tag             A tag the record must have (exact match).
 * @param kind            The required indicator kind.
 * @param classifications The allowed classifications.
 * @param firstSeenSince  The earliest allowed {@code firstSeen} (inclusive).
 */
public record IndicatorQuery(
        @Nullable String search,
        @Nullable String tag,
        @Nullable IndicatorKind kind,
        @Nullable Set<Classification> classifications,
        @Nullable Instant firstSeenSince
) {
    private static final IndicatorQuery ALL = new IndicatorQuery(null, null, null, null, null);

    public IndicatorQuery {
        if (search != null && search.isBlank())
            search = null;
        if (tag != null && tag.isBlank())
            tag = null;
        if (classifications != null)
            classifications = classifications.isEmpty() ? null : Set.copyOf(classifications);
    }

    public static IndicatorQuery all() {
        return ALL;
    }

    public IndicatorQuery withSearch(@Nullable String search) {
        return new IndicatorQuery(search, tag, kind, classifications, firstSeenSince);
    }

    public IndicatorQuery withTag(@Nullable String tag) {
        return new IndicatorQuery(search, tag, kind, classifications, firstSeenSince);
    }

    public IndicatorQuery withKind(@Nullable IndicatorKind kind) {
        return new IndicatorQuery(search, tag, kind, classifications, firstSeenSince);
    }

    public IndicatorQuery withClassifications(@NotNull Classification first, Classification... rest) {
        return new IndicatorQuery(search, tag, kind, EnumSet.of(first, rest), firstSeenSince);
    }

    public IndicatorQuery withFirstSeenSince(@Nullable Instant cutoff) {
        return new IndicatorQuery(search, tag, kind, classifications, cutoff);
    }

    /**
     * Evaluates the predicate against a record.
     *
     * @param indicator The record.
     * @return True if the record satisfies every non-null component.
     */
    public boolean matches(@NotNull Indicator indicator) {
        if (kind != null && indicator.kind() != kind)
            return false;
        if (classifications != null && !classifications.contains(indicator.classification()))
            return false;
        if (firstSeenSince != null && indicator.firstSeen().isBefore(firstSeenSince))
            return false;
        if (tag != null && !indicator.hasTag(tag))
            return false;
        if (search != null) {
            var needle = search.toLowerCase(Locale.ROOT);
            var inValue = indicator.value().toLowerCase(Locale.ROOT).contains(needle);
            var inDescription = indicator.description() != null
                    && indicator.description().toLowerCase(Locale.ROOT).contains(needle);
            return inValue || inDescription;
        }
        return true;
    }
}
