package cz.vut.fit.iocradar.models;

import cz.vut.fit.iocradar.models.scores.RawScore;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * One source's report about one indicator at one point in time, before normalization.
 *
 * @param value       The raw indicator value.
 * @param kind        The indicator kind.
 * @param source      The reporting source identifier.
 * @param rawScore    The score in the source's own representation.
 * @param details     Source-specific details.
 * @param tags        Tags the source assigns to the indicator.
 * @param description An optional description.
 */
public record Observation(
        String value,
        IndicatorKind kind,
        String source,
        RawScore rawScore,
        Map<String, Object> details,
        Set<String> tags,
        @Nullable String description
) {
    public Observation {
        details = details == null ? Map.of() : Map.copyOf(details);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public Observation(String value, IndicatorKind kind, String source, RawScore rawScore) {
        this(value, kind, source, rawScore, Map.of(), Set.of(), null);
    }
}
