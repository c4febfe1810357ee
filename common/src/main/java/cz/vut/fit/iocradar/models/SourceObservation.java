package cz.vut.fit.iocradar.models;

import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.Map;

/**
 * A snapshot of one source's report about an indicator, as appended to the canonical record.
 *
 * @param source         The source identifier.
 * @param score          The normalized score reported by the source.
 * @param classification The classification of {@code score}.
 * @param observedAt     The time the observation was recorded.
 * @param details        Source-specific details (country, ASN, detection counts, ...).
 */
public record SourceObservation(
        @NotNull String source,
        int score,
        @NotNull Classification classification,
        @NotNull Instant observedAt,
        @NotNull Map<String, Object> details
) {
    public SourceObservation {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
