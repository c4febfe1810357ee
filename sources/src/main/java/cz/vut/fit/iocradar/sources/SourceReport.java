package cz.vut.fit.iocradar.sources;

import cz.vut.fit.iocradar.models.scores.RawScore;
import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * The answer of a reputation source about one indicator.
 *
 * @param source   The source identifier.
 * @param rawScore The score in the source's own representation.
 * @param details  Source-specific details.
 */
public record SourceReport(@NotNull String source, @NotNull RawScore rawScore, @NotNull Map<String, Object> details) {
    public SourceReport {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
