package cz.vut.fit.iocradar.sources;

import cz.vut.fit.iocradar.models.IndicatorKind;
import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A uniform interface implemented by every reputation source, real or synthetic.
 * <p>
 * Implementations must not fail on transient errors (network failures, rate limiting, unexpected responses).
 * In such cases, the returned future completes with an empty result, meaning "no data".
 */
public interface SourceLookup extends Closeable {
    /**
     * Returns the source identifier.
     *
     * @return The identifier, used in {@link SourceReport#source()} and in the indicator's source set.
     */
    @NotNull String getName();

    /**
     * Checks whether the source can be asked about indicators of a given kind.
     *
     * @param kind The indicator kind.
     * @return True if the source supports the kind and is enabled.
     */
    boolean supports(@NotNull IndicatorKind kind);

    /**
     * Asks the source about an indicator.
     *
     * @param value The raw indicator value.
     * @param kind  The indicator kind.
     * @return A future completed with the report, or with an empty optional if the source has no data.
     */
    @NotNull CompletableFuture<Optional<SourceReport>> lookup(@NotNull String value, @NotNull IndicatorKind kind);

    @Override
    default void close() {
    }
}
