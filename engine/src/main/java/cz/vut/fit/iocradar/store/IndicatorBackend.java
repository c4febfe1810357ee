package cz.vut.fit.iocradar.store;

import cz.vut.fit.iocradar.StorageUnavailableException;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKey;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * The persistence backend of the indicator store. Implementations must provide atomic single-record
 * read-modify-write: two upserts of the same key are serialized, upserts of different keys do not block
 * each other.
 */
public interface IndicatorBackend extends AutoCloseable {
    /**
     * Atomically creates or replaces the record with a given key.
     *
     * @param key     The record key.
     * @param mergeFn Computes the new record from the current one (null if absent). Must be side-effect free,
     *                as it may be invoked more than once.
     * @return The previous and the stored record.
     * @throws StorageUnavailableException If the backend cannot be reached.
     */
    @NotNull UpsertResult upsert(@NotNull IndicatorKey key, @NotNull Function<Indicator, Indicator> mergeFn)
            throws StorageUnavailableException;

    /**
     * Atomically replaces an existing record. Never creates one.
     *
     * @param key The record key.
     * @param fn  Computes the new record from the current one.
     * @return The stored record, or an empty optional if there is no record with the key.
     * @throws StorageUnavailableException If the backend cannot be reached.
     */
    @NotNull Optional<Indicator> update(@NotNull IndicatorKey key, @NotNull UnaryOperator<Indicator> fn)
            throws StorageUnavailableException;

    @NotNull Optional<Indicator> findOne(@NotNull IndicatorKey key) throws StorageUnavailableException;

    /**
     * Finds the records matching a query.
     *
     * @param query The predicate.
     * @param sort  The ordering.
     * @param skip  The number of matching records to skip.
     * @param limit The maximum number of records to return.
     * @return The records and the total number of matches.
     * @throws StorageUnavailableException If the backend cannot be reached.
     */
    @NotNull FindResult findMany(@NotNull IndicatorQuery query, @NotNull SortOrder sort, int skip, int limit)
            throws StorageUnavailableException;

    long countMatching(@NotNull IndicatorQuery query) throws StorageUnavailableException;

    @NotNull List<GroupCount> aggregate(@NotNull GroupSpec groupSpec) throws StorageUnavailableException;

    @Override
    default void close() {
    }
}
