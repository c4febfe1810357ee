package cz.vut.fit.iocradar.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import cz.vut.fit.iocradar.AggregatorConfig;
import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.StorageUnavailableException;
import cz.vut.fit.iocradar.models.Classification;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A backend that stores the records in a PostgreSQL table. The whole record is kept as a JSONB document;
 * the columns used for filtering, sorting and grouping are duplicated next to it.
 * <p>
 * Each operation uses its own connection. Read-modify-write runs in a transaction that locks the row with
 * {@code SELECT ... FOR UPDATE}; a concurrent first insert of the same key is detected through
 * {@code ON CONFLICT DO NOTHING} and the operation is retried.
 */
@SuppressWarnings("SqlNoDataSourceInspection")
public class PostgresIndicatorBackend implements IndicatorBackend {
    public static final String COMPONENT_NAME = "store-postgres";
    private static final Logger Logger = Common.getComponentLogger(PostgresIndicatorBackend.class);

    static final String TABLE = "ioc_indicator";
    private static final int MAX_UPSERT_ATTEMPTS = 3;

    private static final String SELECT_FOR_UPDATE =
            "SELECT doc FROM " + TABLE + " WHERE value = ? AND kind = ? FOR UPDATE";
    private static final String SELECT_ONE =
            "SELECT doc FROM " + TABLE + " WHERE value = ? AND kind = ?";
    private static final String INSERT =
            "INSERT INTO " + TABLE + "(value, kind, threat_score, classification, tags, description," +
                    " first_seen, last_seen, doc) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)" +
                    " ON CONFLICT (value, kind) DO NOTHING";
    private static final String UPDATE =
            "UPDATE " + TABLE + " SET threat_score = ?, classification = ?, tags = ?, description = ?," +
                    " first_seen = ?, last_seen = ?, doc = ?::jsonb WHERE value = ? AND kind = ?";

    private final String _dbUrl;
    private final String _dbUser;
    private final String _dbPassword;
    private final ObjectMapper _mapper;

    public PostgresIndicatorBackend(String dbUrl, String dbUser, String dbPassword) {
        _dbUrl = dbUrl;
        _dbUser = dbUser;
        _dbPassword = dbPassword;
        _mapper = Common.makeMapper().build();
    }

    public static PostgresIndicatorBackend fromProperties(Properties properties) {
        var url = properties.getProperty(AggregatorConfig.POSTGRES_URL_CONFIG, AggregatorConfig.POSTGRES_URL_DEFAULT);
        if (url.isBlank())
            throw new IllegalArgumentException("The PostgreSQL backend requires " + AggregatorConfig.POSTGRES_URL_CONFIG);

        return new PostgresIndicatorBackend(url,
                properties.getProperty(AggregatorConfig.POSTGRES_USER_CONFIG, AggregatorConfig.POSTGRES_USER_DEFAULT),
                properties.getProperty(AggregatorConfig.POSTGRES_PASSWORD_CONFIG,
                        AggregatorConfig.POSTGRES_PASSWORD_DEFAULT));
    }

    protected Connection openConnection() throws SQLException {
        return DriverManager.getConnection(_dbUrl, _dbUser, _dbPassword);
    }

    /**
     * Creates the table and its indexes if they do not exist.
     *
     * @throws StorageUnavailableException If the database cannot be reached.
     */
    public void ensureSchema() throws StorageUnavailableException {
        try (var connection = openConnection(); var statement = connection.createStatement()) {
            Logger.debug("Ensuring the schema exists");
            statement.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " (" +
                    "value TEXT NOT NULL, " +
                    "kind TEXT NOT NULL, " +
                    "threat_score INTEGER NOT NULL, " +
                    "classification TEXT NOT NULL, " +
                    "tags TEXT[] NOT NULL DEFAULT '{}', " +
                    "description TEXT, " +
                    "first_seen TIMESTAMPTZ NOT NULL, " +
                    "last_seen TIMESTAMPTZ NOT NULL, " +
                    "doc JSONB NOT NULL, " +
                    "PRIMARY KEY (value, kind))");
            statement.execute("CREATE INDEX IF NOT EXISTS " + TABLE + "_first_seen_idx ON " + TABLE + " (first_seen)");
            statement.execute("CREATE INDEX IF NOT EXISTS " + TABLE + "_tags_idx ON " + TABLE + " USING GIN (tags)");
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to create the schema", e);
        }
    }

    @Override
    public @NotNull UpsertResult upsert(@NotNull IndicatorKey key, @NotNull Function<Indicator, Indicator> mergeFn)
            throws StorageUnavailableException {
        for (int attempt = 1; attempt <= MAX_UPSERT_ATTEMPTS; attempt++) {
            try (var connection = openConnection()) {
                connection.setAutoCommit(false);
                try {
                    var current = selectForUpdate(connection, key);
                    var next = mergeFn.apply(current);
                    if (current == null) {
                        if (insert(connection, next) == 0) {
                            Logger.debug("[{}] Concurrent insert, retrying (attempt {})", key, attempt);
                            connection.rollback();
                            continue;
                        }
                    } else {
                        update(connection, next);
                    }
                    connection.commit();
                    return new UpsertResult(current, next);
                } catch (SQLException | RuntimeException e) {
                    rollback(connection);
                    throw e;
                }
            } catch (SQLException e) {
                throw new StorageUnavailableException("Failed to upsert " + key, e);
            }
        }
        throw new StorageUnavailableException("Failed to upsert " + key + " after " + MAX_UPSERT_ATTEMPTS
                + " attempts");
    }

    @Override
    public @NotNull Optional<Indicator> update(@NotNull IndicatorKey key, @NotNull UnaryOperator<Indicator> fn)
            throws StorageUnavailableException {
        try (var connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                var current = selectForUpdate(connection, key);
                if (current == null) {
                    connection.rollback();
                    return Optional.empty();
                }
                var next = fn.apply(current);
                update(connection, next);
                connection.commit();
                return Optional.of(next);
            } catch (SQLException | RuntimeException e) {
                rollback(connection);
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to update " + key, e);
        }
    }

    @Override
    public @NotNull Optional<Indicator> findOne(@NotNull IndicatorKey key) throws StorageUnavailableException {
        try (var connection = openConnection(); var statement = connection.prepareStatement(SELECT_ONE)) {
            statement.setString(1, key.value());
            statement.setString(2, key.kind().id());
            try (var rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(readDocument(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to read " + key, e);
        }
    }

    @Override
    public @NotNull FindResult findMany(@NotNull IndicatorQuery query, @NotNull SortOrder sort, int skip, int limit)
            throws StorageUnavailableException {
        final var params = new ArrayList<>();
        final var where = whereClause(query, params);

        try (var connection = openConnection()) {
            long total;
            try (var statement = connection.prepareStatement("SELECT COUNT(*) FROM " + TABLE + where)) {
                bind(statement, params, 1);
                try (var rs = statement.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                }
            }

            var records = new ArrayList<Indicator>();
            var sql = "SELECT doc FROM " + TABLE + where + " ORDER BY " + sort.orderByClause() + " LIMIT ? OFFSET ?";
            try (var statement = connection.prepareStatement(sql)) {
                var next = bind(statement, params, 1);
                statement.setInt(next, Math.max(limit, 0));
                statement.setInt(next + 1, Math.max(skip, 0));
                try (var rs = statement.executeQuery()) {
                    while (rs.next()) {
                        records.add(readDocument(rs));
                    }
                }
            }
            return new FindResult(records, total);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to query indicators", e);
        }
    }

    @Override
    public long countMatching(@NotNull IndicatorQuery query) throws StorageUnavailableException {
        final var params = new ArrayList<>();
        final var sql = "SELECT COUNT(*) FROM " + TABLE + whereClause(query, params);

        try (var connection = openConnection(); var statement = connection.prepareStatement(sql)) {
            bind(statement, params, 1);
            try (var rs = statement.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to count indicators", e);
        }
    }

    @Override
    public @NotNull List<GroupCount> aggregate(@NotNull GroupSpec groupSpec) throws StorageUnavailableException {
        final var params = new ArrayList<>();
        final var sql = aggregateQuery(groupSpec, params);
        final var byClassification = groupSpec.groupsBy(GroupSpec.Field.CLASSIFICATION);
        final var byDay = groupSpec.groupsBy(GroupSpec.Field.FIRST_SEEN_DAY);

        try (var connection = openConnection(); var statement = connection.prepareStatement(sql)) {
            bind(statement, params, 1);
            var result = new ArrayList<GroupCount>();
            try (var rs = statement.executeQuery()) {
                while (rs.next()) {
                    result.add(new GroupCount(
                            byClassification ? Classification.fromId(rs.getString("classification")) : null,
                            byDay ? rs.getObject("day", LocalDate.class) : null,
                            rs.getLong("cnt")));
                }
            }
            return result;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to aggregate indicators", e);
        }
    }

    /**
     * Builds the WHERE clause of a query and collects its parameters.
     *
     * @param query  The query.
     * @param params The list the positional parameters are appended to.
     * @return The clause including the leading space, or an empty string if the query matches everything.
     */
    static String whereClause(IndicatorQuery query, List<Object> params) {
        var conditions = new ArrayList<String>();

        if (query.search() != null) {
            var pattern = "%" + escapeLike(query.search()) + "%";
            conditions.add("(value ILIKE ? ESCAPE '\\' OR description ILIKE ? ESCAPE '\\')");
            params.add(pattern);
            params.add(pattern);
        }
        if (query.tag() != null) {
            conditions.add("? = ANY(tags)");
            params.add(query.tag());
        }
        if (query.kind() != null) {
            conditions.add("kind = ?");
            params.add(query.kind().id());
        }
        if (query.classifications() != null) {
            var placeholders = new ArrayList<String>();
            query.classifications().stream().sorted().forEach(c -> {
                placeholders.add("?");
                params.add(c.id());
            });
            conditions.add("classification IN (" + String.join(", ", placeholders) + ")");
        }
        if (query.firstSeenSince() != null) {
            conditions.add("first_seen >= ?");
            params.add(toTimestamp(query.firstSeenSince()));
        }

        return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
    }

    static String aggregateQuery(GroupSpec groupSpec, List<Object> params) {
        var columns = new ArrayList<String>();
        if (groupSpec.groupsBy(GroupSpec.Field.CLASSIFICATION))
            columns.add("classification");
        if (groupSpec.groupsBy(GroupSpec.Field.FIRST_SEEN_DAY))
            columns.add("(first_seen AT TIME ZONE 'UTC')::date AS day");

        var where = whereClause(groupSpec.filter(), params);
        if (columns.isEmpty())
            return "SELECT COUNT(*) AS cnt FROM " + TABLE + where;

        var groupBy = new ArrayList<String>();
        for (int i = 1; i <= columns.size(); i++) {
            groupBy.add(Integer.toString(i));
        }
        return "SELECT " + String.join(", ", columns) + ", COUNT(*) AS cnt FROM " + TABLE + where
                + " GROUP BY " + String.join(", ", groupBy) + " ORDER BY " + String.join(", ", groupBy);
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static int bind(PreparedStatement statement, List<Object> params, int firstIndex) throws SQLException {
        int index = firstIndex;
        for (var param : params) {
            statement.setObject(index++, param);
        }
        return index;
    }

    private static OffsetDateTime toTimestamp(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private @Nullable Indicator selectForUpdate(Connection connection, IndicatorKey key) throws SQLException {
        try (var statement = connection.prepareStatement(SELECT_FOR_UPDATE)) {
            statement.setString(1, key.value());
            statement.setString(2, key.kind().id());
            try (var rs = statement.executeQuery()) {
                return rs.next() ? readDocument(rs) : null;
            }
        }
    }

    private int insert(Connection connection, Indicator record) throws SQLException {
        try (var statement = connection.prepareStatement(INSERT)) {
            statement.setString(1, record.value());
            statement.setString(2, record.kind().id());
            statement.setInt(3, record.threatScore());
            statement.setString(4, record.classification().id());
            statement.setArray(5, connection.createArrayOf("text", record.tags().toArray()));
            statement.setString(6, record.description());
            statement.setObject(7, toTimestamp(record.firstSeen()));
            statement.setObject(8, toTimestamp(record.lastSeen()));
            statement.setString(9, writeDocument(record));
            return statement.executeUpdate();
        }
    }

    private void update(Connection connection, Indicator record) throws SQLException {
        try (var statement = connection.prepareStatement(UPDATE)) {
            statement.setInt(1, record.threatScore());
            statement.setString(2, record.classification().id());
            statement.setArray(3, connection.createArrayOf("text", record.tags().toArray()));
            statement.setString(4, record.description());
            statement.setObject(5, toTimestamp(record.firstSeen()));
            statement.setObject(6, toTimestamp(record.lastSeen()));
            statement.setString(7, writeDocument(record));
            statement.setString(8, record.value());
            statement.setString(9, record.kind().id());
            statement.executeUpdate();
        }
    }

    private Indicator readDocument(ResultSet rs) throws SQLException {
        try {
            return _mapper.readValue(rs.getString("doc"), Indicator.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot decode the stored document", e);
        }
    }

    private String writeDocument(Indicator record) throws SQLException {
        try {
            return _mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new SQLException("Cannot encode the record", e);
        }
    }

    private void rollback(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException ex) {
            Logger.error("Rollback failed", ex);
        }
    }
}
