package cz.vut.fit.iocradar;

/**
 * The configuration keys, descriptions and default values for the aggregation engine, the feed monitor,
 * the reputation sources and the notification sinks.
 */
@SuppressWarnings("ALL")
public class AggregatorConfig {
    /* --- Aggregation engine --- */
    public static final String FRESHNESS_WINDOW_SEC_CONFIG = "aggregator.freshness.window";
    public static final String FRESHNESS_WINDOW_SEC_DOC = "The maximum age of a stored indicator before a lookup re-queries the sources (seconds).";
    public static final String FRESHNESS_WINDOW_SEC_DEFAULT = "3600";

    public static final String SOURCE_TIMEOUT_SEC_CONFIG = "aggregator.source.timeout";
    public static final String SOURCE_TIMEOUT_SEC_DOC = "The upper bound on a single source lookup; a source that does not answer in time is treated as having no data (seconds).";
    public static final String SOURCE_TIMEOUT_SEC_DEFAULT = "10";

    /* --- Feed monitor --- */
    public static final String MONITOR_INTERVAL_SEC_CONFIG = "monitor.interval";
    public static final String MONITOR_INTERVAL_SEC_DOC = "The interval between two feed monitor cycles (seconds).";
    public static final String MONITOR_INTERVAL_SEC_DEFAULT = "10";

    public static final String MONITOR_BACKOFF_SEC_CONFIG = "monitor.backoff.interval";
    public static final String MONITOR_BACKOFF_SEC_DOC = "The interval used after a cycle that encountered an error (seconds).";
    public static final String MONITOR_BACKOFF_SEC_DEFAULT = "30";

    public static final String MONITOR_FEED_SEED_CONFIG = "monitor.feed.seed";
    public static final String MONITOR_FEED_SEED_DOC = "The random seed of the synthetic observation feed. If empty, a random seed is used.";
    public static final String MONITOR_FEED_SEED_DEFAULT = "";

    /* --- Store --- */
    public static final String STORE_BACKEND_CONFIG = "store.backend";
    public static final String STORE_BACKEND_DOC = "The persistence backend. One of memory / postgres.";
    public static final String STORE_BACKEND_DEFAULT = "memory";

    public static final String POSTGRES_URL_CONFIG = "store.postgres.url";
    public static final String POSTGRES_URL_DOC = "The JDBC connection string of the PostgreSQL database.";
    public static final String POSTGRES_URL_DEFAULT = "";

    public static final String POSTGRES_USER_CONFIG = "store.postgres.user";
    public static final String POSTGRES_USER_DOC = "The PostgreSQL user name.";
    public static final String POSTGRES_USER_DEFAULT = "";

    public static final String POSTGRES_PASSWORD_CONFIG = "store.postgres.password";
    public static final String POSTGRES_PASSWORD_DOC = "The PostgreSQL password.";
    public static final String POSTGRES_PASSWORD_DEFAULT = "";

    /* --- VirusTotal source --- */
    public static final String VIRUSTOTAL_HTTP_TIMEOUT_CONFIG = "sources.virustotal.timeout";
    public static final String VIRUSTOTAL_HTTP_TIMEOUT_DOC = "The request timeout to use in the VirusTotal source (seconds).";
    public static final String VIRUSTOTAL_HTTP_TIMEOUT_DEFAULT = "10";

    public static final String VIRUSTOTAL_TOKEN_CONFIG = "sources.virustotal.token";
    public static final String VIRUSTOTAL_TOKEN_DOC = "The VirusTotal access token. The source is disabled if empty.";
    public static final String VIRUSTOTAL_TOKEN_DEFAULT = "";

    /* --- AbuseIPDB source --- */
    public static final String ABUSEIPDB_HTTP_TIMEOUT_CONFIG = "sources.abuseipdb.timeout";
    public static final String ABUSEIPDB_HTTP_TIMEOUT_DOC = "The request timeout to use in the AbuseIPDB source (seconds).";
    public static final String ABUSEIPDB_HTTP_TIMEOUT_DEFAULT = "10";

    public static final String ABUSEIPDB_TOKEN_CONFIG = "sources.abuseipdb.token";
    public static final String ABUSEIPDB_TOKEN_DOC = "The AbuseIPDB access token. The source is disabled if empty.";
    public static final String ABUSEIPDB_TOKEN_DEFAULT = "";

    public static final String ABUSEIPDB_MAX_AGE_DAYS_CONFIG = "sources.abuseipdb.max.age";
    public static final String ABUSEIPDB_MAX_AGE_DAYS_DOC = "Only reports newer than this are considered by AbuseIPDB (days).";
    public static final String ABUSEIPDB_MAX_AGE_DAYS_DEFAULT = "90";

    /* --- Notifications --- */
    public static final String KAFKA_NOTIFICATIONS_ENABLED_CONFIG = "notifications.kafka.enabled";
    public static final String KAFKA_NOTIFICATIONS_ENABLED_DOC = "If true, monitor updates are published to Kafka; otherwise they are only logged.";
    public static final String KAFKA_NOTIFICATIONS_ENABLED_DEFAULT = "false";

    public static final String KAFKA_CLOSE_TIMEOUT_SEC_CONFIG = "notifications.kafka.close.timeout";
    public static final String KAFKA_CLOSE_TIMEOUT_SEC_DOC = "The time to wait for the notification producer to close (seconds).";
    public static final String KAFKA_CLOSE_TIMEOUT_SEC_DEFAULT = "5";

    public static final String KAFKA_QUEUE_CAPACITY_CONFIG = "notifications.kafka.queue.capacity";
    public static final String KAFKA_QUEUE_CAPACITY_DOC = "The maximum number of events waiting to be sent to Kafka. Events published while the queue is full are dropped.";
    public static final String KAFKA_QUEUE_CAPACITY_DEFAULT = "1000";

    public static final String KAFKA_MAX_BLOCK_MS_DEFAULT = "500";
}
