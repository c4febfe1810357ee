package cz.vut.fit.iocradar.notifications;

/**
 * The Kafka topic names.
 */
public final class Topics {
    public static final String OUT_NEW_OBSERVATION = "iocradar_new_observation";
    public static final String OUT_STATS_UPDATE = "iocradar_stats_update";

    private Topics() {
    }
}
