package cz.vut.fit.iocradar.notifications;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The kinds of events published by the feed monitor.
 */
public enum EventType {
    /** A new observation has been recorded; the payload is the merged indicator record. */
    NEW_OBSERVATION("new-observation", Topics.OUT_NEW_OBSERVATION),
    /** The rolling statistics have been recomputed; the payload is the snapshot. */
    STATS_UPDATE("stats-update", Topics.OUT_STATS_UPDATE);

    private final String _id;
    private final String _topic;

    EventType(String id, String topic) {
        _id = id;
        _topic = topic;
    }

    @JsonValue
    public String id() {
        return _id;
    }

    public String topic() {
        return _topic;
    }

    @Override
    public String toString() {
        return _id;
    }
}
