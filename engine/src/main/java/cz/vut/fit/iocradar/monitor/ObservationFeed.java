package cz.vut.fit.iocradar.monitor;

import cz.vut.fit.iocradar.models.Observation;

import java.util.List;

/**
 * A source of new observations polled by the {@link FeedMonitor} once per cycle.
 */
public interface ObservationFeed {
    /**
     * Returns the observations that appeared since the last poll.
     */
    List<Observation> poll();
}
