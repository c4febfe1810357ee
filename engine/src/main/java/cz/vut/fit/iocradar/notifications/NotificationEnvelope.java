package cz.vut.fit.iocradar.notifications;

import java.time.Instant;

/**
 * The message published to subscribers.
 *
 * @param event     The event type.
 * @param timestamp The publication time.
 * @param data      The payload.
 */
public record NotificationEnvelope(EventType event, Instant timestamp, Object data) {
}
