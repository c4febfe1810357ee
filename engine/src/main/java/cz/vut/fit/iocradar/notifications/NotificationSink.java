package cz.vut.fit.iocradar.notifications;

import org.jetbrains.annotations.NotNull;

/**
 * A subscriber of monitor events. Publishing is best-effort: implementations must not block the caller for
 * long and must not throw on delivery failures.
 */
public interface NotificationSink extends AutoCloseable {
    void publish(@NotNull EventType event, @NotNull Object payload);

    @Override
    default void close() {
    }
}
