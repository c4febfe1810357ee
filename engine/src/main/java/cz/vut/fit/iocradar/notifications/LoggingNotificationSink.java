package cz.vut.fit.iocradar.notifications;

import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.RollingStats;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * A sink that writes the events to the log.
 */
public class LoggingNotificationSink implements NotificationSink {
    public static final String COMPONENT_NAME = "notifications-log";
    private static final Logger Logger = Common.getComponentLogger(LoggingNotificationSink.class);

    @Override
    public void publish(@NotNull EventType event, @NotNull Object payload) {
        if (payload instanceof Indicator indicator) {
            Logger.info("[{}] {} ({}), score {}, {}, sources {}", event, indicator.value(), indicator.kind(),
                    indicator.threatScore(), indicator.classification(), indicator.sources());
        } else if (payload instanceof RollingStats stats) {
            Logger.info("[{}] level {}, {} in the last hour, {} in 24 h, {} total", event, stats.threatLevel(),
                    stats.threatsLastHour(), stats.threatsLast24h(), stats.totalIndicators());
        } else {
            Logger.info("[{}] {}", event, payload);
        }
    }
}
