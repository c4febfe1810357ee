package cz.vut.fit.iocradar.notifications;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import cz.vut.fit.iocradar.AggregatorConfig;
import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.models.Indicator;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A sink that publishes the events to Kafka as JSON envelopes. New observations are keyed by the indicator
 * key, statistics updates have no key.
 * <p>
 * {@link #publish(EventType, Object)} only stamps the envelope and queues it. Serialization and
 * {@link Producer#send} run on a single dispatcher thread, so a slow or unreachable cluster delays the
 * notifications, not the caller. When the queue is full, the event is dropped and counted.
 */
public class KafkaNotificationSink implements NotificationSink {
    public static final String COMPONENT_NAME = "notifications-kafka";
    private static final Logger Logger = Common.getComponentLogger(KafkaNotificationSink.class);

    private final Producer<String, byte[]> _producer;
    private final ObjectMapper _mapper;
    private final Clock _clock;
    private final Duration _closeTimeout;
    private final ExecutorService _dispatcher;
    private final AtomicLong _dropped = new AtomicLong();

    public KafkaNotificationSink(Producer<String, byte[]> producer, ObjectMapper mapper, Clock clock,
                                 Duration closeTimeout, int queueCapacity) {
        this(producer, mapper, clock, closeTimeout, new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new ThreadFactoryBuilder().setNameFormat("kafka-notifications-%d").setDaemon(true).build()));
    }

    KafkaNotificationSink(Producer<String, byte[]> producer, ObjectMapper mapper, Clock clock,
                          Duration closeTimeout, ExecutorService dispatcher) {
        _producer = producer;
        _mapper = mapper;
        _clock = clock;
        _closeTimeout = closeTimeout;
        _dispatcher = dispatcher;
    }

    /**
     * Creates a sink with a new Kafka producer. Unless configured otherwise, the producer waits at most
     * {@value AggregatorConfig#KAFKA_MAX_BLOCK_MS_DEFAULT} ms for metadata; the wait holds up the dispatcher
     * thread only.
     *
     * @param properties The configuration, including the Kafka producer settings.
     * @param mapper     The JSON mapper.
     * @return The sink.
     */
    public static KafkaNotificationSink create(Properties properties, ObjectMapper mapper) {
        var producerProperties = new Properties();
        producerProperties.putAll(properties);
        producerProperties.putIfAbsent(ProducerConfig.MAX_BLOCK_MS_CONFIG, AggregatorConfig.KAFKA_MAX_BLOCK_MS_DEFAULT);
        producerProperties.putIfAbsent(ProducerConfig.CLIENT_ID_CONFIG, "iocradar-notifications");

        var producer = new KafkaProducer<>(producerProperties, new StringSerializer(), new ByteArraySerializer());
        var closeTimeout = Common.secondsProperty(properties, AggregatorConfig.KAFKA_CLOSE_TIMEOUT_SEC_CONFIG,
                AggregatorConfig.KAFKA_CLOSE_TIMEOUT_SEC_DEFAULT);
        var queueCapacity = Integer.parseInt(properties.getProperty(AggregatorConfig.KAFKA_QUEUE_CAPACITY_CONFIG,
                AggregatorConfig.KAFKA_QUEUE_CAPACITY_DEFAULT).trim());
        return new KafkaNotificationSink(producer, mapper, Clock.systemUTC(), closeTimeout, queueCapacity);
    }

    @Override
    public void publish(@NotNull EventType event, @NotNull Object payload) {
        final String key = payload instanceof Indicator indicator ? indicator.key().toString() : null;
        final var envelope = new NotificationEnvelope(event, _clock.instant(), payload);

        try {
            _dispatcher.execute(() -> send(event, key, envelope));
        } catch (RejectedExecutionException e) {
            var dropped = _dropped.incrementAndGet();
            Logger.warn("[{}] Notification queue full or closed, dropping {} ({} dropped so far)", event, key,
                    dropped);
        }
    }

    private void send(EventType event, @Nullable String key, NotificationEnvelope envelope) {
        final byte[] value;
        try {
            value = _mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            Logger.warn("[{}] Cannot serialize the notification for {}", event, key, e);
            return;
        }

        try {
            _producer.send(new ProducerRecord<>(event.topic(), key, value), (metadata, e) -> {
                if (e != null) {
                    Logger.warn("[{}] Failed to publish {}: {}", event, key, e.getMessage());
                } else {
                    Logger.trace("[{}] Published to {}-{}@{}", event, metadata.topic(), metadata.partition(),
                            metadata.offset());
                }
            });
        } catch (KafkaException e) {
            Logger.warn("[{}] Failed to publish {}", event, key, e);
        }
    }

    /**
     * Returns the number of events dropped because the dispatch queue was full or the sink was closed.
     */
    public long getDroppedCount() {
        return _dropped.get();
    }

    /**
     * Sends the queued events, waiting at most the close timeout, and closes the producer.
     */
    @Override
    public void close() {
        Logger.debug("Closing the producer");
        _dispatcher.shutdown();
        try {
            if (!_dispatcher.awaitTermination(_closeTimeout.toMillis(), TimeUnit.MILLISECONDS))
                Logger.warn("Queued notifications were not sent in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        _dispatcher.shutdownNow();
        _producer.close(_closeTimeout);
    }
}
