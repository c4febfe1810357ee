package cz.vut.fit.iocradar.notifications;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.MoreExecutors;
import cz.vut.fit.iocradar.Common;
import cz.vut.fit.iocradar.MutableClock;
import cz.vut.fit.iocradar.models.Classification;
import cz.vut.fit.iocradar.models.Indicator;
import cz.vut.fit.iocradar.models.IndicatorKind;
import cz.vut.fit.iocradar.models.RollingStats;
import cz.vut.fit.iocradar.models.ThreatLevel;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KafkaNotificationSinkTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper mapper = Common.makeMapper().build();
    private MockProducer<String, byte[]> producer;
    private KafkaNotificationSink sink;

    @BeforeEach
    void setUp() {
        producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
        sink = directSink(producer);
    }

    private KafkaNotificationSink directSink(Producer<String, byte[]> target) {
        return new KafkaNotificationSink(target, mapper, new MutableClock(NOW), Duration.ofSeconds(1),
                MoreExecutors.newDirectExecutorService());
    }

    @Test
    void newObservationIsKeyedByIndicator() throws Exception {
        var indicator = new Indicator("198.51.100.7", IndicatorKind.IP, 90, Classification.CRITICAL,
                new TreeSet<>(Set.of("A", "B")), List.of(), new TreeSet<>(), NOW, NOW, null);

        sink.publish(EventType.NEW_OBSERVATION, indicator);

        assertEquals(1, producer.history().size());
        var record = producer.history().get(0);
        assertEquals(Topics.OUT_NEW_OBSERVATION, record.topic());
        assertEquals("ip:198.51.100.7", record.key());

        var json = mapper.readTree(record.value());
        assertEquals("new-observation", json.get("event").asText());
        assertEquals("2024-05-01T12:00:00Z", json.get("timestamp").asText());
        assertEquals("critical", json.get("data").get("classification").asText());
        assertEquals(90, json.get("data").get("threatScore").asInt());
        assertFalse(json.get("data").has("key"));
    }

    @Test
    void statsUpdateHasNoKey() throws Exception {
        sink.publish(EventType.STATS_UPDATE, new RollingStats(NOW, 1, 2, Map.of(), ThreatLevel.MEDIUM, 3));

        var record = producer.history().get(0);
        assertEquals(Topics.OUT_STATS_UPDATE, record.topic());
        assertNull(record.key());
        assertEquals("stats-update", mapper.readTree(record.value()).get("event").asText());
    }

    @Test
    void sendFailureIsNotPropagated() {
        producer = new MockProducer<>(false, new StringSerializer(), new ByteArraySerializer());
        sink = directSink(producer);

        sink.publish(EventType.STATS_UPDATE, RollingStats.empty(NOW));
        assertTrue(producer.errorNext(new RuntimeException("broker unavailable")));
    }

    @Test
    @SuppressWarnings("unchecked")
    void publishDoesNotWaitForBlockedProducer() throws Exception {
        final Producer<String, byte[]> blocking = mock(Producer.class);
        final var sending = new CountDownLatch(1);
        final var release = new CountDownLatch(1);
        when(blocking.send(any(ProducerRecord.class), any())).thenAnswer(invocation -> {
            sending.countDown();
            release.await(5, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(null);
        });
        var bounded = new KafkaNotificationSink(blocking, mapper, new MutableClock(NOW), Duration.ofSeconds(5), 1);

        try {
            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
                bounded.publish(EventType.STATS_UPDATE, RollingStats.empty(NOW)); // taken by the dispatcher
                bounded.publish(EventType.STATS_UPDATE, RollingStats.empty(NOW)); // queued
                bounded.publish(EventType.STATS_UPDATE, RollingStats.empty(NOW)); // dropped
            });
            assertTrue(sending.await(5, TimeUnit.SECONDS));
            assertEquals(1, bounded.getDroppedCount());
        } finally {
            release.countDown();
            bounded.close();
        }

        verify(blocking, times(2)).send(any(ProducerRecord.class), any());
        verify(blocking).close(Duration.ofSeconds(5));
    }

    @Test
    void publishAfterCloseIsDropped() {
        sink.close();
        sink.publish(EventType.STATS_UPDATE, RollingStats.empty(NOW));

        assertTrue(producer.history().isEmpty());
        assertEquals(1, sink.getDroppedCount());
    }

    @Test
    void closeClosesTheProducer() {
        sink.close();
        assertTrue(producer.closed());
    }
}
