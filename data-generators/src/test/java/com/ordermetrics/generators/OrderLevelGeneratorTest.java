package com.ordermetrics.generators;

import com.ordermetrics.common.model.OrderKey;
import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.model.OrderStatus;
import com.ordermetrics.common.serde.JsonSerde;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Generator tests against a MockProducer with a fixed clock and seeded randomness.
 */
class OrderLevelGeneratorTest {

    private static final String TOPIC = "order.level";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-15T10:00:00Z"), ZoneOffset.UTC);

    private MockProducer<String, OrderRecord> producer;
    private OrderLevelGenerator generator;

    @BeforeEach
    void setUp() {
        producer = new MockProducer<>(true, new StringSerializer(), new JsonSerde<>(OrderRecord.class).serializer());
        generator = new OrderLevelGenerator(producer, TOPIC, CLOCK, new Random(42));
    }

    @Test
    void testNewOrderPublishedInProcess() {
        generator.createNewOrder();

        List<ProducerRecord<String, OrderRecord>> sent = producer.history();
        assertEquals(1, sent.size());

        ProducerRecord<String, OrderRecord> record = sent.get(0);
        assertEquals(TOPIC, record.topic());
        assertEquals(OrderKey.of(record.value()).value(), record.key());
        assertEquals("In Process", record.value().orderStatus());
        assertEquals(1, record.value().noKey());
        assertFalse(record.value().createdAt().isAfter(LocalDateTime.now(CLOCK)));
        assertTrue(record.value().promisedTime().isAfter(record.value().createdAt()));
        assertEquals(1, generator.activeOrderCount());
    }

    @Test
    void testUpdateWithNoActiveOrdersCreatesOne() {
        generator.updateExistingOrder();

        assertEquals(1, producer.history().size());
        assertEquals(1, generator.activeOrderCount());
    }

    @Test
    void testOrdersProgressToTerminalStatus() {
        for (int i = 0; i < 50; i++) {
            generator.tick();
        }

        Map<String, OrderRecord> latest = new HashMap<>();
        for (ProducerRecord<String, OrderRecord> record : producer.history()) {
            latest.put(record.key(), record.value());
        }

        long terminal = latest.values().stream()
            .filter(order -> !OrderStatus.IN_PROCESS.matches(order.orderStatus()))
            .count();
        assertTrue(terminal > 0);
        assertEquals(latest.size() - terminal, generator.activeOrderCount());

        for (OrderRecord order : latest.values()) {
            assertNotNull(OrderStatus.fromLabel(order.orderStatus()));
            if (OrderStatus.CANCELLED.matches(order.orderStatus())) {
                assertNotNull(order.cancellationCode());
                assertEquals(3, order.cancellationCode().length());
            } else {
                assertNull(order.cancellationCode());
            }
            if (OrderStatus.DELIVERED.matches(order.orderStatus())) {
                assertNotNull(order.tatDif());
                assertNotNull(order.shippedAt());
            }
        }
    }
}
