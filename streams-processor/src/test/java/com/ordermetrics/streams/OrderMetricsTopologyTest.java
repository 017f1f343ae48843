package com.ordermetrics.streams;

import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.model.OrderStatus;
import com.ordermetrics.common.serde.JsonSerde;
import com.ordermetrics.streams.model.Metric;
import com.ordermetrics.streams.model.MetricsRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.TestInputTopic;
import org.apache.kafka.streams.TestOutputTopic;
import org.apache.kafka.streams.TopologyTestDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Topology tests against an in-memory driver. The wall clock is fixed.
 */
class OrderMetricsTopologyTest {

    private static final String ORDER_LEVEL = "order.level";
    private static final String ORDER_METRICS = "order.metrics";
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 8, 10, 13, 30);
    private static final LocalDateTime PROMISED = LocalDateTime.of(2025, 8, 10, 12, 0);

    private TopologyTestDriver driver;
    private TestInputTopic<String, OrderRecord> input;
    private TestOutputTopic<String, MetricsRecord> output;
    private OrderStateReader reader;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG, "order-metrics-test");
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, "dummy:9092");
        props.put(StreamsConfig.STATESTORE_CACHE_MAX_BYTES_CONFIG, 0);

        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        driver = new TopologyTestDriver(OrderMetricsTopology.build(ORDER_LEVEL, ORDER_METRICS, clock), props);

        input = driver.createInputTopic(ORDER_LEVEL,
            new StringSerializer(), new JsonSerde<>(OrderRecord.class).serializer());
        output = driver.createOutputTopic(ORDER_METRICS,
            new StringDeserializer(), new JsonSerde<>(MetricsRecord.class).deserializer());
        reader = new OrderStateReader(
            () -> driver.getKeyValueStore(OrderMetricsTopology.ORDER_STATE_STORE),
            () -> driver.getKeyValueStore(OrderMetricsTopology.ORDERS_BY_STATUS_STORE)
        );
    }

    @AfterEach
    void tearDown() {
        driver.close();
    }

    private static OrderRecord.Builder order(String orderId) {
        return OrderRecord.builder()
            .buyerNp("buyer.example.com")
            .sellerNp("Seller.Example.com")
            .networkOrderId(orderId)
            .providerId("P1")
            .networkTransactionId("TXN")
            .category("Grocery")
            .orderStatus(OrderStatus.IN_PROCESS)
            .createdAt(PROMISED.minusHours(3))
            .promisedTime(PROMISED)
            .updatedAt(PROMISED.minusHours(3));
    }

    @Test
    void testLatestRecordReplacesEarlierOne() {
        input.pipeInput("ignored", order("ORD-1").build());
        input.pipeInput("also-ignored", order("ord-1")
            .sellerNp("SELLER.EXAMPLE.COM")
            .orderStatus(OrderStatus.DELIVERED)
            .updatedAt(PROMISED)
            .build());

        List<OrderRecord> orders = reader.allOrders();
        assertEquals(1, orders.size());

        OrderRecord current = reader.order("seller.example.comord-1p1txn");
        assertNotNull(current);
        assertEquals("Delivered", current.orderStatus());
    }

    @Test
    void testStatusCountsFollowUpdates() {
        input.pipeInput(null, order("ORD-1").build());
        input.pipeInput(null, order("ORD-2").build());
        input.pipeInput(null, order("ORD-1").orderStatus(OrderStatus.DELIVERED).build());

        assertEquals(1L, reader.statusCount("In Process"));
        assertEquals(1L, reader.statusCount("Delivered"));
        assertEquals(0L, reader.statusCount("Cancelled"));
    }

    @Test
    void testMissingStatusCountedAsUnknown() {
        input.pipeInput(null, order("ORD-1").orderStatus((String) null).build());

        assertEquals(1L, reader.statusCount(OrderMetricsTopology.UNKNOWN_STATUS));
        assertEquals(OrderMetricsTopology.UNKNOWN_STATUS,
            OrderMetricsTopology.statusLabel(order("x").orderStatus("").build()));
    }

    @Test
    void testMetricsEmittedForEveryRecord() {
        input.pipeInput("k", order("ORD-1").build());
        input.pipeInput("k", order("ORD-1").orderStatus(OrderStatus.DELIVERED).updatedAt(PROMISED).build());

        List<KeyValue<String, MetricsRecord>> records = output.readKeyValuesToList();
        assertEquals(2, records.size());

        KeyValue<String, MetricsRecord> inFlight = records.get(0);
        assertEquals("seller.example.comord-1p1txn", inFlight.key);
        assertEquals(NOW, inFlight.value.evaluatedAt());
        assertEquals(90.0, inFlight.value.value(Metric.BREACH_MINS));
        assertEquals(1.0, inFlight.value.value(Metric.IN_PROCESS));

        MetricsRecord delivered = records.get(1).value;
        assertEquals(0.0, delivered.value(Metric.BREACH_MINS));
        assertEquals(1.0, delivered.value(Metric.DBO));
        assertEquals("seller.example.com_p1", delivered.providerKey());
    }

    @Test
    void testTombstonesDropped() {
        input.pipeInput("k", order("ORD-1").build());
        input.pipeInput("k", null);

        assertEquals(1, output.readValuesToList().size());
        assertEquals(1, reader.allOrders().size());
    }

    @Test
    void testRecordTimeDoesNotAffectEvaluation() {
        input.pipeInput("k", order("ORD-1").build(), Instant.parse("2020-01-01T00:00:00Z"));

        assertEquals(NOW, output.readValue().evaluatedAt());
    }
}
