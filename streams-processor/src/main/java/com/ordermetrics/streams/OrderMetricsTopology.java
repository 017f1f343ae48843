package com.ordermetrics.streams;

import com.ordermetrics.common.KafkaConfig;
import com.ordermetrics.common.model.OrderKey;
import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.serde.JsonSerde;
import com.ordermetrics.streams.derivation.MetricsDerivationEngine;
import com.ordermetrics.streams.model.MetricsRecord;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.common.utils.Bytes;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.StreamsBuilder;
import org.apache.kafka.streams.Topology;
import org.apache.kafka.streams.kstream.Consumed;
import org.apache.kafka.streams.kstream.Grouped;
import org.apache.kafka.streams.kstream.KStream;
import org.apache.kafka.streams.kstream.KTable;
import org.apache.kafka.streams.kstream.Materialized;
import org.apache.kafka.streams.kstream.Produced;
import org.apache.kafka.streams.state.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Kafka Streams topology for order metrics.
 * Keeps the current state of every order and emits derived metrics as orders change.
 */
public class OrderMetricsTopology {

    private static final Logger LOG = LoggerFactory.getLogger(OrderMetricsTopology.class);

    // State store names
    public static final String ORDER_STATE_STORE = "order-current-state";
    public static final String ORDERS_BY_STATUS_STORE = "orders-by-status";

    public static final String UNKNOWN_STATUS = "Unknown";

    /**
     * Build the topology on the configured topics.
     *
     * @param clock wall clock used to age in-flight orders as they arrive
     * @return Configured topology
     */
    public static Topology build(Clock clock) {
        return build(KafkaConfig.getOrderLevelTopic(), KafkaConfig.getOrderMetricsTopic(), clock);
    }

    /**
     * Build the topology.
     *
     * @param orderLevelTopic topic carrying order records
     * @param orderMetricsTopic topic receiving derived metrics records
     * @param clock wall clock used to age in-flight orders as they arrive
     * @return Configured topology
     */
    public static Topology build(String orderLevelTopic, String orderMetricsTopic, Clock clock) {
        LOG.info("Building order metrics topology: {} -> {}", orderLevelTopic, orderMetricsTopic);

        StreamsBuilder builder = new StreamsBuilder();
        MetricsDerivationEngine engine = new MetricsDerivationEngine();

        JsonSerde<OrderRecord> orderSerde = new JsonSerde<>(OrderRecord.class);
        JsonSerde<MetricsRecord> metricsSerde = new JsonSerde<>(MetricsRecord.class);

        // Incoming keys are not trusted; every record is re-keyed by its normalized identity
        KStream<String, OrderRecord> orderStream = builder.stream(
                orderLevelTopic,
                Consumed.with(Serdes.String(), orderSerde)
            )
            .filter((key, value) -> value != null)
            .selectKey((key, value) -> OrderKey.of(value).value());

        orderStream.peek((key, value) ->
            LOG.debug("Processing order record: {} - {}", key, value.orderStatus())
        );

        KTable<String, OrderRecord> currentOrders = buildOrderStateStore(orderStream, orderSerde);
        buildOrdersByStatusStore(currentOrders, orderSerde);
        buildMetricsOutput(orderStream, orderMetricsTopic, engine, metricsSerde, clock);

        Topology topology = builder.build();
        LOG.info("Topology built successfully with 2 state stores");
        LOG.info("Topology description:\n{}", topology.describe());

        return topology;
    }

    /**
     * Latest record per order key; a later record for the same key replaces the earlier one.
     */
    private static KTable<String, OrderRecord> buildOrderStateStore(
            KStream<String, OrderRecord> orderStream,
            JsonSerde<OrderRecord> orderSerde) {

        LOG.info("Building state store: {}", ORDER_STATE_STORE);

        return orderStream.toTable(
            Materialized.<String, OrderRecord, KeyValueStore<Bytes, byte[]>>as(ORDER_STATE_STORE)
                .withKeySerde(Serdes.String())
                .withValueSerde(orderSerde)
        );
    }

    /**
     * Count of current orders per status label. Status changes move an order between counts.
     */
    private static void buildOrdersByStatusStore(
            KTable<String, OrderRecord> currentOrders,
            JsonSerde<OrderRecord> orderSerde) {

        LOG.info("Building state store: {}", ORDERS_BY_STATUS_STORE);

        KTable<String, Long> countsByStatus = currentOrders
            .groupBy(
                (key, order) -> KeyValue.pair(statusLabel(order), order),
                Grouped.with(Serdes.String(), orderSerde)
            )
            .count(
                Materialized.<String, Long, KeyValueStore<Bytes, byte[]>>as(ORDERS_BY_STATUS_STORE)
                    .withKeySerde(Serdes.String())
                    .withValueSerde(Serdes.Long())
            );

        countsByStatus.toStream().peek((status, count) ->
            LOG.debug("Updated {} count: {}", status, count)
        );
    }

    private static void buildMetricsOutput(
            KStream<String, OrderRecord> orderStream,
            String orderMetricsTopic,
            MetricsDerivationEngine engine,
            JsonSerde<MetricsRecord> metricsSerde,
            Clock clock) {

        orderStream
            .mapValues(order -> engine.derive(order, LocalDateTime.now(clock)))
            .to(orderMetricsTopic, Produced.with(Serdes.String(), metricsSerde));
    }

    static String statusLabel(OrderRecord order) {
        String status = order.orderStatus();
        return status == null || status.isEmpty() ? UNKNOWN_STATUS : status;
    }
}
