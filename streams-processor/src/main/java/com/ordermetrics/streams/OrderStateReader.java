package com.ordermetrics.streams;

import com.ordermetrics.common.model.OrderRecord;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.KeyValue;
import org.apache.kafka.streams.StoreQueryParameters;
import org.apache.kafka.streams.state.KeyValueIterator;
import org.apache.kafka.streams.state.QueryableStoreTypes;
import org.apache.kafka.streams.state.ReadOnlyKeyValueStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Read access to the order state stores. Stores are looked up on every call since
 * a rebalance can replace them.
 */
public class OrderStateReader {

    private final Supplier<ReadOnlyKeyValueStore<String, OrderRecord>> orderStore;
    private final Supplier<ReadOnlyKeyValueStore<String, Long>> statusStore;

    public OrderStateReader(Supplier<ReadOnlyKeyValueStore<String, OrderRecord>> orderStore,
                            Supplier<ReadOnlyKeyValueStore<String, Long>> statusStore) {
        this.orderStore = orderStore;
        this.statusStore = statusStore;
    }

    public static OrderStateReader forStreams(KafkaStreams streams) {
        return new OrderStateReader(
            () -> streams.store(StoreQueryParameters.fromNameAndType(
                OrderMetricsTopology.ORDER_STATE_STORE, QueryableStoreTypes.keyValueStore())),
            () -> streams.store(StoreQueryParameters.fromNameAndType(
                OrderMetricsTopology.ORDERS_BY_STATUS_STORE, QueryableStoreTypes.keyValueStore()))
        );
    }

    /**
     * @return the current record for a normalized order key, or null
     */
    public OrderRecord order(String orderKey) {
        return orderStore.get().get(orderKey);
    }

    public List<OrderRecord> allOrders() {
        List<OrderRecord> orders = new ArrayList<>();
        try (KeyValueIterator<String, OrderRecord> iter = orderStore.get().all()) {
            while (iter.hasNext()) {
                orders.add(iter.next().value);
            }
        }
        return orders;
    }

    public long statusCount(String status) {
        Long count = statusStore.get().get(status);
        return count != null ? count : 0L;
    }

    public Map<String, Long> statusCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        try (KeyValueIterator<String, Long> iter = statusStore.get().all()) {
            while (iter.hasNext()) {
                KeyValue<String, Long> kv = iter.next();
                counts.put(kv.key, kv.value);
            }
        }
        return counts;
    }
}
