package com.ordermetrics.streams.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ordermetrics.common.model.OrderKey;
import com.ordermetrics.common.model.OrderRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metrics derived from one order record at one evaluation instant.
 * Never persisted as a correction; recomputed on every evaluation.
 * The metric map holds every {@link Metric} label in declaration order;
 * a null value means "not applicable" and is excluded from averages.
 */
public record MetricsRecord(
    @JsonProperty("order_key") String orderKey,
    @JsonProperty("buyer_np") String buyerNp,
    @JsonProperty("seller_np") String sellerNp,
    @JsonProperty("network_order_id") String networkOrderId,
    @JsonProperty("provider_key") String providerKey,
    @JsonProperty("category") String category,
    @JsonProperty("date") LocalDate date,
    @JsonProperty("evaluated_at") LocalDateTime evaluatedAt,
    @JsonProperty("metrics") Map<String, Double> metrics
) {

    /**
     * Assemble a record for an order from per-metric values. Metrics missing from
     * {@code values} are written as null.
     */
    public static MetricsRecord of(OrderRecord order, LocalDateTime evaluatedAt, Map<Metric, Double> values) {
        Map<String, Double> ordered = new LinkedHashMap<>();
        for (Metric metric : Metric.values()) {
            ordered.put(metric.label(), values.get(metric));
        }
        return new MetricsRecord(
            OrderKey.of(order).value(),
            order.buyerNp(),
            order.sellerNp(),
            order.networkOrderId(),
            OrderKey.providerKey(order),
            order.category(),
            order.date(),
            evaluatedAt,
            Collections.unmodifiableMap(ordered)
        );
    }

    /**
     * Value of one metric, or null when it does not apply to this order.
     */
    public Double value(Metric metric) {
        return metrics.get(metric.label());
    }
}
