package com.ordermetrics.streams.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Dashboard roll-up of one derivation pass.
 * SUM metrics are totalled, AVERAGE metrics are averaged over the records where
 * they apply (null when none does). Buyer NPs are counted distinct.
 */
public record MetricsSummary(
    @JsonProperty("evaluated_at") LocalDateTime evaluatedAt,
    @JsonProperty("order_count") long orderCount,
    @JsonProperty("distinct_buyer_nps") long distinctBuyerNps,
    @JsonProperty("totals") Map<String, Double> totals,
    @JsonProperty("averages") Map<String, Double> averages
) {

    public static MetricsSummary of(Collection<MetricsRecord> records, LocalDateTime evaluatedAt) {
        Map<String, Double> totals = new LinkedHashMap<>();
        Map<String, Double> averages = new LinkedHashMap<>();

        for (Metric metric : Metric.values()) {
            double sum = 0.0;
            long contributing = 0;
            for (MetricsRecord record : records) {
                Double value = record.value(metric);
                if (value != null) {
                    sum += value;
                    contributing++;
                }
            }
            if (metric.aggregation() == Metric.Aggregation.SUM) {
                totals.put(metric.label(), sum);
            } else {
                averages.put(metric.label(), contributing == 0 ? null : sum / contributing);
            }
        }

        long distinctBuyers = records.stream()
            .map(MetricsRecord::buyerNp)
            .filter(Objects::nonNull)
            .distinct()
            .count();

        return new MetricsSummary(evaluatedAt, records.size(), distinctBuyers, totals, averages);
    }

    public Double total(Metric metric) {
        return totals.get(metric.label());
    }

    public Double average(Metric metric) {
        return averages.get(metric.label());
    }
}
