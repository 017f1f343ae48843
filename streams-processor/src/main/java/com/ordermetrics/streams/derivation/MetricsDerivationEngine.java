package com.ordermetrics.streams.derivation;

import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.model.OrderStatus;
import com.ordermetrics.streams.derivation.BucketFamily.Weighting;
import com.ordermetrics.streams.model.Metric;
import com.ordermetrics.streams.model.MetricsRecord;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Derives the dashboard metrics of one order at one evaluation instant.
 *
 * <p>Stateless and side-effect free: the same record and {@code now} always give an
 * equal {@link MetricsRecord}, and any number of threads may share one instance.
 * {@code now} is only consulted for the breach duration of orders still
 * {@code In Process}.
 *
 * <p>Missing inputs never fail a derivation. A missing {@code tat_dif} or on-time
 * indicator counts as 0, a missing timestamp makes every duration that needs it
 * null, and a missing status or category fails every test on it.
 */
public class MetricsDerivationEngine {

    static final String FNB_CATEGORY = "F&B";

    private static final double SECONDS_PER_MINUTE = 60.0;
    private static final double SECONDS_PER_HOUR = 3600.0;
    private static final double SECONDS_PER_DAY = 86400.0;

    // Keyed on day_diff. Only "Same Day" carries the unit weight.
    static final BucketFamily DELIVERY_AGEING = BucketFamily.named("delivery-ageing")
        .bucket(Metric.SAME_DAY, d -> d == 0)
        .bucket(Metric.NEXT_DAY, d -> d == 1, Weighting.PLAIN)
        .bucket(Metric.DAY_PLUS_2, d -> d == 2, Weighting.PLAIN)
        .bucket(Metric.MORE_THAN_2_DAYS, d -> d > 2, Weighting.PLAIN)
        .build();

    // Keyed on min_diff. The two longest buckets count a plain 1.
    static final BucketFamily FNB_MINUTES = BucketFamily.named("fnb-minutes")
        .bucket(Metric.WITHIN_15_MINS, m -> m <= 15)
        .bucket(Metric.MINS_15_30, m -> m > 15 && m <= 30)
        .bucket(Metric.MINS_30_45, m -> m > 30 && m <= 45)
        .bucket(Metric.MINS_45_60, m -> m > 45 && m <= 60)
        .bucket(Metric.MINS_60_120, m -> m > 60 && m <= 120, Weighting.PLAIN)
        .bucket(Metric.ABOVE_120_MINS, m -> m > 120, Weighting.PLAIN)
        .build();

    // Keyed on tat_dif in seconds; tat_dif <= 0 falls in no bucket.
    static final BucketFamily TAT_SECONDS = BucketFamily.named("tat-seconds")
        .bucket(Metric.TAT_UNDER_5_MINS, s -> s > 0 && s <= 300)
        .bucket(Metric.TAT_5_15_MINS, s -> s > 300 && s <= 900)
        .bucket(Metric.TAT_15_30_MINS, s -> s > 900 && s <= 1800)
        .bucket(Metric.TAT_30_60_MINS, s -> s > 1800 && s <= 3600)
        .bucket(Metric.TAT_OVER_60_MINS, s -> s > 3600)
        .build();

    // Keyed on tat_diff_days, exact day counts.
    static final BucketFamily TAT_DAYS = BucketFamily.named("tat-days")
        .bucket(Metric.TAT_PLUS_1, d -> d == 1)
        .bucket(Metric.TAT_PLUS_2, d -> d == 2)
        .bucket(Metric.TAT_PLUS_3, d -> d == 3)
        .bucket(Metric.TAT_PLUS_4, d -> d == 4)
        .bucket(Metric.TAT_OVER_4, d -> d > 4)
        .build();

    /**
     * Derive all metrics of {@code order} as of {@code now}.
     *
     * @param order current state of the order
     * @param now evaluation instant, timezone-naive like the order's timestamps
     * @return one metrics record keyed by the order's identity
     */
    public MetricsRecord derive(OrderRecord order, LocalDateTime now) {
        Map<Metric, Double> values = new EnumMap<>(Metric.class);
        Double weight = order.noKey() == null ? null : order.noKey().doubleValue();
        boolean delivered = OrderStatus.DELIVERED.matches(order.orderStatus());
        boolean fnb = FNB_CATEGORY.equals(order.category());

        statusCounts(order, weight, values);
        values.put(Metric.CANCELLATION_CODE_CAL, order.cancellationCode() != null ? 1.0 : 0.0);
        tatBreach(order, delivered, weight, values);
        values.put(Metric.DBO, weighted(delivered && deliveredByObligation(order), weight));
        breachDuration(order, now, values);
        DELIVERY_AGEING.apply(delivered, order.dayDiff(), weight, values);
        values.put(Metric.ON_TIME_DELIVERIES, orZero(order.onTimeDelivery()));
        averages(order, delivered, fnb, values);
        FNB_MINUTES.apply(delivered && fnb, order.minDiff(), weight, values);
        TAT_SECONDS.apply(delivered, order.tatDif(), weight, values);
        TAT_DAYS.apply(delivered, order.tatDiffDays(), weight, values);
        values.put(Metric.TAT_SAME_DAY, weighted(delivered && tatSameDay(order), weight));
        values.put(Metric.NON_FNB_DAYS_DIFF, delivered && order.category() != null && !fnb
            ? wholeDaysBetween(order.createdAt(), order.updatedAt())
            : null);
        values.put(Metric.SHIPPED_MARK, weighted(order.shippedAt() != null, weight));

        return MetricsRecord.of(order, now, values);
    }

    /**
     * "Confirmed" counts every record; the other four split by status.
     */
    private static void statusCounts(OrderRecord order, Double weight, Map<Metric, Double> values) {
        String status = order.orderStatus();
        values.put(Metric.CONFIRMED, weight);
        values.put(Metric.DELIVERED, weighted(OrderStatus.DELIVERED.matches(status), weight));
        values.put(Metric.CANCELLED, weighted(OrderStatus.CANCELLED.matches(status), weight));
        values.put(Metric.IN_PROCESS, weighted(OrderStatus.IN_PROCESS.matches(status), weight));
        values.put(Metric.PART_DELIVERED, weighted(OrderStatus.PART_DELIVERED.matches(status), weight));
    }

    /**
     * Delivered records with a negative tat_dif (early arrival) are in neither
     * "with TAT" nor "beyond TAT".
     */
    private static void tatBreach(OrderRecord order, boolean delivered, Double weight, Map<Metric, Double> values) {
        double tatDif = orZero(order.tatDif());
        values.put(Metric.TAT_BREACH, tatDif);
        values.put(Metric.DELIVERED_WITH_TAT, weighted(delivered && tatDif == 0, weight));
        values.put(Metric.DELIVERED_BEYOND_TAT, weighted(delivered && tatDif > 0, weight));
    }

    private static boolean deliveredByObligation(OrderRecord order) {
        return order.updatedAt() != null
            && order.promisedTime() != null
            && !order.updatedAt().isAfter(order.promisedTime());
    }

    /**
     * Signed distance past the promised time: completion for closed orders,
     * {@code now} for orders still in flight, null for any other status.
     */
    private static void breachDuration(OrderRecord order, LocalDateTime now, Map<Metric, Double> values) {
        String status = order.orderStatus();
        Double seconds = null;
        if (OrderStatus.DELIVERED.matches(status) || OrderStatus.CANCELLED.matches(status)) {
            seconds = secondsBetween(order.promisedTime(), order.updatedAt());
        } else if (OrderStatus.IN_PROCESS.matches(status)) {
            seconds = secondsBetween(order.promisedTime(), now);
        }
        values.put(Metric.BREACH_MINS, seconds == null ? null : seconds / SECONDS_PER_MINUTE);
        values.put(Metric.BREACH_HRS, seconds == null ? null : seconds / SECONDS_PER_HOUR);
        values.put(Metric.BREACH_DAYS, seconds == null ? null : seconds / SECONDS_PER_DAY);
    }

    private static void averages(OrderRecord order, boolean delivered, boolean fnb, Map<Metric, Double> values) {
        values.put(Metric.AVERAGE_TAT_MINS, delivered ? order.tatTime() : null);
        values.put(Metric.AVG_DELIVERY_MINS,
            delivered && order.minDiff() != null && order.minDiff() > 0 ? order.minDiff() : null);
        Double fnbSeconds = delivered && fnb ? secondsBetween(order.createdAt(), order.updatedAt()) : null;
        values.put(Metric.FNB_MINS_DIFF, fnbSeconds == null ? null : fnbSeconds / SECONDS_PER_MINUTE);
    }

    private static boolean tatSameDay(OrderRecord order) {
        return order.tatDiffDays() != null
            && order.tatDiffDays() < 1
            && order.promisedTime() != null
            && order.updatedAt() != null
            && order.promisedTime().isBefore(order.updatedAt());
    }

    private static Double weighted(boolean condition, Double weight) {
        return condition ? weight : Double.valueOf(0.0);
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static Double secondsBetween(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null) {
            return null;
        }
        Duration duration = Duration.between(from, to);
        return duration.getSeconds() + duration.getNano() / 1_000_000_000.0;
    }

    // Day component of the interval, truncated toward zero.
    private static Double wholeDaysBetween(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null) {
            return null;
        }
        return (double) Duration.between(from, to).toDays();
    }
}
