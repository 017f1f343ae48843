package com.ordermetrics.generators;

import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.model.OrderStatus;
import com.ordermetrics.generators.model.OrderLifecycle;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Turns a simulated order lifecycle into the order-level record the metrics engine reads,
 * computing the precomputed TAT fields the same way the staging pipeline does.
 * All differences are whole units, truncated, and null while the order has no completion.
 */
public class OrderRecordFactory {

    static final String FNB_CATEGORY = "F&B";

    // F&B sellers get a short grace on top of the promised time
    static final Duration FNB_PROMISE_GRACE = Duration.ofMinutes(5);

    static final String RTO_CANCELLATION_CODE = "013";
    static final String UNMAPPED_CANCELLATION_CODE = "052";
    static final String DEFAULT_CANCELLATION_CODE = "050";

    private static final Set<String> KNOWN_CANCELLATION_CODES = IntStream.rangeClosed(1, 22)
        .mapToObj(code -> String.format("%03d", code))
        .collect(Collectors.toUnmodifiableSet());

    public OrderRecord build(OrderLifecycle order) {
        LocalDateTime promised = effectivePromisedTime(order);
        LocalDateTime completed = order.completedAt();
        OrderStatus status = order.status();

        return OrderRecord.builder()
            .buyerNp(order.buyerNp())
            .sellerNp(order.sellerNp())
            .networkOrderId(order.networkOrderId())
            .providerId(order.providerId())
            .networkTransactionId(order.networkTransactionId())
            .sellerName(order.sellerName())
            .sellerPincode(order.sellerPincode())
            .deliveryPincode(order.deliveryPincode())
            .domain(order.domain())
            .category(order.category())
            .consolidatedCategory(order.category())
            .orderStatus(status)
            .cancellationCode(cancellationCode(status, order.rawCancellationCode(), order.isRto()))
            .date(order.createdAt() == null ? null : order.createdAt().toLocalDate())
            .createdAt(order.createdAt())
            .readyToShipAt(order.readyToShipAt())
            .shippedAt(order.shippedAt())
            .promisedTime(promised)
            .updatedAt(updatedAt(order))
            .tatDif(between(ChronoUnit.SECONDS, promised, completed))
            .tatDiffDays(between(ChronoUnit.DAYS, promised, completed))
            .dayDiff(between(ChronoUnit.DAYS, order.createdAt(), completed))
            .minDiff(between(ChronoUnit.MINUTES, order.createdAt(), completed))
            .tatTime(between(ChronoUnit.MINUTES, order.createdAt(), promised))
            .onTimeDelivery(onTime(status, completed, promised) ? 1.0 : 0.0)
            .noKey(1)
            .build();
    }

    /**
     * Promised time with the F&B grace applied, falling back to the creation time.
     */
    static LocalDateTime effectivePromisedTime(OrderLifecycle order) {
        LocalDateTime promised = order.promisedAt();
        if (promised == null) {
            return order.createdAt();
        }
        return FNB_CATEGORY.equals(order.category()) ? promised.plus(FNB_PROMISE_GRACE) : promised;
    }

    /**
     * Normalized cancellation code; null unless the order is cancelled.
     * Seller codes keep their last three characters when those are a known code 001-022.
     */
    static String cancellationCode(OrderStatus status, String rawCode, boolean rto) {
        if (status != OrderStatus.CANCELLED) {
            return null;
        }
        if (rawCode == null) {
            return rto ? RTO_CANCELLATION_CODE : DEFAULT_CANCELLATION_CODE;
        }
        String suffix = rawCode.length() > 3 ? rawCode.substring(rawCode.length() - 3) : rawCode;
        return KNOWN_CANCELLATION_CODES.contains(suffix) ? suffix : UNMAPPED_CANCELLATION_CODE;
    }

    static LocalDateTime updatedAt(OrderLifecycle order) {
        switch (order.status()) {
            case DELIVERED:
                return order.completedAt();
            case CANCELLED:
                return order.cancelledAt();
            default:
                return order.createdAt();
        }
    }

    private static boolean onTime(OrderStatus status, LocalDateTime completed, LocalDateTime promised) {
        return status == OrderStatus.DELIVERED
            && completed != null
            && promised != null
            && !completed.isAfter(promised);
    }

    private static Double between(ChronoUnit unit, LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null) {
            return null;
        }
        return (double) unit.between(from, to);
    }
}
