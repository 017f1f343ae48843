package com.ordermetrics.common.model;

import java.util.Locale;

/**
 * Case-normalized identity of an order record: seller NP, network order id,
 * provider id and network transaction id concatenated and lower-cased.
 * The ingestion source guarantees one current record per key.
 */
public record OrderKey(String value) {

    public static OrderKey of(OrderRecord order) {
        return of(order.sellerNp(), order.networkOrderId(), order.providerId(), order.networkTransactionId());
    }

    public static OrderKey of(String sellerNp, String networkOrderId, String providerId, String networkTransactionId) {
        String raw = nullToEmpty(sellerNp)
            + nullToEmpty(networkOrderId)
            + nullToEmpty(providerId)
            + nullToEmpty(networkTransactionId);
        return new OrderKey(raw.toLowerCase(Locale.ROOT));
    }

    /**
     * Reporting dimension grouping orders by seller and provider: {@code lower(seller + "_" + provider)}.
     */
    public static String providerKey(OrderRecord order) {
        return (nullToEmpty(order.sellerNp()) + "_" + nullToEmpty(order.providerId())).toLowerCase(Locale.ROOT);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        return value;
    }
}
