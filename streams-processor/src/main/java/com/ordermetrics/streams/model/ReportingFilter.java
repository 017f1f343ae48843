package com.ordermetrics.streams.model;

import com.ordermetrics.common.model.OrderRecord;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Selects the orders a report covers: orders dated on or after {@code from},
 * optionally narrowed to one category and one seller NP.
 * Orders without a date are excluded whenever {@code from} is set.
 */
public record ReportingFilter(LocalDate from, String category, String sellerNp) implements Predicate<OrderRecord> {

    public static ReportingFilter window(LocalDate from) {
        return new ReportingFilter(from, null, null);
    }

    /**
     * Parse {@code from}, {@code category} and {@code seller} from a raw URI query string.
     *
     * @param rawQuery query string, possibly null
     * @param defaultFrom window start used when {@code from} is absent
     * @throws IllegalArgumentException if {@code from} is not an ISO date
     */
    public static ReportingFilter fromQuery(String rawQuery, LocalDate defaultFrom) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                int idx = pair.indexOf('=');
                if (idx <= 0) {
                    continue;
                }
                params.put(
                    URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8)
                );
            }
        }

        LocalDate from = defaultFrom;
        String rawFrom = params.get("from");
        if (rawFrom != null && !rawFrom.isEmpty()) {
            try {
                from = LocalDate.parse(rawFrom);
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Invalid 'from' date: " + rawFrom, e);
            }
        }
        return new ReportingFilter(from, emptyToNull(params.get("category")), emptyToNull(params.get("seller")));
    }

    @Override
    public boolean test(OrderRecord order) {
        if (from != null && (order.date() == null || order.date().isBefore(from))) {
            return false;
        }
        if (category != null && !category.equals(order.category())) {
            return false;
        }
        return sellerNp == null || sellerNp.equals(order.sellerNp());
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
