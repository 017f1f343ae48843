package com.ordermetrics.streams.derivation;

import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.model.OrderStatus;
import com.ordermetrics.streams.model.Metric;
import com.ordermetrics.streams.model.MetricsRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DerivationPassTest {

    private static final LocalDateTime PROMISED = LocalDateTime.of(2025, 9, 1, 10, 0);

    private final DerivationPass pass = new DerivationPass(new MetricsDerivationEngine());

    private static List<OrderRecord> inProcessOrders(int count) {
        List<OrderRecord> orders = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            orders.add(OrderRecord.builder()
                .sellerNp("seller")
                .networkOrderId("order-" + i)
                .providerId("p")
                .networkTransactionId("t")
                .orderStatus(OrderStatus.IN_PROCESS)
                .promisedTime(PROMISED.minusMinutes(i))
                .build());
        }
        return orders;
    }

    @Test
    void testEmptyPass() {
        assertTrue(pass.run(List.of(), PROMISED).isEmpty());
    }

    @Test
    void testOneRecordPerOrderInInputOrder() {
        List<OrderRecord> orders = inProcessOrders(10);

        List<MetricsRecord> results = pass.run(orders, PROMISED);

        assertEquals(10, results.size());
        for (int i = 0; i < orders.size(); i++) {
            assertEquals("sellerorder-" + i + "pt", results.get(i).orderKey());
        }
    }

    @Test
    void testEveryRecordSharesOneNow() {
        LocalDateTime now = PROMISED.plusHours(1);

        List<MetricsRecord> results = pass.run(inProcessOrders(25), now);

        for (int i = 0; i < results.size(); i++) {
            assertEquals(now, results.get(i).evaluatedAt());
            assertEquals(60.0 + i, results.get(i).value(Metric.BREACH_MINS));
        }
    }

    @Test
    void testLargePassKeepsOrder() {
        int size = DerivationPass.PARALLEL_THRESHOLD * 3;
        List<OrderRecord> orders = inProcessOrders(size);

        List<MetricsRecord> results = pass.run(orders, PROMISED);

        assertEquals(size, results.size());
        for (int i = 0; i < size; i++) {
            assertEquals((double) i, results.get(i).value(Metric.BREACH_MINS));
        }
    }
}
