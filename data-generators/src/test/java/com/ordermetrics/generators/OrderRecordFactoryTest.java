package com.ordermetrics.generators;

import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.model.OrderStatus;
import com.ordermetrics.generators.model.OrderLifecycle;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class OrderRecordFactoryTest {

    private static final LocalDateTime CREATED = LocalDateTime.of(2025, 8, 5, 10, 0);

    private final OrderRecordFactory factory = new OrderRecordFactory();

    private static OrderLifecycle lifecycle(String category, LocalDateTime promisedAt) {
        return new OrderLifecycle("buyer", "seller", "ORD-1", "P1", "TXN-1", category, CREATED, promisedAt);
    }

    @Test
    void testNewOrderIsInProcessWithoutCompletionFields() {
        OrderRecord record = factory.build(lifecycle("Grocery", CREATED.plusHours(6)));

        assertEquals("In Process", record.orderStatus());
        assertEquals(LocalDate.of(2025, 8, 5), record.date());
        assertEquals(CREATED, record.updatedAt());
        assertNull(record.tatDif());
        assertNull(record.tatDiffDays());
        assertNull(record.dayDiff());
        assertNull(record.minDiff());
        assertEquals(360.0, record.tatTime());
        assertEquals(0.0, record.onTimeDelivery());
        assertNull(record.cancellationCode());
        assertEquals(1, record.noKey());
    }

    @Test
    void testFoodPromiseGetsGrace() {
        OrderLifecycle order = lifecycle("F&B", CREATED.plusMinutes(30));
        order.deliver(CREATED.plusMinutes(34));

        OrderRecord record = factory.build(order);

        assertEquals(CREATED.plusMinutes(35), record.promisedTime());
        assertEquals(35.0, record.tatTime());
        assertEquals(-60.0, record.tatDif());
        assertEquals(1.0, record.onTimeDelivery());
    }

    @Test
    void testMissingPromiseFallsBackToCreation() {
        OrderLifecycle order = lifecycle("F&B", null);

        assertEquals(CREATED, factory.build(order).promisedTime());
    }

    @Test
    void testLateDeliveryDifferences() {
        OrderLifecycle order = lifecycle("Electronics", CREATED.plusDays(2));
        order.deliver(CREATED.plusDays(3).plusHours(5).plusSeconds(30));

        OrderRecord record = factory.build(order);

        assertEquals("Delivered", record.orderStatus());
        assertEquals(order.completedAt(), record.updatedAt());
        assertEquals(29.0 * 3600 + 30, record.tatDif());
        assertEquals(1.0, record.tatDiffDays());
        assertEquals(3.0, record.dayDiff());
        assertEquals(3.0 * 1440 + 300, record.minDiff());
        assertEquals(0.0, record.onTimeDelivery());
    }

    @Test
    void testPartDeliveredKeepsCreationAsUpdate() {
        OrderLifecycle order = lifecycle("Grocery", CREATED.plusHours(6));
        order.partDeliver(CREATED.plusHours(5));

        OrderRecord record = factory.build(order);

        assertEquals("Part Delivered", record.orderStatus());
        assertEquals(CREATED, record.updatedAt());
        assertEquals(0.0, record.onTimeDelivery());
        assertEquals(300.0, record.minDiff());
    }

    @Test
    void testCancelledOrderUsesCancellationTime() {
        OrderLifecycle order = lifecycle("Grocery", CREATED.plusHours(6));
        order.cancel(CREATED.plusHours(1), "ONDC-007", false);

        OrderRecord record = factory.build(order);

        assertEquals(OrderStatus.CANCELLED.label(), record.orderStatus());
        assertEquals(CREATED.plusHours(1), record.updatedAt());
        assertEquals("007", record.cancellationCode());
        assertNull(record.tatDif());
    }

    @Test
    void testCancellationCodeNormalization() {
        assertEquals("001", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, "001", false));
        assertEquals("022", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, "XYZ022", false));
        assertEquals("052", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, "023", false));
        assertEquals("052", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, "CUSTOM-CANCEL", false));
        assertEquals("052", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, "7", false));
        assertEquals("050", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, null, false));
        assertEquals("013", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, null, true));
        assertEquals("004", OrderRecordFactory.cancellationCode(OrderStatus.CANCELLED, "004", true));
        assertNull(OrderRecordFactory.cancellationCode(OrderStatus.DELIVERED, "001", false));
    }

    @Test
    void testIdentityAndDimensionsCarriedThrough() {
        OrderLifecycle order = lifecycle("F&B", CREATED.plusMinutes(30))
            .withSeller("Corner Cafe", "560001")
            .withDelivery("ONDC:RET11", "560034");
        order.readyToShip(CREATED.plusMinutes(5));
        order.ship(CREATED.plusMinutes(10));

        OrderRecord record = factory.build(order);

        assertEquals("buyer", record.buyerNp());
        assertEquals("TXN-1", record.networkTransactionId());
        assertEquals("Corner Cafe", record.sellerName());
        assertEquals("560034", record.deliveryPincode());
        assertEquals("ONDC:RET11", record.domain());
        assertEquals("F&B", record.consolidatedCategory());
        assertEquals(CREATED.plusMinutes(5), record.readyToShipAt());
        assertEquals(CREATED.plusMinutes(10), record.shippedAt());
    }
}
