package com.ordermetrics.common.serde;

import com.ordermetrics.common.model.OrderRecord;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class JsonSerdeTest {

    private final JsonSerde<OrderRecord> serde = new JsonSerde<>(OrderRecord.class);

    @Test
    void testReadsSnakeCaseOrderRecord() {
        String json = "{"
            + "\"seller_np\":\"seller.example.com\","
            + "\"network_order_id\":\"ORD-1\","
            + "\"order_status\":\"Delivered\","
            + "\"category\":\"F&B\","
            + "\"date\":\"2025-08-02\","
            + "\"created_at\":\"2025-08-02T10:00:00\","
            + "\"updated_at\":\"2025-08-02T10:22:00\","
            + "\"min_diff\":22.0,"
            + "\"no_key\":1,"
            + "\"unexpected_column\":\"ignored\""
            + "}";

        OrderRecord order = serde.deserializer().deserialize("order.level", json.getBytes(StandardCharsets.UTF_8));

        assertEquals("seller.example.com", order.sellerNp());
        assertEquals("Delivered", order.orderStatus());
        assertEquals(LocalDate.of(2025, 8, 2), order.date());
        assertEquals(LocalDateTime.of(2025, 8, 2, 10, 22), order.updatedAt());
        assertEquals(22.0, order.minDiff());
        assertEquals(1, order.noKey());
        assertNull(order.tatDif());
        assertNull(order.shippedAt());
    }

    @Test
    void testWritesIsoTimestamps() {
        OrderRecord order = OrderRecord.builder()
            .createdAt(LocalDateTime.of(2025, 1, 1, 0, 0, 30))
            .build();

        String json = new String(serde.serializer().serialize("order.level", order), StandardCharsets.UTF_8);

        assertTrue(json.contains("\"created_at\":\"2025-01-01T00:00:30\""), json);
        assertTrue(json.contains("\"no_key\":1"), json);
    }

    @Test
    void testNullAndEmptyPayloads() {
        assertNull(serde.serializer().serialize("order.level", null));
        assertNull(serde.deserializer().deserialize("order.level", new byte[0]));
    }

    @Test
    void testMalformedPayloadFails() {
        byte[] payload = "{\"created_at\":\"not-a-timestamp\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(RuntimeException.class, () -> serde.deserializer().deserialize("order.level", payload));
    }
}
