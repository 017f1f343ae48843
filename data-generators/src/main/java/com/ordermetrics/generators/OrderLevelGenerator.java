package com.ordermetrics.generators;

import com.ordermetrics.common.KafkaConfig;
import com.ordermetrics.common.model.OrderKey;
import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.common.serde.JsonSerde;
import com.ordermetrics.generators.model.OrderLifecycle;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Order-level generator.
 * Generates 5-10 records/second on the order-level topic.
 * New orders start In Process; updates move them through ready-to-ship and shipped
 * to Delivered, Part Delivered or Cancelled.
 * Every record is the full current state of its order, keyed by the normalized order key.
 */
public class OrderLevelGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(OrderLevelGenerator.class);

    private static final int MIN_EVENTS_PER_SEC = 5;
    private static final int MAX_EVENTS_PER_SEC = 10;

    private static final List<String> BUYER_NPS = List.of(
        "buyer.paytm.com", "buyer.phonepe.com", "buyer.mystore.in", "buyer.ondc.example");
    private static final List<String> SELLER_NPS = List.of(
        "seller.kiranapro.com", "seller.bitsila.com", "seller.magicpin.in", "seller.ondc.example");
    private static final List<String> CATEGORIES = List.of(
        "F&B", "F&B", "Grocery", "Grocery", "Electronics", "Fashion", "Home & Kitchen");

    // Seller codes as reported; some carry prefixes or codes outside the known range
    private static final List<String> RAW_CANCELLATION_CODES = List.of(
        "001", "ONDC-002", "005", "012", "013", "019", "022", "999", "CUSTOM-CANCEL");

    // Promise windows per category
    private static final Map<String, Duration> PROMISE_WINDOWS = Map.of(
        "F&B", Duration.ofMinutes(40),
        "Grocery", Duration.ofHours(6)
    );
    private static final Duration DEFAULT_PROMISE_WINDOW = Duration.ofDays(3);

    private final Producer<String, OrderRecord> producer;
    private final String topic;
    private final Clock clock;
    private final OrderRecordFactory factory;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentHashMap<String, OrderLifecycle> activeOrders;
    private final Random random;

    public OrderLevelGenerator(Clock clock) {
        this(
            new KafkaProducer<>(
                KafkaConfig.createProducerConfig("order-level-generator"),
                new StringSerializer(),
                new JsonSerde<>(OrderRecord.class).serializer()
            ),
            KafkaConfig.getOrderLevelTopic(),
            clock,
            new Random()
        );
    }

    OrderLevelGenerator(Producer<String, OrderRecord> producer, String topic, Clock clock, Random random) {
        this.producer = producer;
        this.topic = topic;
        this.clock = clock;
        this.random = random;
        this.factory = new OrderRecordFactory();
        this.scheduler = Executors.newScheduledThreadPool(1);
        this.activeOrders = new ConcurrentHashMap<>();
        LOG.info("OrderLevelGenerator initialized for topic {}", topic);
    }

    public void start() {
        LOG.info("Starting OrderLevelGenerator - target rate: {}-{} events/sec",
            MIN_EVENTS_PER_SEC, MAX_EVENTS_PER_SEC);

        scheduler.scheduleAtFixedRate(() -> {
            try {
                tick();
            } catch (Exception e) {
                LOG.error("Error generating order records", e);
            }
        }, 0, 1, TimeUnit.SECONDS);

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down OrderLevelGenerator");
            scheduler.shutdown();
            producer.close();
        }));
    }

    /**
     * One second worth of records: a third new orders, the rest lifecycle updates.
     */
    void tick() {
        int eventsThisSecond = MIN_EVENTS_PER_SEC + random.nextInt(MAX_EVENTS_PER_SEC - MIN_EVENTS_PER_SEC + 1);
        int newOrders = eventsThisSecond / 3;

        for (int i = 0; i < newOrders; i++) {
            createNewOrder();
        }
        for (int i = newOrders; i < eventsThisSecond; i++) {
            updateExistingOrder();
        }
    }

    int activeOrderCount() {
        return activeOrders.size();
    }

    void createNewOrder() {
        LocalDateTime now = LocalDateTime.now(clock);
        String category = pick(CATEGORIES);
        Duration promiseWindow = PROMISE_WINDOWS.getOrDefault(category, DEFAULT_PROMISE_WINDOW);

        // Orders surface some time after creation, so completions land on both sides of the promise
        LocalDateTime createdAt = now.minusSeconds((long) (random.nextDouble() * promiseWindow.getSeconds()));
        String sellerNp = pick(SELLER_NPS);

        OrderLifecycle order = new OrderLifecycle(
            pick(BUYER_NPS),
            sellerNp,
            "ORD-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase(),
            "P" + (1 + random.nextInt(50)),
            UUID.randomUUID().toString(),
            category,
            createdAt,
            createdAt.plus(promiseWindow)
        )
            .withSeller(sellerNp.split("\\.")[1] + " store", pincode())
            .withDelivery(domainFor(category), pincode());

        OrderRecord record = factory.build(order);
        activeOrders.put(OrderKey.of(record).value(), order);
        send(record);

        LOG.debug("Created new order {} in {}", order.networkOrderId(), category);
    }

    void updateExistingOrder() {
        if (activeOrders.isEmpty()) {
            createNewOrder();
            return;
        }

        List<String> keys = new ArrayList<>(activeOrders.keySet());
        String key = keys.get(random.nextInt(keys.size()));
        OrderLifecycle order = activeOrders.get(key);
        if (order == null) {
            return;
        }

        advance(order, LocalDateTime.now(clock));
        send(factory.build(order));

        if (order.isTerminal()) {
            activeOrders.remove(key);
            LOG.debug("Order {} reached terminal state: {}", order.networkOrderId(), order.status().label());
        }
    }

    private void advance(OrderLifecycle order, LocalDateTime now) {
        double rand = random.nextDouble();

        if (order.readyToShipAt() == null) {
            if (rand < 0.03) {
                order.cancel(now, randomCancellationCode(), false);
            } else {
                order.readyToShip(now);
            }
        } else if (order.shippedAt() == null) {
            if (rand < 0.03) {
                order.cancel(now, randomCancellationCode(), false);
            } else {
                order.ship(now);
            }
        } else if (rand < 0.85) {
            order.deliver(now);
        } else if (rand < 0.90) {
            order.partDeliver(now);
        } else {
            // Returned to origin after shipping
            order.cancel(now, random.nextBoolean() ? null : randomCancellationCode(), true);
        }
    }

    private void send(OrderRecord record) {
        String key = OrderKey.of(record).value();
        ProducerRecord<String, OrderRecord> producerRecord = new ProducerRecord<>(topic, key, record);

        producer.send(producerRecord, (metadata, exception) -> {
            if (exception != null) {
                LOG.error("Failed to send order record for {}", key, exception);
            } else {
                LOG.debug("Sent order {} - status: {}", key, record.orderStatus());
            }
        });

        producer.flush();
    }

    private String randomCancellationCode() {
        if (random.nextDouble() < 0.2) {
            return null;
        }
        return pick(RAW_CANCELLATION_CODES);
    }

    private String pincode() {
        return String.valueOf(110001 + random.nextInt(700000));
    }

    private <T> T pick(List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    private static String domainFor(String category) {
        return OrderRecordFactory.FNB_CATEGORY.equals(category) ? "ONDC:RET11" : "ONDC:RET10";
    }
}
