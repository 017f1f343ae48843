package com.ordermetrics.common;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.Serdes;
import org.apache.kafka.streams.StreamsConfig;
import org.apache.kafka.streams.errors.LogAndContinueExceptionHandler;
import org.apache.kafka.streams.errors.LogAndContinueProcessingExceptionHandler;

import java.util.Properties;

/**
 * Centralized Kafka configuration for producers and streams.
 * Record values are JSON; serializers are supplied by the caller.
 */
public class KafkaConfig {

    private static final String BOOTSTRAP_SERVERS =
        System.getenv().getOrDefault(
            "KAFKA_BOOTSTRAP_SERVERS",
            "localhost:9092"
        );

    private static final String ORDER_LEVEL_TOPIC =
        System.getenv().getOrDefault("ORDER_LEVEL_TOPIC", "order.level");

    private static final String ORDER_METRICS_TOPIC =
        System.getenv().getOrDefault("ORDER_METRICS_TOPIC", "order.metrics");

    /**
     * Create Kafka producer configuration.
     *
     * @param clientId Unique client identifier
     * @return Producer properties
     */
    public static Properties createProducerConfig(String clientId) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, BOOTSTRAP_SERVERS);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);

        // Producer reliability settings
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, "3");
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "1");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        return props;
    }

    /**
     * Create Kafka Streams configuration.
     *
     * @param applicationId Streams application identifier
     * @return Streams properties
     */
    public static Properties createStreamsConfig(String applicationId) {
        return createStreamsConfig(applicationId, null);
    }

    /**
     * Create Kafka Streams configuration with optional application server.
     *
     * @param applicationId Streams application identifier
     * @param applicationServer Optional application server (host:port) for Interactive Queries
     * @return Streams properties
     */
    public static Properties createStreamsConfig(String applicationId, String applicationServer) {
        Properties props = new Properties();
        props.put(StreamsConfig.APPLICATION_ID_CONFIG, applicationId);
        props.put(StreamsConfig.BOOTSTRAP_SERVERS_CONFIG, BOOTSTRAP_SERVERS);
        props.put(StreamsConfig.DEFAULT_KEY_SERDE_CLASS_CONFIG, Serdes.String().getClass());
        props.put(StreamsConfig.DEFAULT_VALUE_SERDE_CLASS_CONFIG, Serdes.String().getClass());

        // Streams settings
        props.put(StreamsConfig.PROCESSING_GUARANTEE_CONFIG, StreamsConfig.EXACTLY_ONCE_V2);
        props.put(StreamsConfig.STATE_DIR_CONFIG, "/tmp/kafka-streams/" + applicationId);
        props.put(StreamsConfig.CACHE_MAX_BYTES_BUFFERING_CONFIG, 10 * 1024 * 1024L); // 10MB cache

        // Malformed order records are skipped here and never reach the derivation engine
        props.put(StreamsConfig.DEFAULT_DESERIALIZATION_EXCEPTION_HANDLER_CLASS_CONFIG,
            LogAndContinueExceptionHandler.class);
        props.put(StreamsConfig.PROCESSING_EXCEPTION_HANDLER_CLASS_CONFIG,
            LogAndContinueProcessingExceptionHandler.class);
        // No built-in "continue" handler exists for production exceptions
        props.put(StreamsConfig.DEFAULT_PRODUCTION_EXCEPTION_HANDLER_CLASS_CONFIG,
            "com.ordermetrics.streams.handlers.LogAndContinueProductionHandler");

        if (applicationServer != null && !applicationServer.isEmpty()) {
            props.put(StreamsConfig.APPLICATION_SERVER_CONFIG, applicationServer);
        }

        return props;
    }

    /**
     * Get the configured Kafka bootstrap servers.
     *
     * @return Bootstrap servers string
     */
    public static String getBootstrapServers() {
        return BOOTSTRAP_SERVERS;
    }

    /**
     * Topic carrying the current state of each order (ingestion source output).
     */
    public static String getOrderLevelTopic() {
        return ORDER_LEVEL_TOPIC;
    }

    /**
     * Topic receiving one derived metrics record per ingested order record.
     */
    public static String getOrderMetricsTopic() {
        return ORDER_METRICS_TOPIC;
    }
}
