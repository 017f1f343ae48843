package com.ordermetrics.generators;

import com.ordermetrics.common.KafkaConfig;
import com.ordermetrics.common.ReportingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the synthetic order-level source.
 */
public class GeneratorMain {

    private static final Logger LOG = LoggerFactory.getLogger(GeneratorMain.class);

    public static void main(String[] args) {
        LOG.info("=".repeat(60));
        LOG.info("Order Metrics - Order Level Generator");
        LOG.info("=".repeat(60));

        ReportingConfig reportingConfig = ReportingConfig.fromEnvironment();
        LOG.info("Kafka bootstrap servers: {}", KafkaConfig.getBootstrapServers());
        LOG.info("Timestamps written in zone {}", reportingConfig.zone());

        OrderLevelGenerator generator = new OrderLevelGenerator(reportingConfig.clock());
        generator.start();

        LOG.info("Generator started, writing to {}", KafkaConfig.getOrderLevelTopic());

        // Keep main thread alive
        try {
            Thread.sleep(Long.MAX_VALUE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Generator main thread interrupted, shutting down...");
        }
    }
}
