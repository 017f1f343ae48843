package com.ordermetrics.streams;

import com.ordermetrics.common.KafkaConfig;
import com.ordermetrics.common.ReportingConfig;
import com.ordermetrics.streams.derivation.DerivationPass;
import com.ordermetrics.streams.derivation.MetricsDerivationEngine;
import org.apache.kafka.streams.KafkaStreams;
import org.apache.kafka.streams.Topology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Main application for the order metrics processor.
 * Materializes current order state and serves metrics derived from it.
 */
public class StreamsApplication {

    private static final Logger LOG = LoggerFactory.getLogger(StreamsApplication.class);
    private static final String APPLICATION_ID = "order-metrics-processor";

    public static void main(String[] args) {
        LOG.info("=".repeat(60));
        LOG.info("Order Metrics - Kafka Streams Processor");
        LOG.info("=".repeat(60));

        ReportingConfig reportingConfig = ReportingConfig.fromEnvironment();

        Topology topology = OrderMetricsTopology.build(reportingConfig.clock());

        // Get application.server from environment variable for Interactive Queries
        String applicationServer = System.getenv("APPLICATION_SERVER");

        Properties props = KafkaConfig.createStreamsConfig(APPLICATION_ID, applicationServer);
        LOG.info("Streams configuration:");
        LOG.info("  Application ID: {}", APPLICATION_ID);
        LOG.info("  Bootstrap Servers: {}", KafkaConfig.getBootstrapServers());
        LOG.info("  Order topic: {}", KafkaConfig.getOrderLevelTopic());
        LOG.info("  Metrics topic: {}", KafkaConfig.getOrderMetricsTopic());
        LOG.info("  Reporting zone: {}", reportingConfig.zone());
        LOG.info("  Reporting window start: {}", reportingConfig.windowStart());
        if (applicationServer != null && !applicationServer.isEmpty()) {
            LOG.info("  Application Server: {}", applicationServer);
        } else {
            LOG.warn("  Application Server: NOT SET (Interactive Queries only see this instance's partitions)");
        }

        final KafkaStreams streams = new KafkaStreams(topology, props);
        final CountDownLatch latch = new CountDownLatch(1);

        final InteractiveQueryServer queryServer = new InteractiveQueryServer(
            OrderStateReader.forStreams(streams),
            new DerivationPass(new MetricsDerivationEngine()),
            reportingConfig
        );

        Runtime.getRuntime().addShutdownHook(new Thread("streams-shutdown-hook") {
            @Override
            public void run() {
                LOG.info("Shutting down Kafka Streams application");
                queryServer.stop();
                streams.close();
                latch.countDown();
                LOG.info("Kafka Streams application shutdown complete");
            }
        });

        try {
            LOG.info("Starting Kafka Streams...");
            streams.start();
            LOG.info("Kafka Streams started successfully");
            LOG.info("State: {}", streams.state());

            // Wait for streams to be in RUNNING state before starting query server
            while (streams.state() != KafkaStreams.State.RUNNING) {
                LOG.info("Waiting for streams to reach RUNNING state. Current state: {}", streams.state());
                Thread.sleep(1000);
            }

            queryServer.start();

            latch.await();

        } catch (IOException e) {
            LOG.error("Failed to start Interactive Query Server", e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Application interrupted");
        } catch (Exception e) {
            LOG.error("Unexpected error", e);
            System.exit(1);
        }

        System.exit(0);
    }
}
