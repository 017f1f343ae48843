package com.ordermetrics.streams.handlers;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.streams.errors.ErrorHandlerContext;
import org.apache.kafka.streams.errors.ProductionExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Production exception handler that logs and skips a record that cannot be written,
 * such as a metrics record rejected by the broker, instead of shutting down the
 * Kafka Streams application. The skipped order is derived again on its next update.
 */
public class LogAndContinueProductionHandler implements ProductionExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(LogAndContinueProductionHandler.class);

    @Override
    public ProductionExceptionHandlerResponse handle(ErrorHandlerContext context,
                                                      ProducerRecord<byte[], byte[]> record,
                                                      Exception exception) {
        LOG.error("Failed to produce to topic {} (partition {}) from processor {}. Skipping record and continuing.",
            record.topic(), record.partition(), context.processorNodeId(), exception);
        return ProductionExceptionHandlerResponse.CONTINUE;
    }

    @Override
    public void configure(Map<String, ?> configs) {
        // No configuration needed
    }
}
