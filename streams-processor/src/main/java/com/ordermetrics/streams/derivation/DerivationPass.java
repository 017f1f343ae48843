package com.ordermetrics.streams.derivation;

import com.ordermetrics.common.model.OrderRecord;
import com.ordermetrics.streams.model.MetricsRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Evaluates a whole set of order records against one captured {@code now}, so every
 * in-flight order in the result is aged from the same instant.
 * Records are independent; large passes are spread over the common fork-join pool.
 */
public class DerivationPass {

    private static final Logger LOG = LoggerFactory.getLogger(DerivationPass.class);

    static final int PARALLEL_THRESHOLD = 1_000;

    private final MetricsDerivationEngine engine;

    public DerivationPass(MetricsDerivationEngine engine) {
        this.engine = engine;
    }

    /**
     * @return one metrics record per order, in the iteration order of {@code orders}
     */
    public List<MetricsRecord> run(Collection<OrderRecord> orders, LocalDateTime now) {
        long start = System.nanoTime();
        Stream<OrderRecord> stream = orders.size() >= PARALLEL_THRESHOLD
            ? orders.parallelStream()
            : orders.stream();

        List<MetricsRecord> results = stream
            .map(order -> engine.derive(order, now))
            .toList();

        LOG.debug("Derived metrics for {} orders as of {} in {} ms",
            results.size(), now, (System.nanoTime() - start) / 1_000_000);
        return results;
    }
}
