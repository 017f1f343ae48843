package com.ordermetrics.streams.derivation;

import com.ordermetrics.streams.model.Metric;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;

/**
 * Ordered list of mutually exclusive buckets keyed on one numeric field.
 * Buckets are tried top to bottom and only the first match is set, so at most
 * one metric of the family is non-zero for a record.
 */
final class BucketFamily {

    /**
     * Value a matched bucket takes.
     */
    enum Weighting {
        /** The record's unit weight ({@code no_key}). */
        UNIT_WEIGHT,
        /** A plain 1 regardless of the unit weight. */
        PLAIN
    }

    private record Bucket(Metric metric, DoublePredicate predicate, Weighting weighting) {
    }

    private final String name;
    private final List<Bucket> buckets;

    private BucketFamily(String name, List<Bucket> buckets) {
        this.name = name;
        this.buckets = Collections.unmodifiableList(buckets);
    }

    static Builder named(String name) {
        return new Builder(name);
    }

    String name() {
        return name;
    }

    List<Metric> metrics() {
        return buckets.stream().map(Bucket::metric).toList();
    }

    /**
     * Write every metric of the family into {@code out}: 0 for all buckets, except the
     * first bucket whose predicate accepts {@code key}. A family that does not apply
     * to the record, or a null key, leaves every bucket at 0.
     *
     * @return the matched metric, or null if none matched
     */
    Metric apply(boolean applicable, Double key, Double unitWeight, Map<Metric, Double> out) {
        for (Bucket bucket : buckets) {
            out.put(bucket.metric(), 0.0);
        }
        if (!applicable || key == null) {
            return null;
        }
        for (Bucket bucket : buckets) {
            if (bucket.predicate().test(key)) {
                out.put(bucket.metric(), bucket.weighting() == Weighting.PLAIN ? Double.valueOf(1.0) : unitWeight);
                return bucket.metric();
            }
        }
        return null;
    }

    static final class Builder {
        private final String name;
        private final List<Bucket> buckets = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        Builder bucket(Metric metric, DoublePredicate predicate, Weighting weighting) {
            buckets.add(new Bucket(metric, predicate, weighting));
            return this;
        }

        Builder bucket(Metric metric, DoublePredicate predicate) {
            return bucket(metric, predicate, Weighting.UNIT_WEIGHT);
        }

        BucketFamily build() {
            return new BucketFamily(name, new ArrayList<>(buckets));
        }
    }
}
