package com.ordermetrics.streams.model;

/**
 * Every metric a {@link MetricsRecord} carries, in output order, with the exact
 * column names the reporting layer reads.
 */
public enum Metric {
    // Status split
    CONFIRMED("Confirmed", Aggregation.SUM),
    DELIVERED("Delivered", Aggregation.SUM),
    CANCELLED("Cancelled", Aggregation.SUM),
    IN_PROCESS("In Process", Aggregation.SUM),
    PART_DELIVERED("Part Delivered", Aggregation.SUM),
    CANCELLATION_CODE_CAL("Cancellation code cal", Aggregation.SUM),

    // TAT breach
    TAT_BREACH("Tat breach", Aggregation.SUM),
    DELIVERED_WITH_TAT("Delivered with TAT", Aggregation.SUM),
    DELIVERED_BEYOND_TAT("Delivered beyond TAT", Aggregation.SUM),
    DBO("DBO", Aggregation.SUM),

    // Breach duration
    BREACH_MINS("Breach (mins)", Aggregation.AVERAGE),
    BREACH_HRS("Breach (hrs)", Aggregation.AVERAGE),
    BREACH_DAYS("Breach (days)", Aggregation.AVERAGE),

    // Delivery ageing
    SAME_DAY("Same Day", Aggregation.SUM),
    NEXT_DAY("Next Day", Aggregation.SUM),
    DAY_PLUS_2("Day + 2", Aggregation.SUM),
    MORE_THAN_2_DAYS("More than 2 Days", Aggregation.SUM),
    ON_TIME_DELIVERIES("On time deliveries", Aggregation.SUM),

    // Averages
    AVERAGE_TAT_MINS("Average TAT (in mins)", Aggregation.AVERAGE),
    AVG_DELIVERY_MINS("Avg Delivery (mins)", Aggregation.AVERAGE),
    FNB_MINS_DIFF("F&B mins diff", Aggregation.AVERAGE),

    // F&B minute buckets
    WITHIN_15_MINS("Within 15 mins", Aggregation.SUM),
    MINS_15_30("15 - 30 mins", Aggregation.SUM),
    MINS_30_45("30 - 45 mins", Aggregation.SUM),
    MINS_45_60("45 - 60 mins", Aggregation.SUM),
    MINS_60_120("60 - 120 mins", Aggregation.SUM),
    ABOVE_120_MINS("Above 120 mins", Aggregation.SUM),

    // TAT seconds buckets
    TAT_UNDER_5_MINS("TAT < 5 mins", Aggregation.SUM),
    TAT_5_15_MINS("TAT 5-15 mins", Aggregation.SUM),
    TAT_15_30_MINS("TAT 15-30 mins", Aggregation.SUM),
    TAT_30_60_MINS("TAT 30-60 mins", Aggregation.SUM),
    TAT_OVER_60_MINS("TAT > 60 mins", Aggregation.SUM),

    // TAT day buckets
    TAT_PLUS_1("TAT+1", Aggregation.SUM),
    TAT_PLUS_2("TAT + 2", Aggregation.SUM),
    TAT_PLUS_3("TAT + 3", Aggregation.SUM),
    TAT_PLUS_4("TAT + 4", Aggregation.SUM),
    TAT_OVER_4("TAT > 4", Aggregation.SUM),

    TAT_SAME_DAY("TAT (Same day)", Aggregation.SUM),
    NON_FNB_DAYS_DIFF("Non F&B days diff", Aggregation.AVERAGE),
    SHIPPED_MARK("Shipped mark", Aggregation.SUM);

    /**
     * How a dashboard rolls the metric up across records.
     * AVERAGE metrics are null when not applicable so they drop out of the mean.
     */
    public enum Aggregation {
        SUM,
        AVERAGE
    }

    private final String label;
    private final Aggregation aggregation;

    Metric(String label, Aggregation aggregation) {
        this.label = label;
        this.aggregation = aggregation;
    }

    public String label() {
        return label;
    }

    public Aggregation aggregation() {
        return aggregation;
    }
}
