package com.ordermetrics.common;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Map;

/**
 * Settings that shape how metrics are evaluated and reported.
 *
 * @param zone zone used to read the wall clock as a timezone-naive timestamp,
 *             the same zone the ingested timestamps are expressed in
 * @param windowStart earliest order date exposed by the reporting endpoints
 * @param queryServerPort port of the interactive query HTTP server
 */
public record ReportingConfig(ZoneId zone, LocalDate windowStart, int queryServerPort) {

    public static final String DEFAULT_ZONE = "UTC";
    public static final String DEFAULT_WINDOW_START = "2025-08-01";
    public static final int DEFAULT_QUERY_SERVER_PORT = 7070;

    public static ReportingConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build the configuration from an environment map, falling back to defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ReportingConfig fromEnvironment(Map<String, String> env) {
        String zone = env.getOrDefault("REPORTING_ZONE", DEFAULT_ZONE);
        String windowStart = env.getOrDefault("REPORTING_WINDOW_START", DEFAULT_WINDOW_START);
        String port = env.getOrDefault("QUERY_SERVER_PORT", String.valueOf(DEFAULT_QUERY_SERVER_PORT));
        try {
            return new ReportingConfig(
                ZoneId.of(zone),
                LocalDate.parse(windowStart),
                Integer.parseInt(port)
            );
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid reporting configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Wall clock in the reporting zone.
     */
    public Clock clock() {
        return Clock.system(zone);
    }
}
