/* (C)2026 */
package com.ammann.impact.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * REST API path constants shared by the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Temporal impact analysis endpoints, relative to {@link #BASE_URL_V1}.
     */
    public static final class Temporal {
        private Temporal() {}

        public static final String BASE = "/events/{eventId}/temporal";
        public static final String WINDOWS = "/windows";
        public static final String OPTIMAL_WINDOW_SIZE = "/optimal-window-size";
        public static final String PERIODICITY = "/periodicity";
        public static final String SEASONALITY = "/seasonality";
        public static final String BREAKPOINTS = "/breakpoints";
        public static final String COMPARISON = "/comparison";
        public static final String ROLLING_CORRELATION = "/rolling-correlation";
        public static final String CHANGE_POINT_SIGNIFICANCE = "/change-point-significance";
        public static final String AGGREGATION = "/aggregation";
        public static final String GAPS = "/gaps";
        public static final String FEATURES = "/features";
        public static final String EVENT_WINDOWS = "/event-windows";
        public static final String IMPACT_TIMING = "/impact-timing";
    }
}
