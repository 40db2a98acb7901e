/* (C)2026 */
package com.ammann.wearable.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Central registry of REST API path constants used across the JAX-RS resources.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1. */
    public static final String BASE_URL_V1 = "/api/v1";

    /**
     * Participant time series ingestion endpoints
     */
    public static final class Participants {
        private Participants() {}

        public static final String BASE = "/participants";
    }

    /**
     * Analysis run endpoints
     */
    public static final class Analysis {
        private Analysis() {}

        public static final String BASE = "/analysis/runs";
        public static final String LATEST = "/latest";
        public static final String LATEST_PARTICIPANT = LATEST + "/participants/{participantId}";
        public static final String ABORT = "/abort";
    }
}
