package com.genderai.server.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.genderai.server.service.HealthSnapshot;
import com.genderai.server.util.RetryHints;

import java.time.Instant;

public class HealthResponse {
    @JsonProperty("status")
    public String status;

    @JsonProperty("model_loaded")
    public boolean modelLoaded;

    @JsonProperty("processor_loaded")
    public boolean processorLoaded;

    @JsonProperty("detector_loaded")
    public boolean detectorLoaded;

    @JsonProperty("load_state")
    public String loadState;

    @JsonProperty("retry_after_seconds")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public Long retryAfterSeconds;

    public static HealthResponse from(HealthSnapshot snapshot, Instant now) {
        HealthResponse r = new HealthResponse();
        r.status = snapshot.isHealthy() ? "healthy" : "unhealthy";
        r.modelLoaded = snapshot.isClassifierLoaded();
        r.processorLoaded = snapshot.isPreprocessorLoaded();
        r.detectorLoaded = snapshot.isDetectorLoaded();
        r.loadState = snapshot.getLoadState().name().toLowerCase();
        if (snapshot.getRetryAfter() != null) {
            r.retryAfterSeconds = RetryHints.secondsUntil(now, snapshot.getRetryAfter());
        }
        return r;
    }
}
