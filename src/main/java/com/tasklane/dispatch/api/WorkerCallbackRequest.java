package com.tasklane.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the internal worker callbacks. Heartbeats use {@code progress_percent} and {@code current_step};
 * log appends use {@code kind} and {@code message}.
 */
public record WorkerCallbackRequest(
    @JsonProperty("progress_percent") Integer progressPercent,
    @JsonProperty("current_step") String currentStep,
    String kind,
    String message
) {}
