package com.recnos.ratetelemetry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.recnos.ratetelemetry.telemetry.Snapshot;

public record StatsDto(
    @JsonProperty("totalRequests") long totalRequests,
    @JsonProperty("requestsPerSecond") long requestsPerSecond,
    @JsonProperty("requestsPerMinute") long requestsPerMinute,
    @JsonProperty("timestamp") String timestamp
) {

    public static StatsDto from(Snapshot snapshot) {
        return new StatsDto(snapshot.total(), snapshot.ratePerSecond(), snapshot.ratePerMinute(),
                snapshot.timestamp().toString());
    }
}
