package com.recnos.ratetelemetry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EventAckDto(
    @JsonProperty("message") String message,
    @JsonProperty("user") String user,
    @JsonProperty("age") int age
) {
}
