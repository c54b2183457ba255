package com.recnos.sensors.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record QueryTimeoutDto(
    @JsonProperty("error") String error,
    @JsonProperty("missingLocations") List<String> missingLocations
) {
}
