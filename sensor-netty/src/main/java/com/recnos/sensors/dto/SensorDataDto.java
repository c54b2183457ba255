package com.recnos.sensors.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Body of {@code POST /sensorapi/data}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SensorDataDto(
    @JsonProperty("location") String location,
    @JsonProperty("data") List<String> data
) {
}
