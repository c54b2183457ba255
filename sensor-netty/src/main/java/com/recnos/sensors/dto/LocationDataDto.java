package com.recnos.sensors.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.recnos.sensors.model.LocationCounts;

import java.util.Map;

public record LocationDataDto(
    @JsonProperty("location") String location,
    @JsonProperty("data") Map<String, Long> data
) {

    public static LocationDataDto from(LocationCounts counts) {
        return new LocationDataDto(counts.location(), counts.data());
    }
}
