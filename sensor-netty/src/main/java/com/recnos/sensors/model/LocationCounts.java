package com.recnos.sensors.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One report entry. The data map is keyed by vehicle label and may hold fewer
 * than all types once a vehicle filter has been applied.
 */
public record LocationCounts(String location, Map<String, Long> data) {

    public LocationCounts {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(data, "data");
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static LocationCounts of(String location, CountMap counts) {
        return new LocationCounts(location, counts.toLabelMap());
    }
}
