package com.recnos.sensors.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One sensor submission: the raw vehicle labels seen at a location.
 */
public record SensorBatch(String location, List<String> vehicles) {

    public SensorBatch {
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(vehicles, "vehicles");
        if (location.isBlank()) {
            throw new IllegalArgumentException("location must not be blank");
        }
        // null labels are allowed here and counted as unknown by the parser
        vehicles = Collections.unmodifiableList(new ArrayList<>(vehicles));
    }
}
