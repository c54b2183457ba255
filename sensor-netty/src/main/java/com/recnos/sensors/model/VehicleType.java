package com.recnos.sensors.model;

import java.util.Optional;

/**
 * Vehicle categories a sensor can report. Labels on the wire are lower case.
 */
public enum VehicleType {
    CAR("car"),
    MOTORCYCLE("motorcycle"),
    BUS("bus");

    private final String label;

    VehicleType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a wire label. Matching is exact, so "Car" is not a car.
     *
     * @param label raw label from a sensor batch, may be null
     * @return the matching type, or empty for anything unrecognized
     */
    public static Optional<VehicleType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (VehicleType type : values()) {
            if (type.label.equals(label)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
