package com.recnos.sensors.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable vehicle counts keyed by {@link VehicleType}.
 * Every type is always present, with zero for types never observed.
 */
public final class CountMap {

    public static final CountMap EMPTY = new CountMap(0, 0, 0);

    private final long cars;
    private final long motorcycles;
    private final long buses;

    public CountMap(long cars, long motorcycles, long buses) {
        if (cars < 0 || motorcycles < 0 || buses < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
        this.cars = cars;
        this.motorcycles = motorcycles;
        this.buses = buses;
    }

    public static CountMap of(Map<VehicleType, Long> counts) {
        return new CountMap(
                counts.getOrDefault(VehicleType.CAR, 0L),
                counts.getOrDefault(VehicleType.MOTORCYCLE, 0L),
                counts.getOrDefault(VehicleType.BUS, 0L));
    }

    public long get(VehicleType type) {
        switch (type) {
            case CAR:
                return cars;
            case MOTORCYCLE:
                return motorcycles;
            case BUS:
                return buses;
            default:
                throw new IllegalArgumentException("Unsupported vehicle type: " + type);
        }
    }

    public long total() {
        return cars + motorcycles + buses;
    }

    public CountMap plus(CountMap other) {
        return new CountMap(cars + other.cars, motorcycles + other.motorcycles, buses + other.buses);
    }

    public Map<VehicleType, Long> asMap() {
        EnumMap<VehicleType, Long> map = new EnumMap<>(VehicleType.class);
        for (VehicleType type : VehicleType.values()) {
            map.put(type, get(type));
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Wire view keyed by label, in declaration order (car, motorcycle, bus).
     */
    public Map<String, Long> toLabelMap() {
        Map<String, Long> map = new LinkedHashMap<>();
        for (VehicleType type : VehicleType.values()) {
            map.put(type.label(), get(type));
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CountMap)) return false;
        CountMap that = (CountMap) o;
        return cars == that.cars && motorcycles == that.motorcycles && buses == that.buses;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cars, motorcycles, buses);
    }

    @Override
    public String toString() {
        return "CountMap{car=" + cars + ", motorcycle=" + motorcycles + ", bus=" + buses + "}";
    }
}
