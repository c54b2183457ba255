package com.recnos.sensors.service;

import com.recnos.sensors.model.CountMap;
import com.recnos.sensors.model.VehicleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the raw labels of a sensor batch into per-type counts.
 * Stateless and safe to share between threads.
 */
public class VehicleBatchParser {

    private static final Logger logger = LoggerFactory.getLogger(VehicleBatchParser.class);

    /**
     * Counts recognized labels. Unrecognized labels are logged and dropped.
     *
     * @param labels raw vehicle labels, in arrival order
     * @return counts with every vehicle type present
     */
    public CountMap parse(List<String> labels) {
        return tally(labels).counts();
    }

    /**
     * Same as {@link #parse(List)} but also reports how many labels were skipped.
     */
    public Tally tally(List<String> labels) {
        Map<VehicleType, Long> counts = new EnumMap<>(VehicleType.class);
        int unknown = 0;

        for (String label : labels) {
            Optional<VehicleType> type = VehicleType.fromLabel(label);
            if (type.isPresent()) {
                counts.merge(type.get(), 1L, Long::sum);
            } else {
                logger.debug("Unknown vehicle type: {}", label);
                unknown++;
            }
        }

        if (unknown > 0) {
            logger.warn("Skipped {} unknown vehicle label(s) out of {}", unknown, labels.size());
        }
        return new Tally(CountMap.of(counts), unknown);
    }

    /**
     * Parsed counts plus the size of the dropped "unknown" bucket.
     */
    public record Tally(CountMap counts, int unknown) {
    }
}
