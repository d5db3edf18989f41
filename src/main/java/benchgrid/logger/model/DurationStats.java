package benchgrid.logger.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Mean, min and max over completed instances. All zero when nothing completed.
 */
public record DurationStats(
        @JsonProperty("count") int count,
        @JsonProperty("mean") double mean,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max) {

    public static final DurationStats EMPTY = new DurationStats(0, 0, 0, 0);

    public static DurationStats of(Collection<Double> durations) {
        if (durations.isEmpty()) {
            return EMPTY;
        }
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double d : durations) {
            sum += d;
            min = Math.min(min, d);
            max = Math.max(max, d);
        }
        return new DurationStats(durations.size(), sum / durations.size(), min, max);
    }
}
