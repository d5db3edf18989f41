package benchgrid.catalog;

import java.util.Map;

/**
 * One executable benchmark body.
 */
@FunctionalInterface
public interface BenchmarkTask {

    void run(Map<String, Number> parameters) throws Exception;

    /**
     * Read a required integer parameter.
     */
    static int intParam(Map<String, Number> parameters, String name) {
        Number value = parameters.get(name);
        if (value == null) {
            throw new IllegalArgumentException("missing parameter '" + name + "'");
        }
        if (value.doubleValue() < 0) {
            throw new IllegalArgumentException("parameter '" + name + "' must not be negative");
        }
        return value.intValue();
    }
}
