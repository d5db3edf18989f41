package benchgrid.catalog;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Benchmark task types known to the cluster.
 * The wire name is what travels in scheduler replies and logger events.
 */
public enum TaskType {
    /** Naive n x n integer matrix multiply */
    MATMUL("matmul", Map.of("size", 425)),
    /** Sieve of Eratosthenes up to max_n */
    PRIMES("primes", Map.of("max_n", 2_400_000)),
    /** Sort of a random int array */
    ARRAY("array", Map.of("array_size", 5_000_000)),
    /** Random 4 KiB read/write cycles against a scratch file */
    FILEIO("fileIO", Map.of("num_rw", 1_000_000));

    private final String wireName;
    private final Map<String, Number> defaultParameters;

    TaskType(String wireName, Map<String, Number> defaultParameters) {
        this.wireName = wireName;
        this.defaultParameters = defaultParameters;
    }

    public String wireName() {
        return wireName;
    }

    public Map<String, Number> defaultParameters() {
        return defaultParameters;
    }

    /**
     * Resolve a wire name. Matching is exact first, then case-insensitive on
     * either the wire name or the enum constant.
     */
    public static Optional<TaskType> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equals(trimmed))
                .findFirst()
                .or(() -> Arrays.stream(values())
                        .filter(t -> t.wireName.equalsIgnoreCase(trimmed) || t.name().equalsIgnoreCase(trimmed))
                        .findFirst());
    }

    @Override
    public String toString() {
        return wireName;
    }
}
