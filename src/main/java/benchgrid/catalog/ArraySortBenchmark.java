package benchgrid.catalog;

import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Sorts array_size random ints.
 */
final class ArraySortBenchmark implements BenchmarkTask {

    @Override
    public void run(Map<String, Number> parameters) {
        int size = BenchmarkTask.intParam(parameters, "array_size");
        int[] values = ThreadLocalRandom.current().ints(size).toArray();
        Arrays.sort(values);
    }
}
