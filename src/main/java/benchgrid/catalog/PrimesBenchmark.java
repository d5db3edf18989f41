package benchgrid.catalog;

import java.util.BitSet;
import java.util.Map;

/**
 * Sieve of Eratosthenes up to max_n (inclusive).
 */
final class PrimesBenchmark implements BenchmarkTask {

    @Override
    public void run(Map<String, Number> parameters) {
        countPrimes(BenchmarkTask.intParam(parameters, "max_n"));
    }

    static int countPrimes(int maxN) {
        if (maxN < 2) {
            return 0;
        }
        BitSet composite = new BitSet(maxN + 1);
        for (long p = 2; p * p <= maxN; p++) {
            if (!composite.get((int) p)) {
                for (long m = p * p; m <= maxN; m += p) {
                    composite.set((int) m);
                }
            }
        }
        // indices 0 and 1 are never marked
        return maxN + 1 - 2 - composite.cardinality();
    }
}
