package benchgrid.catalog;

import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Naive triple-loop multiply of two random size x size matrices.
 */
final class MatmulBenchmark implements BenchmarkTask {

    @Override
    public void run(Map<String, Number> parameters) {
        int n = BenchmarkTask.intParam(parameters, "size");
        multiply(random(n), random(n));
    }

    static long[][] multiply(long[][] a, long[][] b) {
        int n = a.length;
        long[][] result = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                long sum = 0;
                for (int k = 0; k < n; k++) {
                    sum += a[i][k] * b[k][j];
                }
                result[i][j] = sum;
            }
        }
        return result;
    }

    private static long[][] random(int n) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        long[][] m = new long[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                m[i][j] = rnd.nextInt(-32767, 32768);
            }
        }
        return m;
    }
}
