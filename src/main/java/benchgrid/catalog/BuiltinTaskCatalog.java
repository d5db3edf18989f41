package benchgrid.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Task catalog backed by the in-process benchmark bodies.
 * Individual bodies can be replaced (tests swap in fast or failing ones).
 */
public final class BuiltinTaskCatalog implements TaskCatalog {

    private static final Logger log = LoggerFactory.getLogger(BuiltinTaskCatalog.class);

    private final Map<TaskType, BenchmarkTask> tasks = new EnumMap<>(TaskType.class);

    private BuiltinTaskCatalog(Path ioFile) {
        tasks.put(TaskType.MATMUL, new MatmulBenchmark());
        tasks.put(TaskType.PRIMES, new PrimesBenchmark());
        tasks.put(TaskType.ARRAY, new ArraySortBenchmark());
        tasks.put(TaskType.FILEIO, new FileIoBenchmark(ioFile));
    }

    /**
     * Catalog with all built-in bodies.
     *
     * @param ioFile scratch file for the fileIO body, or null for a temp file
     */
    public static BuiltinTaskCatalog create(Path ioFile) {
        try {
            Path file = ioFile != null ? ioFile : FileIoBenchmark.defaultScratchFile();
            log.debug("fileIO scratch file: {}", file);
            return new BuiltinTaskCatalog(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create fileIO scratch file", e);
        }
    }

    /**
     * Replace the body for one task type.
     */
    public BuiltinTaskCatalog with(TaskType type, BenchmarkTask task) {
        tasks.put(type, task);
        return this;
    }

    @Override
    public double execute(String taskType, Map<String, Number> parameters) throws TaskExecutionException {
        Optional<TaskType> type = TaskType.fromWireName(taskType);
        if (type.isEmpty()) {
            throw new UnknownTaskTypeException(taskType);
        }
        BenchmarkTask task = tasks.get(type.get());

        long start = System.nanoTime();
        try {
            task.run(parameters);
        } catch (IllegalArgumentException e) {
            throw new TaskExecutionException(taskType, "bad parameters for " + taskType + ": " + e.getMessage(), e);
        } catch (Exception e) {
            throw new TaskExecutionException(taskType, taskType + " failed: " + e.getMessage(), e);
        }
        return (System.nanoTime() - start) / 1_000_000_000.0;
    }
}
