package benchgrid.catalog;

import java.util.Map;

/**
 * Named-task dispatch: look up a task type and run it with the given parameters.
 */
public interface TaskCatalog {

    /**
     * Execute a task.
     *
     * @param taskType   wire name of the task type (e.g. "matmul")
     * @param parameters numeric parameter bag
     * @return elapsed time in seconds as measured by the catalog
     * @throws TaskExecutionException if the type is unknown, a parameter is
     *                                missing or the body fails
     */
    double execute(String taskType, Map<String, Number> parameters) throws TaskExecutionException;
}
