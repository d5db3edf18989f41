package benchgrid.catalog;

/**
 * The catalog has no body for the requested task type.
 */
public class UnknownTaskTypeException extends TaskExecutionException {

    public UnknownTaskTypeException(String taskType) {
        super(taskType, "unknown task type '" + taskType + "'");
    }
}
