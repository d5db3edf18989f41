package benchgrid.catalog;

/**
 * Raised when a task body fails. Ends the worker that ran it; the scheduler
 * only notices the missing FINISH.
 */
public class TaskExecutionException extends Exception {

    private final String taskType;

    public TaskExecutionException(String taskType, String message) {
        super(message);
        this.taskType = taskType;
    }

    public TaskExecutionException(String taskType, String message, Throwable cause) {
        super(message, cause);
        this.taskType = taskType;
    }

    public String taskType() {
        return taskType;
    }
}
