package benchgrid.worker;

/**
 * What a worker did before the scheduler told it to rest.
 */
public record WorkerReport(String nodeId, int tasksCompleted, double busySeconds) {
}
