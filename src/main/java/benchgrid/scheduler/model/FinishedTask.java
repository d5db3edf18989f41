package benchgrid.scheduler.model;

import benchgrid.catalog.TaskSpec;

/**
 * A task whose node reported FINISH, with the duration the node measured.
 */
public record FinishedTask(TaskSpec task, String node, double durationSeconds) {
}
