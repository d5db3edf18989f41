package benchgrid.scheduler.model;

/**
 * Outcome of a TASK|FINISH report.
 */
public enum FinishResult {
    /** The node's in-flight task was moved to the finished list */
    COMPLETED,

    /** Same as COMPLETED, and it was the last task of the run */
    RUN_COMPLETE,

    /** The node had no in-flight task; the report is ignored */
    UNMATCHED
}
