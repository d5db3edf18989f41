package benchgrid.scheduler.config;

/**
 * Which end of the waiting queue a task request pops from.
 */
public enum PopOrder {
    /** Pop the most recently seeded task (tail of the list) */
    LIFO,
    /** Pop the first seeded task (head of the list) */
    FIFO
}
