package benchgrid.scheduler.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time progress of a scheduler run, served to STATUS|REQUEST.
 */
public record SchedulerStatus(
        @JsonProperty("scheduler") String scheduler,
        @JsonProperty("total") int total,
        @JsonProperty("waiting") int waiting,
        @JsonProperty("in_flight") int inFlight,
        @JsonProperty("finished") int finished,
        @JsonProperty("abandoned") int abandoned,
        @JsonProperty("nodes") int nodes,
        @JsonProperty("complete") boolean complete) {
}
