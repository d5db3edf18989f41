package benchgrid.logger.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * On-disk snapshot format.
 */
public record ExportDocument(
        @JsonProperty("events") List<LifecycleEvent> events,
        @JsonProperty("tasks") Map<String, TaskInstance> tasks,
        @JsonProperty("export_time") double exportTime,
        @JsonProperty("export_datetime") String exportDatetime) {

    public static ExportDocument of(LogSnapshot snapshot, double exportTime, String exportDatetime) {
        return new ExportDocument(snapshot.events(), snapshot.tasks(), exportTime, exportDatetime);
    }
}
