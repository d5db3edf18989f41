package benchgrid.protocol;

import benchgrid.catalog.TaskSpec;
import benchgrid.catalog.TaskType;
import benchgrid.util.Jsons;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Formatting and parsing of scheduler-to-node replies.
 */
public final class SchedulerReply {

    public static final String REST = "REST";

    private static final String ASSIGN_PREFIX = "TASK|ASSIGN|";
    private static final String CONFIRM_PREFIX = "REGISTER|CONFIRM|";
    private static final String STATUS_PREFIX = "STATUS|REPORT|";

    private static final TypeReference<LinkedHashMap<String, Number>> PARAMS = new TypeReference<>() {
    };

    private SchedulerReply() {
    }

    public static String confirm(String schedulerHostname) {
        return CONFIRM_PREFIX + "true|" + schedulerHostname;
    }

    public static String assign(TaskSpec task) {
        try {
            return ASSIGN_PREFIX + task.type().wireName() + "|"
                    + Jsons.mapper().writeValueAsString(task.parameters());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode parameters of " + task, e);
        }
    }

    public static String rest() {
        return ASSIGN_PREFIX + REST;
    }

    public static String status(String json) {
        return STATUS_PREFIX + json;
    }

    /**
     * Parse a registration confirmation.
     *
     * @return scheduler hostname if the confirmation flag is {@code true}
     */
    public static Optional<String> parseConfirm(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String[] parts = line.trim().split("\\|", -1);
        if (parts.length >= 3 && "REGISTER".equals(parts[0]) && "CONFIRM".equals(parts[1])
                && "true".equals(parts[2])) {
            return Optional.of(parts.length >= 4 ? parts[3] : "");
        }
        return Optional.empty();
    }

    /**
     * Parse an assignment reply.
     *
     * @return the assigned task, or empty for the REST signal
     * @throws ProtocolException for malformed replies and unknown task types
     */
    public static Optional<TaskSpec> parseAssign(String line) {
        if (line == null || !line.startsWith(ASSIGN_PREFIX)) {
            throw new ProtocolException("unexpected reply to TASK|REQUEST: '" + line + "'");
        }
        String rest = line.substring(ASSIGN_PREFIX.length()).trim();
        if (REST.equals(rest)) {
            return Optional.empty();
        }
        int sep = rest.indexOf('|');
        if (sep < 0) {
            throw new ProtocolException("assignment without parameters: '" + line + "'");
        }
        String typeName = rest.substring(0, sep);
        TaskType type = TaskType.fromWireName(typeName)
                .orElseThrow(() -> new ProtocolException("unknown task type '" + typeName + "'"));
        Map<String, Number> params;
        try {
            params = Jsons.mapper().readValue(rest.substring(sep + 1), PARAMS);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("invalid task parameters: '" + rest.substring(sep + 1) + "'", e);
        }
        if (params == null) {
            throw new ProtocolException("invalid task parameters: null");
        }
        return Optional.of(TaskSpec.of(type, params));
    }

    /**
     * Extract the JSON payload of a status report.
     */
    public static String parseStatus(String line) {
        if (line == null || !line.startsWith(STATUS_PREFIX)) {
            throw new ProtocolException("unexpected reply to STATUS|REQUEST: '" + line + "'");
        }
        return line.substring(STATUS_PREFIX.length());
    }
}
