package benchgrid.protocol;

import java.util.Optional;

/**
 * A parsed node-to-scheduler message.
 *
 * <pre>
 * REGISTER|REQUEST|&lt;hostname&gt;
 * TASK|REQUEST[|&lt;node_id&gt;]
 * TASK|FINISH|&lt;duration_seconds&gt;[|&lt;node_id&gt;]
 * STATUS|REQUEST
 * </pre>
 */
public record SchedulerRequest(Kind kind, String nodeId, double durationSeconds) {

    public enum Kind {
        REGISTER,
        TASK_REQUEST,
        TASK_FINISH,
        STATUS
    }

    public static SchedulerRequest register(String hostname) {
        return new SchedulerRequest(Kind.REGISTER, hostname, 0);
    }

    public static SchedulerRequest taskRequest(String nodeId) {
        return new SchedulerRequest(Kind.TASK_REQUEST, nodeId, 0);
    }

    public static SchedulerRequest taskFinish(double durationSeconds, String nodeId) {
        return new SchedulerRequest(Kind.TASK_FINISH, nodeId, durationSeconds);
    }

    public static SchedulerRequest status() {
        return new SchedulerRequest(Kind.STATUS, null, 0);
    }

    /** Node id carried in the message, if any. */
    public Optional<String> node() {
        return Optional.ofNullable(nodeId);
    }

    /**
     * Parse one message line.
     *
     * @throws ProtocolException if the line is not a known message
     */
    public static SchedulerRequest parse(String line) {
        if (line == null) {
            throw new ProtocolException("empty message");
        }
        String[] parts = line.trim().split("\\|", -1);
        if (parts.length < 2) {
            throw new ProtocolException("invalid message: '" + line.trim() + "'");
        }

        String head = parts[0];
        String verb = parts[1];

        if ("REGISTER".equals(head) && "REQUEST".equals(verb)) {
            String hostname = field(parts, 2);
            if (hostname == null) {
                throw new ProtocolException("REGISTER without hostname");
            }
            return register(hostname);
        }
        if ("TASK".equals(head) && "REQUEST".equals(verb)) {
            return taskRequest(field(parts, 2));
        }
        if ("TASK".equals(head) && "FINISH".equals(verb)) {
            String raw = field(parts, 2);
            if (raw == null) {
                throw new ProtocolException("TASK|FINISH without duration");
            }
            double duration;
            try {
                duration = Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                throw new ProtocolException("invalid duration value: '" + raw + "'", e);
            }
            if (!Double.isFinite(duration) || duration < 0) {
                throw new ProtocolException("invalid duration value: '" + raw + "'");
            }
            return taskFinish(duration, field(parts, 3));
        }
        if ("STATUS".equals(head) && "REQUEST".equals(verb)) {
            return status();
        }
        throw new ProtocolException("unknown message: '" + line.trim() + "'");
    }

    /** Wire form of this message, without line terminator. */
    public String format() {
        return switch (kind) {
            case REGISTER -> "REGISTER|REQUEST|" + nodeId;
            case TASK_REQUEST -> nodeId == null ? "TASK|REQUEST" : "TASK|REQUEST|" + nodeId;
            case TASK_FINISH -> nodeId == null
                    ? "TASK|FINISH|" + durationSeconds
                    : "TASK|FINISH|" + durationSeconds + "|" + nodeId;
            case STATUS -> "STATUS|REQUEST";
        };
    }

    private static String field(String[] parts, int index) {
        if (index >= parts.length) {
            return null;
        }
        String value = parts[index].trim();
        return value.isEmpty() ? null : value;
    }
}
