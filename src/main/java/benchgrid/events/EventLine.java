package benchgrid.events;

import java.util.Locale;

/**
 * Wire form of a lifecycle event:
 * {@code NODE <node> EVENT <kind> TIME <seconds> [TASK <type>]}.
 */
public final class EventLine {

    private EventLine() {
    }

    public static String format(String node, EventKind kind, double timeSeconds, String taskName) {
        if (node == null || node.isBlank() || node.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("node must be a non-blank token: '" + node + "'");
        }
        StringBuilder sb = new StringBuilder()
                .append("NODE ").append(node)
                .append(" EVENT ").append(kind.name())
                .append(" TIME ").append(String.format(Locale.ROOT, "%.6f", timeSeconds));
        if (taskName != null) {
            sb.append(" TASK ").append(taskName);
        }
        return sb.toString();
    }

    /** Current wall-clock time in seconds since the epoch. */
    public static double now() {
        return System.currentTimeMillis() / 1000.0;
    }
}
