package benchgrid.logger.service;

import benchgrid.logger.model.DurationStats;
import benchgrid.logger.model.GroupStats;
import benchgrid.logger.model.LogSummary;

import java.util.Locale;
import java.util.Map;

/**
 * Human-readable rendering of a {@link LogSummary}, logged on shutdown.
 */
public final class SummaryReport {

    private static final String RULE = "=".repeat(50);

    private SummaryReport() {
    }

    public static String render(LogSummary s) {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(RULE).append('\n');
        sb.append("LOGGER SUMMARY\n");
        sb.append(RULE).append('\n');
        sb.append("Total events: ").append(s.totalEvents()).append('\n');
        sb.append("Total tasks: ").append(s.totalTasks()).append('\n');
        if (s.orphanedFinishes() > 0) {
            sb.append("Orphaned finish events: ").append(s.orphanedFinishes()).append('\n');
        }

        sb.append("\nEvent counts:\n");
        s.eventCounts().forEach((kind, count) -> sb.append("  ").append(kind).append(": ").append(count).append('\n'));

        DurationStats d = s.durations();
        if (d.count() > 0) {
            sb.append("\nCompleted tasks: ").append(d.count()).append('\n');
            sb.append(fmt("Average task duration: %.4f seconds%n", d.mean()));
            sb.append(fmt("Min task duration: %.4f seconds%n", d.min()));
            sb.append(fmt("Max task duration: %.4f seconds%n", d.max()));
        }

        sb.append("\nTasks per node:\n");
        appendGroups(sb, s.nodes(), false);
        sb.append("\nTasks per type:\n");
        appendGroups(sb, s.taskTypes(), true);
        sb.append(RULE);
        return sb.toString();
    }

    private static void appendGroups(StringBuilder sb, Map<String, GroupStats> groups, boolean withRange) {
        groups.forEach((key, g) -> {
            sb.append("  ").append(key).append(": ").append(g.total()).append(" tasks");
            if (g.pending() > 0) {
                sb.append(", ").append(g.pending()).append(" pending");
            }
            DurationStats d = g.durations();
            if (d.count() > 0) {
                sb.append(withRange
                        ? fmt(" (avg: %.4fs, min: %.4fs, max: %.4fs)", d.mean(), d.min(), d.max())
                        : fmt(" (avg duration: %.4fs)", d.mean()));
            }
            sb.append('\n');
        });
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
