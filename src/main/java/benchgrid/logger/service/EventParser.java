package benchgrid.logger.service;

import benchgrid.events.EventKind;
import benchgrid.logger.model.LifecycleEvent;
import benchgrid.protocol.ProtocolException;

/**
 * Parses the free-form event message
 * {@code NODE <host> EVENT <kind> [TIME <seconds>] [TASK <name>]}.
 *
 * Keys may come in any order; unrecognised tokens are skipped. NODE and
 * EVENT are required, TIME defaults to the receipt time.
 */
public final class EventParser {

    private EventParser() {
    }

    public static LifecycleEvent parse(String message, double receiptTime) {
        if (message == null || message.isBlank()) {
            throw new ProtocolException("empty event message");
        }
        String[] parts = message.trim().split("\\s+");

        String node = null;
        String event = null;
        String time = null;
        String task = null;

        int i = 0;
        while (i < parts.length) {
            boolean hasValue = i + 1 < parts.length;
            switch (parts[i]) {
                case "NODE" -> {
                    if (hasValue) {
                        node = parts[++i];
                    }
                }
                case "EVENT" -> {
                    if (hasValue) {
                        event = parts[++i];
                    }
                }
                case "TIME" -> {
                    if (hasValue) {
                        time = parts[++i];
                    }
                }
                case "TASK" -> {
                    if (hasValue) {
                        task = parts[++i];
                    }
                }
                default -> {
                    // unrecognised token
                }
            }
            i++;
        }

        if (node == null || event == null) {
            throw new ProtocolException("invalid event format: '" + message.trim() + "'");
        }
        String eventName = event;
        EventKind kind = EventKind.parse(eventName)
                .orElseThrow(() -> new ProtocolException("unknown event '" + eventName + "'"));

        double at = receiptTime;
        if (time != null) {
            try {
                at = Double.parseDouble(time);
            } catch (NumberFormatException e) {
                throw new ProtocolException("invalid TIME value '" + time + "'", e);
            }
            if (!Double.isFinite(at)) {
                throw new ProtocolException("invalid TIME value '" + time + "'");
            }
        }
        return LifecycleEvent.of(node, kind, at, task);
    }
}
