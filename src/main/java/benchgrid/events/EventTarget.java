package benchgrid.events;

/**
 * Address of a logger that lifecycle events are sent to.
 */
public record EventTarget(String host, int port) {

    public EventTarget {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("logger host is required");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("logger port out of range: " + port);
        }
    }

    /**
     * Parse {@code host:port}.
     */
    public static EventTarget parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("logger address is required");
        }
        int sep = value.lastIndexOf(':');
        if (sep <= 0 || sep == value.length() - 1) {
            throw new IllegalArgumentException("logger address must be host:port, got '" + value + "'");
        }
        try {
            return new EventTarget(value.substring(0, sep).trim(), Integer.parseInt(value.substring(sep + 1).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad logger port in '" + value + "'");
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
