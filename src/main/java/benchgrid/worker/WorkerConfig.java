package benchgrid.worker;

import benchgrid.events.EventTarget;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for a node worker.
 */
public final class WorkerConfig {

    private String schedulerHost = "127.0.0.1";
    private int schedulerPort = 5000;
    private String nodeId = localHostname();
    private Duration connectTimeout = Duration.ofSeconds(5);
    // a task request can wait behind other handlers, never behind another node's task
    private Duration readTimeout = Duration.ofSeconds(30);

    private EventTarget eventTarget = null;
    private Duration eventTimeout = Duration.ofSeconds(1);

    private Path ioFilePath = null; // temp file when unset

    private WorkerConfig() {
    }

    public static WorkerConfig defaults() {
        return new WorkerConfig();
    }

    public static WorkerConfig fromEnv() {
        WorkerConfig config = new WorkerConfig();

        String host = System.getenv("BENCHGRID_SCHEDULER_HOST");
        if (host != null && !host.isBlank() && !"0.0.0.0".equals(host.trim())) {
            config.schedulerHost = host.trim();
        }

        String port = System.getenv("BENCHGRID_SCHEDULER_PORT");
        if (port != null && !port.isBlank()) {
            config.schedulerPort = Integer.parseInt(port.trim());
        }

        String nodeId = System.getenv("BENCHGRID_NODE_ID");
        if (nodeId != null && !nodeId.isBlank()) {
            config.nodeId = nodeId.trim();
        }

        String events = System.getenv("BENCHGRID_EVENTS");
        if (events != null && !events.isBlank()) {
            config.eventTarget = EventTarget.parse(events);
        }

        String ioFile = System.getenv("BENCHGRID_IO_FILE_PATH");
        if (ioFile != null && !ioFile.isBlank()) {
            config.ioFilePath = Path.of(ioFile.trim());
        }

        return config;
    }

    // Getters
    public String schedulerHost() {
        return schedulerHost;
    }

    public int schedulerPort() {
        return schedulerPort;
    }

    public String nodeId() {
        return nodeId;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration readTimeout() {
        return readTimeout;
    }

    public EventTarget eventTarget() {
        return eventTarget;
    }

    public Duration eventTimeout() {
        return eventTimeout;
    }

    public Path ioFilePath() {
        return ioFilePath;
    }

    /** Copy, used to derive per-node configs in a local cluster. */
    public WorkerConfig copy() {
        WorkerConfig c = new WorkerConfig();
        c.schedulerHost = schedulerHost;
        c.schedulerPort = schedulerPort;
        c.nodeId = nodeId;
        c.connectTimeout = connectTimeout;
        c.readTimeout = readTimeout;
        c.eventTarget = eventTarget;
        c.eventTimeout = eventTimeout;
        c.ioFilePath = ioFilePath;
        return c;
    }

    // Fluent setters
    public WorkerConfig withScheduler(String host, int port) {
        this.schedulerHost = host;
        this.schedulerPort = port;
        return this;
    }

    public WorkerConfig withNodeId(String nodeId) {
        if (nodeId == null || nodeId.isBlank() || nodeId.contains("|") || nodeId.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("node id must be a non-blank token without '|': '" + nodeId + "'");
        }
        this.nodeId = nodeId;
        return this;
    }

    public WorkerConfig withConnectTimeout(Duration timeout) {
        this.connectTimeout = timeout;
        return this;
    }

    public WorkerConfig withReadTimeout(Duration timeout) {
        this.readTimeout = timeout;
        return this;
    }

    public WorkerConfig withEventTarget(EventTarget target) {
        this.eventTarget = target;
        return this;
    }

    public WorkerConfig withEventTimeout(Duration timeout) {
        this.eventTimeout = timeout;
        return this;
    }

    public WorkerConfig withIoFilePath(Path path) {
        this.ioFilePath = path;
        return this;
    }

    private static String localHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "localhost";
        }
    }

    @Override
    public String toString() {
        return "WorkerConfig{" +
                "scheduler=" + schedulerHost + ":" + schedulerPort +
                ", nodeId='" + nodeId + '\'' +
                ", events=" + (eventTarget != null ? eventTarget : "off") +
                '}';
    }
}
