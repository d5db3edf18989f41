package benchgrid.scheduler.config;

import benchgrid.catalog.TaskSets;
import benchgrid.catalog.TaskSpec;
import benchgrid.events.EventTarget;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for Scheduler settings.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Server settings
    private String host = "0.0.0.0";
    private int port = 5000;
    private String schedulerName = localHostname();
    private Duration readTimeout = Duration.ofSeconds(10);
    private int handlerThreads = 8;

    // Task settings
    private String taskSet = TaskSets.DEFAULT_SET;
    private Map<String, Number> parameterOverrides = Map.of();
    private List<TaskSpec> tasks = null; // explicit list wins over taskSet
    private PopOrder popOrder = PopOrder.LIFO;
    private boolean shuffle = true;
    private Long shuffleSeed = null;

    // Event settings
    private EventTarget eventTarget = null; // no logger unless configured
    private Duration eventTimeout = Duration.ofSeconds(1);

    private Duration progressInterval = Duration.ofSeconds(30);

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();

        String host = System.getenv("BENCHGRID_SCHEDULER_HOST");
        if (host != null && !host.isBlank()) {
            config.host = host;
        }

        String port = System.getenv("BENCHGRID_SCHEDULER_PORT");
        if (port != null && !port.isBlank()) {
            config.port = Integer.parseInt(port.trim());
        }

        String popOrder = System.getenv("BENCHGRID_POP_ORDER");
        if (popOrder != null && !popOrder.isBlank()) {
            config.popOrder = PopOrder.valueOf(popOrder.trim().toUpperCase(Locale.ROOT));
        }

        String tasks = System.getenv("BENCHGRID_TASKS");
        if (tasks != null && !tasks.isBlank()) {
            config.taskSet = tasks;
        }

        String events = System.getenv("BENCHGRID_EVENTS");
        if (events != null && !events.isBlank()) {
            config.eventTarget = EventTarget.parse(events);
        }

        return config;
    }

    // Getters
    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String schedulerName() {
        return schedulerName;
    }

    public Duration readTimeout() {
        return readTimeout;
    }

    public int handlerThreads() {
        return handlerThreads;
    }

    public PopOrder popOrder() {
        return popOrder;
    }

    public EventTarget eventTarget() {
        return eventTarget;
    }

    public Duration eventTimeout() {
        return eventTimeout;
    }

    public Duration progressInterval() {
        return progressInterval;
    }

    /**
     * The task set to seed, shuffled unless shuffling is off.
     */
    public List<TaskSpec> seedTasks() {
        List<TaskSpec> base = tasks != null ? tasks : TaskSets.parse(taskSet, parameterOverrides);
        return shuffle ? TaskSets.shuffled(base, shuffleSeed) : List.copyOf(base);
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withHost(String host) {
        this.host = host;
        return this;
    }

    public SchedulerConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public SchedulerConfig withSchedulerName(String name) {
        this.schedulerName = name;
        return this;
    }

    public SchedulerConfig withReadTimeout(Duration timeout) {
        this.readTimeout = timeout;
        return this;
    }

    public SchedulerConfig withHandlerThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("handler threads must be positive");
        }
        this.handlerThreads = threads;
        return this;
    }

    public SchedulerConfig withTaskSet(String taskSet) {
        this.taskSet = taskSet;
        this.tasks = null;
        return this;
    }

    public SchedulerConfig withParameterOverrides(Map<String, Number> overrides) {
        this.parameterOverrides = Map.copyOf(overrides);
        return this;
    }

    public SchedulerConfig withTasks(List<TaskSpec> tasks) {
        this.tasks = List.copyOf(tasks);
        return this;
    }

    public SchedulerConfig withPopOrder(PopOrder popOrder) {
        this.popOrder = popOrder;
        return this;
    }

    public SchedulerConfig withShuffle(boolean shuffle) {
        this.shuffle = shuffle;
        return this;
    }

    public SchedulerConfig withShuffleSeed(Long seed) {
        this.shuffleSeed = seed;
        return this;
    }

    public SchedulerConfig withEventTarget(EventTarget target) {
        this.eventTarget = target;
        return this;
    }

    public SchedulerConfig withEventTimeout(Duration timeout) {
        this.eventTimeout = timeout;
        return this;
    }

    public SchedulerConfig withProgressInterval(Duration interval) {
        this.progressInterval = interval;
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
        return "SchedulerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", schedulerName='" + schedulerName + '\'' +
                ", popOrder=" + popOrder +
                ", taskSet='" + (tasks != null ? tasks.size() + " explicit tasks" : taskSet) + '\'' +
                ", shuffle=" + shuffle +
                ", events=" + (eventTarget != null ? eventTarget : "off") +
                '}';
    }
}
