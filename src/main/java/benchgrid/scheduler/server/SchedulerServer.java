package benchgrid.scheduler.server;

import benchgrid.events.EventEmitter;
import benchgrid.net.LineProtocolServer;
import benchgrid.scheduler.config.SchedulerConfig;
import benchgrid.scheduler.model.SchedulerStatus;
import benchgrid.scheduler.service.SchedulerState;
import benchgrid.support.PeriodicJobs;
import io.netty.channel.ChannelHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The scheduler process: TCP control-plane server over one {@link SchedulerState}.
 *
 * Usage:
 *
 * <pre>
 * SchedulerServer server = SchedulerServer.create(SchedulerConfig.fromEnv());
 * server.start();
 * // ... nodes connect ...
 * server.stop();
 * </pre>
 */
public final class SchedulerServer extends LineProtocolServer {

    private static final Logger log = LoggerFactory.getLogger(SchedulerServer.class);

    private final SchedulerConfig config;
    private final SchedulerState state;
    private final EventEmitter events;
    private final SchedulerHandler handler;
    private PeriodicJobs jobs;

    public SchedulerServer(SchedulerConfig config, SchedulerState state, EventEmitter events) {
        super("Scheduler", config.host(), config.port(), config.readTimeout(), config.handlerThreads());
        this.config = config;
        this.state = state;
        this.events = events;
        this.handler = new SchedulerHandler(state, events);
    }

    /**
     * Build a server with freshly seeded state and the configured event emitter.
     */
    public static SchedulerServer create(SchedulerConfig config) {
        log.info("Creating scheduler with config: {}", config);
        SchedulerState state = new SchedulerState(config.seedTasks(), config.popOrder(), config.schedulerName());
        EventEmitter events = EventEmitter.forTarget(config.eventTarget(), config.eventTimeout());
        return new SchedulerServer(config, state, events);
    }

    @Override
    protected ChannelHandler serviceHandler() {
        return handler;
    }

    @Override
    protected void onStarted() {
        log.info("Scheduler hostname: {}", state.schedulerName());
        jobs = new PeriodicJobs("benchgrid-scheduler-progress");
        jobs.schedule("Progress report", config.progressInterval(), this::logProgress);
    }

    @Override
    protected void onStopped() {
        if (jobs != null) {
            jobs.stop();
            jobs = null;
        }
        logProgress();
        events.close();
    }

    public SchedulerState state() {
        return state;
    }

    private void logProgress() {
        SchedulerStatus s = state.status();
        log.info("Progress: {}/{} finished, {} in flight, {} waiting, {} abandoned, {} nodes",
                s.finished(), s.total(), s.inFlight(), s.waiting(), s.abandoned(), s.nodes());
    }
}
