package benchgrid.logger.server;

import benchgrid.logger.config.LoggerConfig;
import benchgrid.logger.service.QueryService;
import benchgrid.logger.service.SnapshotExporter;
import benchgrid.logger.service.SummaryReport;
import benchgrid.logger.service.TimelineStore;
import benchgrid.net.LineProtocolServer;
import benchgrid.support.PeriodicJobs;
import io.netty.channel.ChannelHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * The logger process: event ingestion server over one {@link TimelineStore}.
 * On stop it logs a summary and, unless disabled, exports a snapshot.
 */
public final class LoggerServer extends LineProtocolServer {

    private static final Logger log = LoggerFactory.getLogger(LoggerServer.class);

    private final LoggerConfig config;
    private final TimelineStore store;
    private final SnapshotExporter exporter;
    private final LoggerHandler handler;
    private PeriodicJobs jobs;
    private volatile Path lastExport;

    public LoggerServer(LoggerConfig config, TimelineStore store) {
        super("Logger", config.host(), config.port(), config.readTimeout(), config.handlerThreads());
        this.config = config;
        this.store = store;
        this.exporter = new SnapshotExporter(store, config.outputDir());
        this.handler = new LoggerHandler(store, new QueryService(store));
    }

    public static LoggerServer create(LoggerConfig config) {
        log.info("Creating logger with config: {}", config);
        return new LoggerServer(config, new TimelineStore());
    }

    @Override
    protected ChannelHandler serviceHandler() {
        return handler;
    }

    @Override
    protected void onStarted() {
        jobs = new PeriodicJobs("benchgrid-logger-export");
        jobs.schedule("Snapshot export", config.exportInterval(), this::exportQuietly);
    }

    @Override
    protected void onStopped() {
        if (jobs != null) {
            jobs.stop();
            jobs = null;
        }
        log.info(SummaryReport.render(store.summary()));
        if (config.exportOnShutdown()) {
            exportQuietly();
        }
    }

    public TimelineStore store() {
        return store;
    }

    public SnapshotExporter exporter() {
        return exporter;
    }

    /** File written by the most recent export, if any. */
    public Optional<Path> lastExport() {
        return Optional.ofNullable(lastExport);
    }

    private void exportQuietly() {
        try {
            lastExport = exporter.export();
        } catch (IOException e) {
            log.error("Snapshot export to {} failed", exporter.outputDir(), e);
        }
    }
}
