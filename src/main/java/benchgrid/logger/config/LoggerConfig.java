package benchgrid.logger.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the lifecycle logger.
 */
public final class LoggerConfig {

    private String host = "0.0.0.0";
    private int port = 5001;
    private Duration readTimeout = Duration.ofSeconds(5);
    private int handlerThreads = 8;

    private Path outputDir = Path.of("logs");
    private Duration exportInterval = Duration.ZERO; // periodic export off
    private boolean exportOnShutdown = true;

    private LoggerConfig() {
    }

    public static LoggerConfig defaults() {
        return new LoggerConfig();
    }

    public static LoggerConfig fromEnv() {
        LoggerConfig config = new LoggerConfig();

        String host = System.getenv("BENCHGRID_LOGGER_HOST");
        if (host != null && !host.isBlank()) {
            config.host = host.trim();
        }

        String port = System.getenv("BENCHGRID_LOGGER_PORT");
        if (port != null && !port.isBlank()) {
            config.port = Integer.parseInt(port.trim());
        }

        String dir = System.getenv("BENCHGRID_LOG_DIR");
        if (dir != null && !dir.isBlank()) {
            config.outputDir = Path.of(dir.trim());
        }

        String interval = System.getenv("BENCHGRID_EXPORT_INTERVAL_SECONDS");
        if (interval != null && !interval.isBlank()) {
            config.exportInterval = Duration.ofSeconds(Long.parseLong(interval.trim()));
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

    public Duration readTimeout() {
        return readTimeout;
    }

    public int handlerThreads() {
        return handlerThreads;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Duration exportInterval() {
        return exportInterval;
    }

    public boolean exportOnShutdown() {
        return exportOnShutdown;
    }

    // Fluent setters
    public LoggerConfig withHost(String host) {
        this.host = host;
        return this;
    }

    public LoggerConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public LoggerConfig withReadTimeout(Duration timeout) {
        this.readTimeout = timeout;
        return this;
    }

    public LoggerConfig withHandlerThreads(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("handler threads must be positive");
        }
        this.handlerThreads = threads;
        return this;
    }

    public LoggerConfig withOutputDir(Path dir) {
        this.outputDir = dir;
        return this;
    }

    public LoggerConfig withExportInterval(Duration interval) {
        this.exportInterval = interval;
        return this;
    }

    public LoggerConfig withExportOnShutdown(boolean export) {
        this.exportOnShutdown = export;
        return this;
    }

    @Override
    public String toString() {
        return "LoggerConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", outputDir=" + outputDir +
                ", exportInterval=" + exportInterval +
                ", exportOnShutdown=" + exportOnShutdown +
                '}';
    }
}
