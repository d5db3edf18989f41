package benchgrid.events;

import benchgrid.net.LineClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sends each event on its own short-lived connection from a background
 * thread. Events that cannot be delivered within the timeout, or that do
 * not fit the bounded backlog, are dropped and counted.
 */
public final class SocketEventEmitter implements EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(SocketEventEmitter.class);

    private static final int BACKLOG = 1024;

    private final LineClient client;
    private final ThreadPoolExecutor executor;
    private final AtomicLong sent = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public SocketEventEmitter(EventTarget target, Duration timeout) {
        this.client = new LineClient(target.host(), target.port(), timeout, timeout);
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(BACKLOG), r -> {
                    Thread t = new Thread(r, "benchgrid-events");
                    t.setDaemon(true);
                    return t;
                });
    }

    @Override
    public void emit(String node, EventKind kind, String taskName) {
        String line;
        try {
            line = EventLine.format(node, kind, EventLine.now(), taskName);
        } catch (IllegalArgumentException e) {
            dropped.incrementAndGet();
            log.warn("Dropped {} event: {}", kind, e.getMessage());
            return;
        }
        try {
            executor.execute(() -> deliver(line));
        } catch (RejectedExecutionException e) {
            dropped.incrementAndGet();
            log.debug("Dropped event, emitter backlog full or closed: {}", line);
        }
    }

    private void deliver(String line) {
        try {
            client.send(line);
            sent.incrementAndGet();
        } catch (IOException e) {
            dropped.incrementAndGet();
            log.debug("Dropped event for logger {}: {} ({})", client, line, e.getMessage());
        }
    }

    public long sentCount() {
        return sent.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Stop accepting events and give the backlog a short grace period.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                int pending = executor.shutdownNow().size();
                dropped.addAndGet(pending);
                log.warn("Event emitter closed with {} undelivered events", pending);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Event emitter for {} closed: {} sent, {} dropped", client, sent.get(), dropped.get());
    }
}
